package org.lokray.tamodel.statement;

import org.lokray.tamodel.document.Variable;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A braced block with its own frame for local declarations.
 */
public class BlockStatement extends Statement
{
	private final Frame frame;
	private final List<Variable> variables = new ArrayList<>();
	private final List<Statement> statements = new ArrayList<>();

	public BlockStatement(Frame frame, Position position)
	{
		super(position);
		this.frame = frame;
	}

	public Frame getFrame()
	{
		return frame;
	}

	public void addVariable(Variable variable)
	{
		variables.add(variable);
	}

	public List<Variable> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	public void add(Statement statement)
	{
		statements.add(statement);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	@Override
	public boolean returns()
	{
		return !statements.isEmpty() && statements.get(statements.size() - 1).returns();
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitBlock(this);
	}
}
