package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

public class IfStatement extends Statement
{
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch;

	public IfStatement(Expression condition, Statement thenBranch, Statement elseBranch, Position position)
	{
		super(position);
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThen()
	{
		return thenBranch;
	}

	/** May be null. */
	public Statement getElse()
	{
		return elseBranch;
	}

	@Override
	public boolean returns()
	{
		return elseBranch != null && thenBranch.returns() && elseBranch.returns();
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitIf(this);
	}
}
