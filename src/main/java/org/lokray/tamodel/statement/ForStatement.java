package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

/**
 * C-style {@code for (init; condition; step) body}. Missing parts are empty expressions.
 */
public class ForStatement extends Statement
{
	private final Expression init;
	private final Expression condition;
	private final Expression step;
	private final Statement body;

	public ForStatement(Expression init, Expression condition, Expression step, Statement body, Position position)
	{
		super(position);
		this.init = init;
		this.condition = condition;
		this.step = step;
		this.body = body;
	}

	public Expression getInit()
	{
		return init;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getStep()
	{
		return step;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitFor(this);
	}
}
