package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

public class WhileStatement extends Statement
{
	private final Expression condition;
	private final Statement body;

	public WhileStatement(Expression condition, Statement body, Position position)
	{
		super(position);
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitWhile(this);
	}
}
