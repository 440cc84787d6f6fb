package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

public class DoWhileStatement extends Statement
{
	private final Statement body;
	private final Expression condition;

	public DoWhileStatement(Statement body, Expression condition, Position position)
	{
		super(position);
		this.body = body;
		this.condition = condition;
	}

	public Statement getBody()
	{
		return body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	@Override
	public boolean returns()
	{
		return body.returns();
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDoWhile(this);
	}
}
