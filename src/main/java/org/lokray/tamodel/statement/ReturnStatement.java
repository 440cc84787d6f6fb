package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

public class ReturnStatement extends Statement
{
	private final Expression value;

	public ReturnStatement(Expression value, Position position)
	{
		super(position);
		this.value = value == null ? Expression.EMPTY : value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public boolean returns()
	{
		return true;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitReturn(this);
	}
}
