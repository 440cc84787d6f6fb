package org.lokray.tamodel.statement;

import org.lokray.tamodel.position.Position;

public class EmptyStatement extends Statement
{
	public EmptyStatement(Position position)
	{
		super(position);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitEmpty(this);
	}
}
