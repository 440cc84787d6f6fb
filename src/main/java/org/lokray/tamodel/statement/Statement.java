package org.lokray.tamodel.statement;

import org.lokray.tamodel.position.Position;

/**
 * A statement of a function body.
 */
public abstract class Statement
{
	private final Position position;

	protected Statement(Position position)
	{
		this.position = position;
	}

	public Position getPosition()
	{
		return position;
	}

	public abstract <R> R accept(StatementVisitor<R> visitor);

	/** True if every path through the statement ends in a return. */
	public boolean returns()
	{
		return false;
	}
}
