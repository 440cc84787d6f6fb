package org.lokray.tamodel.position;

import java.util.Objects;

/**
 * A range of virtual offsets into the concatenated input of a document.
 * Offsets are translated back to file, line and column by the {@link PositionIndex}.
 */
public final class Position
{
	public static final int UNKNOWN_OFFSET = Integer.MAX_VALUE;
	public static final Position UNKNOWN = new Position(UNKNOWN_OFFSET, UNKNOWN_OFFSET);

	private final int start;
	private final int end;

	public Position(int start, int end)
	{
		if (end < start)
		{
			throw new IllegalArgumentException("Position end " + end + " precedes start " + start);
		}
		this.start = start;
		this.end = end;
	}

	public int getStart()
	{
		return start;
	}

	public int getEnd()
	{
		return end;
	}

	public boolean isKnown()
	{
		return start != UNKNOWN_OFFSET;
	}

	/**
	 * @return the smallest range covering both positions, ignoring unknown ones.
	 */
	public Position join(Position other)
	{
		if (!other.isKnown())
		{
			return this;
		}
		if (!isKnown())
		{
			return other;
		}
		return new Position(Math.min(start, other.start), Math.max(end, other.end));
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Position position = (Position) o;
		return start == position.start && end == position.end;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(start, end);
	}

	@Override
	public String toString()
	{
		return isKnown() ? "[" + start + ", " + end + ")" : "[unknown]";
	}
}
