package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;

/**
 * Common shape of the elements of a scenario chart: a vertical location on the chart, the
 * part of the chart it belongs to and an optional label expression.
 */
public abstract class LscElement
{
	private final int nr;
	private final int location;
	private final boolean inPrechart;
	private Expression label = Expression.EMPTY;

	protected LscElement(int nr, int location, boolean inPrechart)
	{
		this.nr = nr;
		this.location = location;
		this.inPrechart = inPrechart;
	}

	/** Index in the owning template's list of elements of the same kind. */
	public int getNr()
	{
		return nr;
	}

	/** Vertical location on the chart; smaller is earlier. */
	public int getLocation()
	{
		return location;
	}

	public boolean isInPrechart()
	{
		return inPrechart;
	}

	public Expression getLabel()
	{
		return label;
	}

	public void setLabel(Expression label)
	{
		this.label = label == null ? Expression.EMPTY : label;
	}
}
