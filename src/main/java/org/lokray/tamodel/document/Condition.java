package org.lokray.tamodel.document;

import java.util.List;

/**
 * A condition spanning one or more instance lines. Hot conditions must hold, cold ones
 * only end the scenario when violated.
 */
public class Condition extends LscElement
{
	private final List<Integer> anchors;
	private final boolean hot;

	Condition(int nr, int location, boolean inPrechart, List<Integer> anchors, boolean hot)
	{
		super(nr, location, inPrechart);
		this.anchors = List.copyOf(anchors);
		this.hot = hot;
	}

	/** Indices of the instance lines the condition is attached to. */
	public List<Integer> getAnchors()
	{
		return anchors;
	}

	public boolean isHot()
	{
		return hot;
	}
}
