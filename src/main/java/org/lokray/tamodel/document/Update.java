package org.lokray.tamodel.document;

public class Update extends LscElement
{
	private final int anchor;

	Update(int nr, int location, boolean inPrechart, int anchor)
	{
		super(nr, location, inPrechart);
		this.anchor = anchor;
	}

	/** Index of the instance line the update is attached to. */
	public int getAnchor()
	{
		return anchor;
	}
}
