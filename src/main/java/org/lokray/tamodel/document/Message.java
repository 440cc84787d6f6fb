package org.lokray.tamodel.document;

/**
 * A message arrow between two instance lines.
 */
public class Message extends LscElement
{
	private final int source;
	private final int destination;

	Message(int nr, int location, boolean inPrechart, int source, int destination)
	{
		super(nr, location, inPrechart);
		this.source = source;
		this.destination = destination;
	}

	/** Index of the sending instance line. */
	public int getSource()
	{
		return source;
	}

	/** Index of the receiving instance line. */
	public int getDestination()
	{
		return destination;
	}
}
