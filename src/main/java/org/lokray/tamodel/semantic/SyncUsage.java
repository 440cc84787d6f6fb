package org.lokray.tamodel.semantic;

/**
 * How channels are used across all edges of a document.
 */
public enum SyncUsage
{
	NONE,
	BROADCAST_ONLY,
	BINARY_ONLY,
	MIXED;

	/** Joins the classification with one more synchronising edge. */
	public SyncUsage with(boolean broadcast)
	{
		SyncUsage edge = broadcast ? BROADCAST_ONLY : BINARY_ONLY;
		if (this == NONE || this == edge)
		{
			return edge;
		}
		return MIXED;
	}
}
