// File: src/main/java/org/lokray/tamodel/semantic/Capabilities.java
package org.lokray.tamodel.semantic;

/**
 * Document-wide facts collected during the type check. The checker owns one instance per
 * run, fills it while visiting and hands it back as its result; nothing else writes to it.
 */
public class Capabilities
{
	private boolean urgentTransition;
	private boolean strictInvariant;
	private boolean stopWatch;
	private boolean clockGuardRecvBroadcast;
	private boolean priorityDeclaration;
	private boolean dynamicTemplates;
	private SyncUsage syncUsage = SyncUsage.NONE;

	/** An edge synchronises on an urgent channel. */
	public boolean hasUrgentTransition()
	{
		return urgentTransition;
	}

	/** An invariant compares a clock with {@code <} or {@code >}. */
	public boolean hasStrictInvariants()
	{
		return strictInvariant;
	}

	/** A clock rate may be zero, i.e. a clock can be stopped. */
	public boolean hasStopWatch()
	{
		return stopWatch;
	}

	/** An edge receiving on a broadcast channel has a clock guard. */
	public boolean hasClockGuardRecvBroadcast()
	{
		return clockGuardRecvBroadcast;
	}

	public boolean hasPriorityDeclaration()
	{
		return priorityDeclaration;
	}

	public boolean hasDynamicTemplates()
	{
		return dynamicTemplates;
	}

	public SyncUsage getSyncUsage()
	{
		return syncUsage;
	}

	void recordUrgentTransition()
	{
		urgentTransition = true;
	}

	void recordStrictInvariant()
	{
		strictInvariant = true;
	}

	void recordStopWatch()
	{
		stopWatch = true;
	}

	void recordClockGuardRecvBroadcast()
	{
		clockGuardRecvBroadcast = true;
	}

	void recordPriorityDeclaration()
	{
		priorityDeclaration = true;
	}

	void recordDynamicTemplates()
	{
		dynamicTemplates = true;
	}

	void recordSync(boolean broadcast)
	{
		syncUsage = syncUsage.with(broadcast);
	}

	public SupportedMethods getSupportedMethods()
	{
		return new SupportedMethods(!dynamicTemplates, !clockGuardRecvBroadcast, !strictInvariant);
	}

	@Override
	public String toString()
	{
		return "urgent=" + urgentTransition + ", strictInvariant=" + strictInvariant + ", stopWatch=" + stopWatch
				+ ", clockGuardRecvBroadcast=" + clockGuardRecvBroadcast + ", priorities=" + priorityDeclaration
				+ ", sync=" + syncUsage;
	}
}
