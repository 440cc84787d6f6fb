package org.lokray.tamodel.document;

/**
 * Elements of a scenario chart that happen simultaneously: at most one message, one
 * condition and one update at the same chart location. Elements are referenced by their
 * index in the owning template.
 */
public class SimRegion
{
	public static final int NONE = -1;

	private final int nr;
	private int message = NONE;
	private int condition = NONE;
	private int update = NONE;
	private int location;
	private boolean inPrechart;

	SimRegion(int nr)
	{
		this.nr = nr;
	}

	public int getNr()
	{
		return nr;
	}

	public int getMessage()
	{
		return message;
	}

	public int getCondition()
	{
		return condition;
	}

	public int getUpdate()
	{
		return update;
	}

	public boolean hasMessage()
	{
		return message != NONE;
	}

	public boolean hasCondition()
	{
		return condition != NONE;
	}

	public boolean hasUpdate()
	{
		return update != NONE;
	}

	void setMessage(Message m)
	{
		message = m.getNr();
		take(m);
	}

	void setCondition(Condition c)
	{
		condition = c.getNr();
		take(c);
	}

	void setUpdate(Update u)
	{
		update = u.getNr();
		take(u);
	}

	private void take(LscElement element)
	{
		location = element.getLocation();
		inPrechart = element.isInPrechart();
	}

	public int getLocation()
	{
		return location;
	}

	public boolean isInPrechart()
	{
		return inPrechart;
	}

	@Override
	public String toString()
	{
		return "s" + nr + "(m=" + message + ", c=" + condition + ", u=" + update + ")";
	}
}
