package org.lokray.tamodel.document;

/**
 * A {@code name=value} engine option attached to a document or to a query.
 */
public final class Option
{
	private final String name;
	private final String value;

	public Option(String name, String value)
	{
		this.name = name;
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return name + "=" + value;
	}
}
