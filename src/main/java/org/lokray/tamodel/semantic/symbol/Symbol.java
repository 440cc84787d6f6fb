package org.lokray.tamodel.semantic.symbol;

import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.type.Type;

/**
 * A named entity declared in exactly one {@link Frame}. Identity is by instance: two
 * symbols with the same name in different frames are different symbols.
 */
public final class Symbol
{
	private final String name;
	private final Type type;
	private final Frame frame;
	private final Position position;
	private SymbolData data;

	Symbol(String name, Type type, Frame frame, Position position, SymbolData data)
	{
		this.name = name;
		this.type = type;
		this.frame = frame;
		this.position = position;
		this.data = data;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	/** The frame that declared this symbol. */
	public Frame getFrame()
	{
		return frame;
	}

	public Position getPosition()
	{
		return position;
	}

	public SymbolData getData()
	{
		return data;
	}

	/**
	 * Attaches the semantic record once it exists. Records are usually created after
	 * their symbol, e.g. a variable needs its symbol before its initializer is stored.
	 */
	public void setData(SymbolData data)
	{
		this.data = data;
	}

	public <T extends SymbolData> T getDataAs(Class<T> kind)
	{
		return kind.isInstance(data) ? kind.cast(data) : null;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
