// File: src/main/java/org/lokray/tamodel/semantic/type/RecordType.java
package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code struct { ... }}: named fields in declaration order. The fields live in their own
 * parentless frame so member access resolves only field names.
 */
public class RecordType implements Type
{
	private final Frame fields;

	public RecordType(Frame fields)
	{
		this.fields = fields;
	}

	public Frame getFields()
	{
		return fields;
	}

	public Optional<Symbol> getField(String name)
	{
		return fields.resolveLocally(name);
	}

	public int getFieldCount()
	{
		return fields.size();
	}

	@Override
	public String getName()
	{
		return "struct { " + fields.getSymbols().stream()
				.map(f -> f.getType().getName() + " " + f.getName() + ";")
				.collect(Collectors.joining(" ")) + " }";
	}

	@Override
	public boolean isRecord()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
