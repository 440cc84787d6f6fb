// File: src/main/java/org/lokray/tamodel/semantic/type/PrimitiveType.java
package org.lokray.tamodel.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType("int");
	public static final PrimitiveType BOOL = new PrimitiveType("bool");
	public static final PrimitiveType DOUBLE = new PrimitiveType("double");
	public static final PrimitiveType CLOCK = new PrimitiveType("clock");
	public static final PrimitiveType CHANNEL = new PrimitiveType("chan");
	public static final PrimitiveType VOID = new PrimitiveType("void");
	public static final PrimitiveType STRING = new PrimitiveType("string");
	// Locations and branchpoints; usable as state predicates in queries.
	public static final PrimitiveType LABEL = new PrimitiveType("label");

	// Keywords the builtin frame declares as type names
	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new LinkedHashMap<>();
		map.put("int", INT);
		map.put("bool", BOOL);
		map.put("double", DOUBLE);
		map.put("clock", CLOCK);
		map.put("chan", CHANNEL);
		map.put("void", VOID);
		map.put("string", STRING);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	public static Map<String, PrimitiveType> getAllPrimitiveKeywords()
	{
		return KEYWORD_TO_TYPE_MAP;
	}

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean isIntegral()
	{
		return this == INT || this == BOOL;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOL;
	}

	@Override
	public boolean isDouble()
	{
		return this == DOUBLE;
	}

	@Override
	public boolean isClock()
	{
		return this == CLOCK;
	}

	@Override
	public boolean isChannel()
	{
		return this == CHANNEL;
	}

	@Override
	public boolean isVoid()
	{
		return this == VOID;
	}

	@Override
	public boolean isString()
	{
		return this == STRING;
	}

	@Override
	public boolean isLabel()
	{
		return this == LABEL;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
