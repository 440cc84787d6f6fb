// File: src/main/java/org/lokray/tamodel/semantic/type/Type.java
package org.lokray.tamodel.semantic.type;

/**
 * A structural type. Qualifiers (const, meta, urgent, broadcast, reference) wrap another
 * type through {@link QualifiedType}; {@link #strip()} removes them.
 */
public interface Type
{
	String getName();

	/** The type without any qualifier wrappers. */
	default Type strip()
	{
		return this;
	}

	default boolean is(Qualifier qualifier)
	{
		return false;
	}

	default boolean isConstant()
	{
		return is(Qualifier.CONST);
	}

	default boolean isReference()
	{
		return is(Qualifier.REF);
	}

	/** int, bool and bounded integers. */
	default boolean isIntegral()
	{
		return false;
	}

	/** Integral or floating point. */
	default boolean isNumeric()
	{
		return isIntegral() || isDouble();
	}

	default boolean isBoolean()
	{
		return false;
	}

	default boolean isDouble()
	{
		return false;
	}

	default boolean isClock()
	{
		return false;
	}

	default boolean isChannel()
	{
		return false;
	}

	default boolean isVoid()
	{
		return false;
	}

	default boolean isString()
	{
		return false;
	}

	default boolean isLabel()
	{
		return false;
	}

	default boolean isScalar()
	{
		return false;
	}

	default boolean isArray()
	{
		return false;
	}

	default boolean isRecord()
	{
		return false;
	}

	default boolean isFunction()
	{
		return false;
	}

	default boolean isProcess()
	{
		return false;
	}

	default boolean isError()
	{
		return false;
	}
}
