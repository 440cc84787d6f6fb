package org.lokray.tamodel.semantic.type;

import java.util.Objects;

/**
 * Wraps a type with one qualifier. Stacked qualifiers are nested wrappers.
 */
public class QualifiedType implements Type
{
	private final Qualifier qualifier;
	private final Type inner;

	private QualifiedType(Qualifier qualifier, Type inner)
	{
		this.qualifier = qualifier;
		this.inner = inner;
	}

	/** Adds a qualifier unless the type already carries it. */
	public static Type of(Qualifier qualifier, Type inner)
	{
		if (inner.is(qualifier) || inner.isError())
		{
			return inner;
		}
		return new QualifiedType(qualifier, inner);
	}

	public Qualifier getQualifier()
	{
		return qualifier;
	}

	public Type getInner()
	{
		return inner;
	}

	@Override
	public String getName()
	{
		return qualifier == Qualifier.REF ? inner.getName() + "&" : qualifier.getKeyword() + " " + inner.getName();
	}

	@Override
	public Type strip()
	{
		return inner.strip();
	}

	@Override
	public boolean is(Qualifier q)
	{
		return qualifier == q || inner.is(q);
	}

	@Override
	public boolean isIntegral()
	{
		return inner.isIntegral();
	}

	@Override
	public boolean isBoolean()
	{
		return inner.isBoolean();
	}

	@Override
	public boolean isDouble()
	{
		return inner.isDouble();
	}

	@Override
	public boolean isClock()
	{
		return inner.isClock();
	}

	@Override
	public boolean isChannel()
	{
		return inner.isChannel();
	}

	@Override
	public boolean isVoid()
	{
		return inner.isVoid();
	}

	@Override
	public boolean isString()
	{
		return inner.isString();
	}

	@Override
	public boolean isLabel()
	{
		return inner.isLabel();
	}

	@Override
	public boolean isScalar()
	{
		return inner.isScalar();
	}

	@Override
	public boolean isArray()
	{
		return inner.isArray();
	}

	@Override
	public boolean isRecord()
	{
		return inner.isRecord();
	}

	@Override
	public boolean isFunction()
	{
		return inner.isFunction();
	}

	@Override
	public boolean isProcess()
	{
		return inner.isProcess();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		QualifiedType that = (QualifiedType) o;
		return qualifier == that.qualifier && Objects.equals(inner, that.inner);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(qualifier, inner);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
