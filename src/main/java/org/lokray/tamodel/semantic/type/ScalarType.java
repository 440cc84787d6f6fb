package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.expression.Expression;

/**
 * {@code scalar[n]}: an unordered set of n values, only comparable for equality and only
 * assignable within the same scalar set.
 */
public class ScalarType implements Type
{
	private final Expression size;

	public ScalarType(Expression size)
	{
		this.size = size;
	}

	public Expression getSize()
	{
		return size;
	}

	@Override
	public String getName()
	{
		return "scalar[" + size + "]";
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
