package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.expression.Expression;

/**
 * Bounded integer {@code int[lower, upper]}. Bounds are compile-time constant expressions.
 */
public class RangeType implements Type
{
	private final Expression lower;
	private final Expression upper;

	public RangeType(Expression lower, Expression upper)
	{
		this.lower = lower;
		this.upper = upper;
	}

	public Expression getLower()
	{
		return lower;
	}

	public Expression getUpper()
	{
		return upper;
	}

	@Override
	public String getName()
	{
		return "int[" + lower + "," + upper + "]";
	}

	@Override
	public boolean isIntegral()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
