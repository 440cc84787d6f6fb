package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;

/**
 * {@code progress { guard : measure; }}. The guard is empty when the measure always applies.
 */
public class ProgressMeasure
{
	private final Expression guard;
	private final Expression measure;

	public ProgressMeasure(Expression guard, Expression measure)
	{
		this.guard = guard == null ? Expression.EMPTY : guard;
		this.measure = measure;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public Expression getMeasure()
	{
		return measure;
	}
}
