package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A location of a template. Until the type checker has run, rate conditions such as
 * {@code x' == 0} are still part of the invariant; the checker copies them into
 * {@link #getRates()} and records the cost rate.
 */
public class Location implements SymbolData
{
	private final Symbol symbol;
	private final Expression invariant;
	private final Expression expRate;
	private final int nr;
	private boolean urgent;
	private boolean committed;
	private Expression costRate = Expression.EMPTY;
	private final List<Expression> rates = new ArrayList<>();

	Location(Symbol symbol, Expression invariant, Expression expRate, int nr)
	{
		this.symbol = symbol;
		this.invariant = invariant == null ? Expression.EMPTY : invariant;
		this.expRate = expRate == null ? Expression.EMPTY : expRate;
		this.nr = nr;
		symbol.setData(this);
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	public String getName()
	{
		return symbol.getName();
	}

	public Expression getInvariant()
	{
		return invariant;
	}

	/** Exponential rate used when leaving the location in stochastic semantics. */
	public Expression getExpRate()
	{
		return expRate;
	}

	public Expression getCostRate()
	{
		return costRate;
	}

	public void setCostRate(Expression costRate)
	{
		this.costRate = costRate;
	}

	/** Rate conditions {@code x' == e} found in the invariant. */
	public List<Expression> getRates()
	{
		return Collections.unmodifiableList(rates);
	}

	public void addRate(Expression rate)
	{
		rates.add(rate);
	}

	/** Position of the location in its template. */
	public int getNr()
	{
		return nr;
	}

	public boolean isUrgent()
	{
		return urgent;
	}

	public void setUrgent(boolean urgent)
	{
		this.urgent = urgent;
	}

	public boolean isCommitted()
	{
		return committed;
	}

	public void setCommitted(boolean committed)
	{
		this.committed = committed;
	}

	@Override
	public String toString()
	{
		return symbol.getName() + (invariant.isEmpty() ? "" : " {" + invariant + "}");
	}
}
