package org.lokray.tamodel.semantic;

/**
 * Analysis methods a downstream engine may apply to a checked document.
 */
public final class SupportedMethods
{
	private final boolean symbolic;
	private final boolean stochastic;
	private final boolean concrete;

	public SupportedMethods(boolean symbolic, boolean stochastic, boolean concrete)
	{
		this.symbolic = symbolic;
		this.stochastic = stochastic;
		this.concrete = concrete;
	}

	/** Zone based exploration; unavailable once processes are spawned at run time. */
	public boolean isSymbolic()
	{
		return symbolic;
	}

	/** Statistical simulation; unavailable with clock guards on broadcast receivers. */
	public boolean isStochastic()
	{
		return stochastic;
	}

	/** Concrete state exploration; unavailable with strict invariants. */
	public boolean isConcrete()
	{
		return concrete;
	}

	@Override
	public String toString()
	{
		return "symbolic=" + symbolic + ", stochastic=" + stochastic + ", concrete=" + concrete;
	}
}
