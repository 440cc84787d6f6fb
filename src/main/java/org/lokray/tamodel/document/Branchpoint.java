package org.lokray.tamodel.document;

import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

/**
 * Joins edges sharing source, guard and synchronisation; the outgoing edges carry the
 * probabilistic weights.
 */
public class Branchpoint implements SymbolData
{
	private final Symbol symbol;
	private final int nr;

	Branchpoint(Symbol symbol, int nr)
	{
		this.symbol = symbol;
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

	/** Index in the owning template's branchpoint list. */
	public int getNr()
	{
		return nr;
	}
}
