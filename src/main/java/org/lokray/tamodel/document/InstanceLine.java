package org.lokray.tamodel.document;

import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

/**
 * A vertical line of a scenario chart. It stands for a process of the system and shares
 * that process's parameter binding.
 */
public class InstanceLine implements SymbolData
{
	private final Symbol symbol;
	private final int nr;
	private final Instance instance;

	InstanceLine(Symbol symbol, int nr, Instance instance)
	{
		this.symbol = symbol;
		this.nr = nr;
		this.instance = instance;
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

	public int getNr()
	{
		return nr;
	}

	/** The process this line represents; null if the line is not bound to one. */
	public Instance getInstance()
	{
		return instance;
	}
}
