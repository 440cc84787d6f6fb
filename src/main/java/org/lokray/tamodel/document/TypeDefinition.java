package org.lokray.tamodel.document;

import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

/**
 * Marks a symbol as a type name introduced by {@code typedef}. The symbol's type is the
 * aliased type.
 */
public class TypeDefinition implements SymbolData
{
	private final Symbol symbol;

	public TypeDefinition(Symbol symbol)
	{
		this.symbol = symbol;
		symbol.setData(this);
	}

	public Symbol getSymbol()
	{
		return symbol;
	}
}
