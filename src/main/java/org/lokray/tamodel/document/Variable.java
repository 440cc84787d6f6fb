package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

/**
 * A variable, clock or channel declaration. The symbol's data points back to this record.
 */
public class Variable implements SymbolData
{
	private final Symbol symbol;
	private final Expression initializer;

	public Variable(Symbol symbol, Expression initializer)
	{
		this.symbol = symbol;
		this.initializer = initializer == null ? Expression.EMPTY : initializer;
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

	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean hasInitializer()
	{
		return !initializer.isEmpty();
	}

	@Override
	public String toString()
	{
		return symbol.getType() + " " + symbol.getName() + (hasInitializer() ? " = " + initializer : "") + ";";
	}
}
