package org.lokray.tamodel.semantic.symbol;

/**
 * Semantic payload attached to a {@link Symbol}: the variable, location, branchpoint,
 * function, instance or typedef record the symbol names.
 */
public interface SymbolData
{
}
