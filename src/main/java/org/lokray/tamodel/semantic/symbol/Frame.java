// File: src/main/java/org/lokray/tamodel/semantic/symbol/Frame.java
package org.lokray.tamodel.semantic.symbol;

import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A lexical scope: an ordered list of symbols plus an optional parent frame. Frames form
 * a forest rooted at the builtin frame. Equality is by identity.
 */
public class Frame
{
	private final Frame parent;
	private final List<Symbol> symbols = new ArrayList<>();
	private final Map<String, Symbol> byName = new HashMap<>();

	private Frame(Frame parent)
	{
		this.parent = parent;
	}

	public static Frame createRoot()
	{
		return new Frame(null);
	}

	/** Creates a new frame nested in this one. */
	public Frame child()
	{
		return new Frame(this);
	}

	public Symbol declare(String name, Type type, Position position)
	{
		return declare(name, type, position, null);
	}

	/**
	 * Declares a new symbol in this frame. Shadowing a name of an ancestor frame is allowed;
	 * redeclaring a name of this very frame is not.
	 *
	 * @throws SemanticException with {@link ErrorKind#DUPLICATE_SYMBOL}
	 */
	public Symbol declare(String name, Type type, Position position, SymbolData data)
	{
		if (byName.containsKey(name))
		{
			throw new SemanticException(ErrorKind.DUPLICATE_SYMBOL, "Duplicate definition of '" + name + "'");
		}
		Symbol symbol = new Symbol(name, type, this, position, data);
		symbols.add(symbol);
		byName.put(name, symbol);
		return symbol;
	}

	/**
	 * Adds a symbol declared elsewhere, e.g. the inherited parameters of a partial instance.
	 * The symbol keeps its declaring frame. If the name is already visible here, the
	 * existing symbol keeps winning lookups.
	 */
	public void include(Symbol symbol)
	{
		symbols.add(symbol);
		byName.putIfAbsent(symbol.getName(), symbol);
	}

	public void includeAll(Frame other)
	{
		other.symbols.forEach(this::include);
	}

	public Optional<Symbol> resolve(String name)
	{
		Optional<Symbol> local = resolveLocally(name);
		if (local.isPresent())
		{
			return local;
		}
		if (parent != null)
		{
			return parent.resolve(name);
		}
		return Optional.empty();
	}

	public Optional<Symbol> resolveLocally(String name)
	{
		return Optional.ofNullable(byName.get(name));
	}

	public boolean contains(Symbol symbol)
	{
		return symbols.contains(symbol);
	}

	public int indexOf(Symbol symbol)
	{
		return symbols.indexOf(symbol);
	}

	public Symbol get(int index)
	{
		return symbols.get(index);
	}

	public int size()
	{
		return symbols.size();
	}

	public boolean isEmpty()
	{
		return symbols.isEmpty();
	}

	public List<Symbol> getSymbols()
	{
		return Collections.unmodifiableList(symbols);
	}

	public Frame getParent()
	{
		return parent;
	}

	public boolean hasParent()
	{
		return parent != null;
	}

	/** @return true if {@code ancestor} is this frame or one of its parents. */
	public boolean isWithin(Frame ancestor)
	{
		for (Frame f = this; f != null; f = f.parent)
		{
			if (f == ancestor)
			{
				return true;
			}
		}
		return false;
	}

	public void forEachSymbol(Consumer<Symbol> visitor)
	{
		symbols.forEach(visitor);
	}

	@Override
	public String toString()
	{
		StringBuilder result = new StringBuilder("(");
		for (int i = 0; i < symbols.size(); i++)
		{
			if (i > 0)
			{
				result.append(", ");
			}
			Symbol s = symbols.get(i);
			result.append(s.getType()).append(' ').append(s.getName());
		}
		return result.append(')').toString();
	}
}
