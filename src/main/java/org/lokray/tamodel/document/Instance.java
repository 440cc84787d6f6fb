// File: src/main/java/org/lokray/tamodel/document/Instance.java
package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A possibly partial binding of a template's parameters. Every template is a fully unbound
 * instance of itself; a process is an instance without unbound parameters.
 * <p>
 * Chained instantiations are flattened: {@link #getParameters()} holds both the unbound
 * parameters (first) and the parameters bound by this or an earlier step (after them), so
 * {@code getUnbound() + getBound() == getParameters().size()} always holds. The mapping
 * binds parameter symbols to argument expressions.
 * <p>
 * Restricted parameters are those an array size depends on, directly or through the
 * initializer of a constant. Arguments given for them must be compile-time constants.
 */
public class Instance implements SymbolData
{
	private Symbol symbol;
	private final Frame parameters;
	private final Map<Symbol, Expression> mapping = new LinkedHashMap<>();
	private final Set<Symbol> restricted = new LinkedHashSet<>();
	private final Template template;
	private final Position position;
	private int arguments;
	private int unbound;

	Instance(Frame parameters, int unbound, Template template, Position position)
	{
		this.parameters = parameters;
		this.unbound = unbound;
		this.template = template;
		this.position = position;
	}

	void attach(Symbol symbol)
	{
		this.symbol = symbol;
		symbol.setData(this);
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	public String getName()
	{
		return symbol == null ? "<anonymous>" : symbol.getName();
	}

	public Frame getParameters()
	{
		return parameters;
	}

	public Map<Symbol, Expression> getMapping()
	{
		return Collections.unmodifiableMap(mapping);
	}

	void bind(Symbol parameter, Expression argument)
	{
		mapping.put(parameter, argument);
	}

	void inheritMapping(Instance other)
	{
		mapping.putAll(other.mapping);
	}

	public Expression getArgument(Symbol parameter)
	{
		return mapping.get(parameter);
	}

	public boolean isBound(Symbol parameter)
	{
		return mapping.containsKey(parameter);
	}

	/** Number of arguments supplied by the instantiation step that created this instance. */
	public int getArguments()
	{
		return arguments;
	}

	void setArguments(int arguments)
	{
		this.arguments = arguments;
	}

	public int getUnbound()
	{
		return unbound;
	}

	void setUnbound(int unbound)
	{
		this.unbound = unbound;
	}

	public int getBound()
	{
		return mapping.size();
	}

	public boolean isComplete()
	{
		return unbound == 0;
	}

	/** The still-unbound parameters, in positional order. */
	public List<Symbol> getUnboundParameters()
	{
		return parameters.getSymbols().subList(0, unbound);
	}

	public Template getTemplate()
	{
		return template;
	}

	public Set<Symbol> getRestricted()
	{
		return Collections.unmodifiableSet(restricted);
	}

	public boolean isRestricted(Symbol parameter)
	{
		return restricted.contains(parameter);
	}

	public void addRestricted(Symbol parameter)
	{
		restricted.add(parameter);
	}

	public Position getPosition()
	{
		return position;
	}

	public String mappingString()
	{
		return mapping.entrySet().stream()
				.map(e -> e.getKey().getName() + " = " + e.getValue())
				.collect(Collectors.joining(", "));
	}

	public String argumentsString()
	{
		return parameters.getSymbols().subList(unbound, unbound + arguments).stream()
				.map(s -> String.valueOf(mapping.get(s)))
				.collect(Collectors.joining(", "));
	}

	@Override
	public String toString()
	{
		return getName() + getUnboundParameters().stream()
				.map(s -> s.getType().getName() + " " + s.getName())
				.collect(Collectors.joining(", ", "(", ")"));
	}
}
