package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.semantic.symbol.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gantt chart entry: a named row, optionally expanded over select parameters, mapping
 * boolean predicates to integer colours.
 */
public class Gantt
{
	public static final class Mapping
	{
		private final Frame parameters;
		private final Expression predicate;
		private final Expression colour;

		public Mapping(Frame parameters, Expression predicate, Expression colour)
		{
			this.parameters = parameters;
			this.predicate = predicate;
			this.colour = colour;
		}

		public Frame getParameters()
		{
			return parameters;
		}

		public Expression getPredicate()
		{
			return predicate;
		}

		public Expression getColour()
		{
			return colour;
		}
	}

	private final String name;
	private final Frame parameters;
	private final List<Mapping> mappings = new ArrayList<>();

	public Gantt(String name, Frame parameters)
	{
		this.name = name;
		this.parameters = parameters;
	}

	public String getName()
	{
		return name;
	}

	public Frame getParameters()
	{
		return parameters;
	}

	public void addMapping(Mapping mapping)
	{
		mappings.add(mapping);
	}

	public List<Mapping> getMappings()
	{
		return Collections.unmodifiableList(mappings);
	}
}
