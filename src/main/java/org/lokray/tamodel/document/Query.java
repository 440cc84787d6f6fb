package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A property to verify, with its source text and per-query options.
 */
public class Query
{
	private final Expression formula;
	private final String text;
	private final String comment;
	private final List<Option> options = new ArrayList<>();

	public Query(Expression formula, String text, String comment)
	{
		this.formula = formula;
		this.text = text;
		this.comment = comment == null ? "" : comment;
	}

	public Expression getFormula()
	{
		return formula;
	}

	public String getText()
	{
		return text;
	}

	public String getComment()
	{
		return comment;
	}

	public List<Option> getOptions()
	{
		return Collections.unmodifiableList(options);
	}

	public void addOption(Option option)
	{
		options.add(option);
	}

	@Override
	public String toString()
	{
		return text;
	}
}
