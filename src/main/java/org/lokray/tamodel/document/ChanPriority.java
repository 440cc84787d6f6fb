package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code chan priority} declaration: channels listed from lowest to highest priority.
 * A ',' separator keeps the level, '<' raises it. The {@code default} entry is the
 * empty expression.
 */
public class ChanPriority
{
	public static final class Entry
	{
		private final char separator;
		private final Expression channel;

		Entry(char separator, Expression channel)
		{
			this.separator = separator;
			this.channel = channel;
		}

		public char getSeparator()
		{
			return separator;
		}

		public Expression getChannel()
		{
			return channel;
		}

		public boolean isDefault()
		{
			return channel.isEmpty();
		}
	}

	private final Expression head;
	private final List<Entry> tail = new ArrayList<>();
	private final Position position;

	public ChanPriority(Expression head, Position position)
	{
		this.head = head;
		this.position = position;
	}

	public Expression getHead()
	{
		return head;
	}

	public List<Entry> getTail()
	{
		return Collections.unmodifiableList(tail);
	}

	public void add(char separator, Expression channel)
	{
		if (separator != ',' && separator != '<')
		{
			throw new IllegalArgumentException("Unknown priority separator '" + separator + "'");
		}
		tail.add(new Entry(separator, channel));
	}

	public Position getPosition()
	{
		return position;
	}

	/** All listed channels including the head, in source order. */
	public List<Expression> getChannels()
	{
		List<Expression> result = new ArrayList<>();
		result.add(head);
		tail.forEach(e -> result.add(e.getChannel()));
		return result;
	}

	@Override
	public String toString()
	{
		StringBuilder result = new StringBuilder("chan priority ").append(head.isEmpty() ? "default" : head);
		for (Entry e : tail)
		{
			result.append(e.separator == ',' ? ", " : " < ").append(e.isDefault() ? "default" : e.channel);
		}
		return result.append(';').toString();
	}
}
