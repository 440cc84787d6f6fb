package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.tamodel.position.Position;

/**
 * Maps token indices of one parsed chunk to virtual document offsets.
 */
final class SourceRange
{
	private SourceRange()
	{
	}

	static Position of(ParserRuleContext ctx, int base)
	{
		Token start = ctx.getStart();
		Token stop = ctx.getStop();
		int from = base + Math.max(0, start.getStartIndex());
		if (stop == null || stop.getStopIndex() < start.getStartIndex())
		{
			return new Position(from, from);
		}
		return new Position(from, base + stop.getStopIndex() + 1);
	}

	static Position of(Token token, int base)
	{
		int from = base + Math.max(0, token.getStartIndex());
		return new Position(from, Math.max(from, base + token.getStopIndex() + 1));
	}

	static Position of(TerminalNode node, int base)
	{
		return of(node.getSymbol(), base);
	}
}
