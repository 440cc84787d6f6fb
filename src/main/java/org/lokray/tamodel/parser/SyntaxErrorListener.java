package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;

/**
 * Routes lexer and parser errors into the document's diagnostics, positioned at the
 * offending token.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final Document document;
	private final int base;
	private final int[] lineStarts;
	private int errorCount;

	public SyntaxErrorListener(Document document, int base, int[] lineStarts)
	{
		this.document = document;
		this.base = base;
		this.lineStarts = lineStarts;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		errorCount++;
		int offset;
		String context = "";
		if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0)
		{
			offset = token.getStartIndex();
			context = token.getType() == Token.EOF ? "<EOF>" : token.getText();
		}
		else
		{
			int lineIndex = Math.min(Math.max(line - 1, 0), lineStarts.length - 1);
			offset = lineStarts[lineIndex] + Math.max(charPositionInLine, 0);
		}
		Position position = new Position(base + offset, base + offset);
		document.addError(position, ErrorKind.SYNTAX, msg, context);
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	public boolean hasErrors()
	{
		return errorCount > 0;
	}
}
