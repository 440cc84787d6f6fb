package org.lokray.tamodel.util;

import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.PositionIndex;
import org.lokray.tamodel.position.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only sink for errors and warnings of one document. Lists only shrink when a
 * caller explicitly clears them.
 */
public class ErrorHandler
{
	private final PositionIndex positions;
	private final List<Diagnostic> errors = new ArrayList<>();
	private final List<Diagnostic> warnings = new ArrayList<>();

	public ErrorHandler(PositionIndex positions)
	{
		this.positions = positions;
	}

	public Diagnostic logError(Position position, ErrorKind kind, String msg, String context)
	{
		Diagnostic diagnostic = create(position, kind, msg, context);
		errors.add(diagnostic);
		String label = kind == ErrorKind.SYNTAX ? "Syntax Error" : "Semantic Error";
		Debug.logError(String.format("[%s] %s - %s", label, diagnostic.getStart(), format(diagnostic)));
		return diagnostic;
	}

	public Diagnostic logWarning(Position position, String msg, String context)
	{
		Diagnostic diagnostic = create(position, ErrorKind.GENERAL, msg, context);
		warnings.add(diagnostic);
		Debug.logWarning(String.format("[Semantic Warning] %s - %s", diagnostic.getStart(), format(diagnostic)));
		return diagnostic;
	}

	private Diagnostic create(Position position, ErrorKind kind, String msg, String context)
	{
		SourceLocation start = positions.locate(position.getStart());
		SourceLocation end = positions.locate(position.getEnd());
		return new Diagnostic(kind, start, end, msg, context);
	}

	private static String format(Diagnostic diagnostic)
	{
		return diagnostic.getContext().isEmpty()
				? diagnostic.getMessage()
				: diagnostic.getMessage() + " '" + diagnostic.getContext() + "'";
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean hasWarnings()
	{
		return !warnings.isEmpty();
	}

	public List<Diagnostic> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<Diagnostic> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	public void clearErrors()
	{
		errors.clear();
	}

	public void clearWarnings()
	{
		warnings.clear();
	}
}
