package org.lokray.tamodel.position;

/**
 * A single error or warning tied back to its source.
 */
public final class Diagnostic
{
	private final ErrorKind kind;
	private final SourceLocation start;
	private final SourceLocation end;
	private final String message;
	private final String context;

	public Diagnostic(ErrorKind kind, SourceLocation start, SourceLocation end, String message, String context)
	{
		this.kind = kind;
		this.start = start;
		this.end = end;
		this.message = message;
		this.context = context == null ? "" : context;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public SourceLocation getStart()
	{
		return start;
	}

	public SourceLocation getEnd()
	{
		return end;
	}

	public String getMessage()
	{
		return message;
	}

	/** The offending source text, if known. */
	public String getContext()
	{
		return context;
	}

	/** File the diagnostic starts in. */
	public String getFile()
	{
		return start.getPath();
	}

	/** Element path the diagnostic starts in; null unless the source is structured. */
	public String getPath()
	{
		return start.getStructuralPath();
	}

	@Override
	public String toString()
	{
		String ctx = context.isEmpty() ? "" : " (" + context + ")";
		return start + " - " + message + ctx;
	}
}
