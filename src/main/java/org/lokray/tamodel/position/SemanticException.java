package org.lokray.tamodel.position;

/**
 * Raised by low-level model operations (declaring a symbol, binding instance arguments,
 * folding an array size). Builders and the type checker turn it into a recorded
 * {@link Diagnostic} and carry on.
 */
public class SemanticException extends RuntimeException
{
	private final ErrorKind kind;

	public SemanticException(ErrorKind kind, String message)
	{
		super(message);
		this.kind = kind;
	}

	public ErrorKind getKind()
	{
		return kind;
	}
}
