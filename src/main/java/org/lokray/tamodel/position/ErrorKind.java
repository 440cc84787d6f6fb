package org.lokray.tamodel.position;

public enum ErrorKind
{
	DUPLICATE_SYMBOL,
	UNDECLARED_SYMBOL,
	TYPE_MISMATCH,
	ARITY_MISMATCH,
	INVALID_ARRAY_SIZE,
	RESTRICTED_PARAMETER_VIOLATION,
	TOO_MANY_ARGUMENTS,
	UNRESOLVED_EXTERNAL_FUNCTION,
	// Reported by the grammar layer, never by the checker.
	SYNTAX,
	GENERAL
}
