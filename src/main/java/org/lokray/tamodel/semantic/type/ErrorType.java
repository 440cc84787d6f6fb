// File: src/main/java/org/lokray/tamodel/semantic/type/ErrorType.java
package org.lokray.tamodel.semantic.type;

/**
 * Placeholder written onto a node whose type rule failed. Every rule accepts it silently
 * so one mistake is reported once.
 */
public class ErrorType implements Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
	}

	@Override
	public String getName()
	{
		return "<error>";
	}

	@Override
	public boolean isError()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
