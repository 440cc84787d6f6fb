// File: src/main/java/org/lokray/tamodel/semantic/type/ArrayType.java
package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.expression.Expression;

/**
 * Fixed-size array {@code element[size]}. The size expression must fold to a non-negative
 * integer constant, possibly only once the template parameters it mentions are bound.
 */
public class ArrayType implements Type
{
	private final Type elementType;
	private final Expression size;

	public ArrayType(Type elementType, Expression size)
	{
		if (elementType == null || elementType.strip().isVoid())
		{
			// Arrays of void carry the error placeholder as element
			this.elementType = ErrorType.INSTANCE;
		}
		else
		{
			this.elementType = elementType;
		}
		this.size = size;
	}

	public Type getElementType()
	{
		return elementType;
	}

	public Expression getSize()
	{
		return size;
	}

	@Override
	public String getName()
	{
		return elementType.getName() + "[" + size + "]";
	}

	@Override
	public boolean isArray()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
