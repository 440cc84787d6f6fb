package org.lokray.tamodel.semantic.type;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Signature of a user or external function. Reference parameters carry {@link Qualifier#REF}.
 */
public class FunctionType implements Type
{
	private final Type returnType;
	private final List<Type> parameterTypes;

	public FunctionType(Type returnType, List<Type> parameterTypes)
	{
		this.returnType = returnType;
		this.parameterTypes = List.copyOf(parameterTypes);
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public List<Type> getParameterTypes()
	{
		return Collections.unmodifiableList(parameterTypes);
	}

	public int getArity()
	{
		return parameterTypes.size();
	}

	@Override
	public String getName()
	{
		return returnType.getName() + "(" + parameterTypes.stream().map(Type::getName).collect(Collectors.joining(", ")) + ")";
	}

	@Override
	public boolean isFunction()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
