// File: src/main/java/org/lokray/tamodel/document/Function.java
package org.lokray.tamodel.document;

import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.symbol.SymbolData;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.statement.BlockStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A user function, or an external function imported from a library. External functions
 * have no body.
 */
public class Function implements SymbolData
{
	private final Symbol symbol;
	private final Frame parameters;
	private final List<Variable> variables = new ArrayList<>();
	private final Set<Symbol> changes = new LinkedHashSet<>();
	private final Set<Symbol> depends = new LinkedHashSet<>();
	private BlockStatement body;
	private Position bodyPosition = Position.UNKNOWN;
	private String library;
	private String externalName;

	Function(Symbol symbol, Frame parameters)
	{
		this.symbol = symbol;
		this.parameters = parameters;
		symbol.setData(this);
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	public String getName()
	{
		return symbol.getName();
	}

	public FunctionType getType()
	{
		return (FunctionType) symbol.getType().strip();
	}

	public Type getReturnType()
	{
		return getType().getReturnType();
	}

	/** Frame of the formal parameters; its parent is the declaring frame. */
	public Frame getParameters()
	{
		return parameters;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public void setBody(BlockStatement body)
	{
		this.body = body;
		this.bodyPosition = body.getPosition();
	}

	public Position getBodyPosition()
	{
		return bodyPosition;
	}

	/** Local variables of all nested blocks, in declaration order. */
	public List<Variable> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	void addVariable(Variable variable)
	{
		variables.add(variable);
	}

	/** Non-local variables the body may write; filled in by the type checker. */
	public Set<Symbol> getChanges()
	{
		return changes;
	}

	/** Non-local variables the body reads; filled in by the type checker. */
	public Set<Symbol> getDepends()
	{
		return depends;
	}

	public boolean isExternal()
	{
		return library != null;
	}

	/** Library the function is imported from; null for user functions. */
	public String getLibrary()
	{
		return library;
	}

	/** Name of the function inside its library. */
	public String getExternalName()
	{
		return externalName;
	}

	void markExternal(String library, String externalName)
	{
		this.library = library;
		this.externalName = externalName;
	}
}
