// File: src/main/java/org/lokray/tamodel/semantic/BuiltInLoader.java
package org.lokray.tamodel.semantic;

import org.lokray.tamodel.document.TypeDefinition;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.PrimitiveType;
import org.lokray.tamodel.semantic.type.Type;

import java.util.List;

/**
 * Utility class responsible for filling the builtin frame, the root every document's
 * frames hang off.
 */
public class BuiltInLoader
{
	/**
	 * Declares every primitive type keyword as a type name, querying the PrimitiveType
	 * class as the single source of truth.
	 */
	public static void definePrimitives(Frame frame)
	{
		PrimitiveType.getAllPrimitiveKeywords().forEach((name, type) ->
				new TypeDefinition(frame.declare(name, type, Position.UNKNOWN)));
	}

	/**
	 * Declares the builtin math functions.
	 */
	public static void defineFunctions(Frame frame)
	{
		Type i = PrimitiveType.INT;
		Type d = PrimitiveType.DOUBLE;

		define(frame, "abs", i, i);
		define(frame, "fabs", d, d);
		define(frame, "fmod", d, d, d);
		define(frame, "fmax", d, d, d);
		define(frame, "fmin", d, d, d);
		define(frame, "exp", d, d);
		define(frame, "ln", d, d);
		define(frame, "log", d, d);
		define(frame, "log10", d, d);
		define(frame, "pow", d, d, d);
		define(frame, "sqrt", d, d);
		define(frame, "sin", d, d);
		define(frame, "cos", d, d);
		define(frame, "tan", d, d);
		define(frame, "ceil", d, d);
		define(frame, "floor", d, d);
		define(frame, "round", i, d);
		define(frame, "random", d, d);
		define(frame, "random_normal", d, d, d);
		define(frame, "random_poisson", d, d);
	}

	private static void define(Frame frame, String name, Type returnType, Type... parameters)
	{
		frame.declare(name, new FunctionType(returnType, List.of(parameters)), Position.UNKNOWN);
	}
}
