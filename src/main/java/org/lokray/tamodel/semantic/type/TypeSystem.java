// File: src/main/java/org/lokray/tamodel/semantic/type/TypeSystem.java
package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.document.Variable;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.symbol.Symbol;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compatibility rules between types. All methods ignore qualifier wrappers unless stated
 * otherwise, and accept the error placeholder silently.
 */
public final class TypeSystem
{
	private TypeSystem()
	{
	}

	/**
	 * Can a value of type {@code src} be stored in a location of type {@code dst}?
	 * int and bool convert into each other and widen to double. Clocks are reset from
	 * integral or floating point values and read as floating point. Scalars are only
	 * assignable within one scalar set; arrays and records need the same shape.
	 */
	public static boolean isAssignable(Type dst, Type src)
	{
		Type d = dst.strip();
		Type s = src.strip();
		if (d.isError() || s.isError())
		{
			return true;
		}
		if (d.isClock())
		{
			return s.isIntegral() || s.isDouble();
		}
		if (d.isIntegral())
		{
			return s.isIntegral();
		}
		if (d.isDouble())
		{
			return s.isIntegral() || s.isDouble() || s.isClock();
		}
		if (d.isScalar())
		{
			return d == s;
		}
		if (d.isArray() || d.isRecord())
		{
			return structuralEqual(d, s);
		}
		if (d.isString())
		{
			return s.isString();
		}
		return false;
	}

	/**
	 * Shape equality ignoring qualifiers, used for argument matching. Bounded integers have
	 * the shape of int; array sizes must fold to the same value.
	 */
	public static boolean structuralEqual(Type a, Type b)
	{
		Type x = a.strip();
		Type y = b.strip();
		if (x == y || x.isError() || y.isError())
		{
			return true;
		}
		if (isIntShaped(x) && isIntShaped(y))
		{
			return true;
		}
		if (x instanceof ArrayType ax && y instanceof ArrayType ay)
		{
			return structuralEqual(ax.getElementType(), ay.getElementType()) && sameSize(ax.getSize(), ay.getSize());
		}
		if (x instanceof RecordType rx && y instanceof RecordType ry)
		{
			if (rx.getFieldCount() != ry.getFieldCount())
			{
				return false;
			}
			for (int i = 0; i < rx.getFieldCount(); i++)
			{
				Symbol fx = rx.getFields().get(i);
				Symbol fy = ry.getFields().get(i);
				if (!fx.getName().equals(fy.getName()) || !structuralEqual(fx.getType(), fy.getType()))
				{
					return false;
				}
			}
			return true;
		}
		if (x instanceof FunctionType fx && y instanceof FunctionType fy)
		{
			if (fx.getArity() != fy.getArity() || !structuralEqual(fx.getReturnType(), fy.getReturnType()))
			{
				return false;
			}
			for (int i = 0; i < fx.getArity(); i++)
			{
				if (!structuralEqual(fx.getParameterTypes().get(i), fy.getParameterTypes().get(i)))
				{
					return false;
				}
			}
			return true;
		}
		return false;
	}

	private static boolean isIntShaped(Type t)
	{
		return t == PrimitiveType.INT || t instanceof RangeType;
	}

	private static boolean sameSize(Expression a, Expression b)
	{
		ConstantEvaluator evaluator = new ConstantEvaluator();
		Optional<Long> x = evaluator.tryEvaluate(a);
		Optional<Long> y = evaluator.tryEvaluate(b);
		if (x.isPresent() && y.isPresent())
		{
			return x.get().equals(y.get());
		}
		return a.toString().equals(b.toString());
	}

	public static long evaluateConstantSize(Expression size)
	{
		return evaluateConstantSize(size, Map.of());
	}

	/**
	 * Folds an array size, reading template parameters through {@code bindings}.
	 *
	 * @throws SemanticException with {@link ErrorKind#INVALID_ARRAY_SIZE} unless the size
	 *                           folds to a non-negative integer without reading mutable state
	 */
	public static long evaluateConstantSize(Expression size, Map<Symbol, Expression> bindings)
	{
		long value;
		try
		{
			value = new ConstantEvaluator(bindings).evaluate(size);
		}
		catch (SemanticException e)
		{
			throw new SemanticException(ErrorKind.INVALID_ARRAY_SIZE, "Array size must be a compile-time constant: " + e.getMessage());
		}
		if (value < 0)
		{
			throw new SemanticException(ErrorKind.INVALID_ARRAY_SIZE, "Array size must not be negative, got " + value);
		}
		return value;
	}

	/**
	 * True if the expression has no side effect, calls no function and reads only
	 * literals, constants with constant initializers and the given symbolic constants
	 * (typically constant template parameters whose value is fixed per process).
	 */
	public static boolean isCompileTimeConstant(Expression expr, Set<Symbol> symbolicConstants)
	{
		if (expr.hasSideEffect() || expr.contains(ExprKind.FUNCALL) || expr.contains(ExprKind.RATE))
		{
			return false;
		}
		for (Symbol s : expr.collectSymbols())
		{
			if (!symbolicConstants.contains(s) && !isConstantVariable(s, symbolicConstants))
			{
				return false;
			}
		}
		return true;
	}

	public static boolean isConstantVariable(Symbol symbol, Set<Symbol> symbolicConstants)
	{
		Variable variable = symbol.getDataAs(Variable.class);
		return variable != null && symbol.getType().isConstant() && !symbol.getType().isReference()
				&& variable.hasInitializer() && isCompileTimeConstant(variable.getInitializer(), symbolicConstants);
	}

	/**
	 * Symbols every array or scalar size inside the type mentions, including sizes of
	 * nested element and field types.
	 */
	public static Set<Symbol> collectSizeDependencies(Type type)
	{
		Set<Symbol> result = new LinkedHashSet<>();
		collectSizeDependencies(type.strip(), result);
		return result;
	}

	private static void collectSizeDependencies(Type type, Set<Symbol> into)
	{
		if (type instanceof ArrayType array)
		{
			array.getSize().collectSymbols(into);
			collectSizeDependencies(array.getElementType().strip(), into);
		}
		else if (type instanceof ScalarType scalar)
		{
			scalar.getSize().collectSymbols(into);
		}
		else if (type instanceof RecordType record)
		{
			record.getFields().forEachSymbol(f -> collectSizeDependencies(f.getType().strip(), into));
		}
	}

	/**
	 * Result type of applying {@code op} to operands of the given types, or the error
	 * placeholder if the operator does not apply. Channels never apply to an operator:
	 * they may only appear in synchronisation labels.
	 */
	public static Type compatibleForOperator(ExprKind op, List<Type> operands)
	{
		for (Type operand : operands)
		{
			Type t = operand.strip();
			if (t.isError() || t.isChannel() || t.isVoid() || t.isLabel() || t.isProcess() || t.isFunction())
			{
				return ErrorType.INSTANCE;
			}
		}
		Type left = operands.get(0).strip();
		Type right = operands.size() > 1 ? operands.get(1).strip() : null;

		return switch (op)
		{
			case UNARY_MINUS, UNARY_PLUS -> left.isIntegral() ? PrimitiveType.INT : left.isDouble() ? PrimitiveType.DOUBLE : ErrorType.INSTANCE;
			case NOT -> left.isIntegral() ? PrimitiveType.BOOL : ErrorType.INSTANCE;
			case PLUS, MINUS -> additive(op, left, right);
			case MULT, DIV, POW, MIN, MAX -> multiplicative(left, right);
			case MOD, LSHIFT, RSHIFT, BIT_AND, BIT_OR, BIT_XOR -> left.isIntegral() && right.isIntegral() ? PrimitiveType.INT : ErrorType.INSTANCE;
			case LT, LE, GE, GT -> ordered(left, right);
			case EQ, NEQ -> equality(op, left, right);
			case AND, OR, IMPLY -> left.isIntegral() && right.isIntegral() ? PrimitiveType.BOOL : ErrorType.INSTANCE;
			default -> ErrorType.INSTANCE;
		};
	}

	private static boolean isNumericOrClock(Type t)
	{
		return t.isNumeric() || t.isClock();
	}

	private static Type additive(ExprKind op, Type left, Type right)
	{
		if (left.isIntegral() && right.isIntegral())
		{
			return PrimitiveType.INT;
		}
		// Clock offsets and clock differences keep the clock type for constraints.
		if (left.isClock() && right.isIntegral() || op == ExprKind.PLUS && left.isIntegral() && right.isClock())
		{
			return PrimitiveType.CLOCK;
		}
		if (op == ExprKind.MINUS && left.isClock() && right.isClock())
		{
			return PrimitiveType.CLOCK;
		}
		return isNumericOrClock(left) && isNumericOrClock(right) ? PrimitiveType.DOUBLE : ErrorType.INSTANCE;
	}

	private static Type multiplicative(Type left, Type right)
	{
		if (left.isIntegral() && right.isIntegral())
		{
			return PrimitiveType.INT;
		}
		return isNumericOrClock(left) && isNumericOrClock(right) ? PrimitiveType.DOUBLE : ErrorType.INSTANCE;
	}

	private static Type ordered(Type left, Type right)
	{
		return isNumericOrClock(left) && isNumericOrClock(right) ? PrimitiveType.BOOL : ErrorType.INSTANCE;
	}

	private static Type equality(ExprKind op, Type left, Type right)
	{
		if (left.isClock() || right.isClock())
		{
			// Clock constraints admit < <= == >= > only.
			return op == ExprKind.EQ && isNumericOrClock(left) && isNumericOrClock(right) ? PrimitiveType.BOOL : ErrorType.INSTANCE;
		}
		if (left.isNumeric() && right.isNumeric())
		{
			return PrimitiveType.BOOL;
		}
		if (left.isScalar() || right.isScalar())
		{
			return left == right ? PrimitiveType.BOOL : ErrorType.INSTANCE;
		}
		if ((left.isArray() || left.isRecord() || left.isString()) && structuralEqual(left, right))
		{
			return PrimitiveType.BOOL;
		}
		return ErrorType.INSTANCE;
	}
}
