// File: src/main/java/org/lokray/tamodel/semantic/type/ConstantEvaluator.java
package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.document.Variable;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.symbol.Symbol;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds integer expressions at compile time. Identifiers fold through the initializer of
 * a constant variable or, for template parameters, through a binding of parameters to
 * argument expressions. Nothing that can change at run time is ever read.
 */
public class ConstantEvaluator
{
	private final Map<Symbol, Expression> bindings;
	private final Set<Symbol> visiting = new HashSet<>();

	public ConstantEvaluator()
	{
		this(Map.of());
	}

	/**
	 * @param bindings parameter to argument mapping of an instance, used to fold sizes that
	 *                 depend on template parameters
	 */
	public ConstantEvaluator(Map<Symbol, Expression> bindings)
	{
		this.bindings = bindings;
	}

	public Optional<Long> tryEvaluate(Expression expr)
	{
		try
		{
			return Optional.of(evaluate(expr));
		}
		catch (SemanticException e)
		{
			return Optional.empty();
		}
	}

	/**
	 * @throws SemanticException if the expression is not a compile-time constant or its
	 *                           evaluation fails (division by zero)
	 */
	public long evaluate(Expression expr)
	{
		return switch (expr.getKind())
		{
			case CONSTANT, BOOL_CONSTANT -> expr.getValue();
			case IDENTIFIER -> evaluateSymbol(expr.getSymbol());
			case UNARY_MINUS -> -evaluate(expr.get(0));
			case UNARY_PLUS -> evaluate(expr.get(0));
			case NOT -> evaluate(expr.get(0)) == 0 ? 1 : 0;
			case PLUS -> evaluate(expr.get(0)) + evaluate(expr.get(1));
			case MINUS -> evaluate(expr.get(0)) - evaluate(expr.get(1));
			case MULT -> evaluate(expr.get(0)) * evaluate(expr.get(1));
			case DIV -> evaluate(expr.get(0)) / divisor(expr.get(1));
			case MOD -> evaluate(expr.get(0)) % divisor(expr.get(1));
			case POW -> (long) Math.pow(evaluate(expr.get(0)), evaluate(expr.get(1)));
			case LSHIFT -> evaluate(expr.get(0)) << evaluate(expr.get(1));
			case RSHIFT -> evaluate(expr.get(0)) >> evaluate(expr.get(1));
			case MIN -> Math.min(evaluate(expr.get(0)), evaluate(expr.get(1)));
			case MAX -> Math.max(evaluate(expr.get(0)), evaluate(expr.get(1)));
			case BIT_AND -> evaluate(expr.get(0)) & evaluate(expr.get(1));
			case BIT_OR -> evaluate(expr.get(0)) | evaluate(expr.get(1));
			case BIT_XOR -> evaluate(expr.get(0)) ^ evaluate(expr.get(1));
			case LT -> evaluate(expr.get(0)) < evaluate(expr.get(1)) ? 1 : 0;
			case LE -> evaluate(expr.get(0)) <= evaluate(expr.get(1)) ? 1 : 0;
			case EQ -> evaluate(expr.get(0)) == evaluate(expr.get(1)) ? 1 : 0;
			case NEQ -> evaluate(expr.get(0)) != evaluate(expr.get(1)) ? 1 : 0;
			case GE -> evaluate(expr.get(0)) >= evaluate(expr.get(1)) ? 1 : 0;
			case GT -> evaluate(expr.get(0)) > evaluate(expr.get(1)) ? 1 : 0;
			case AND -> evaluate(expr.get(0)) != 0 && evaluate(expr.get(1)) != 0 ? 1 : 0;
			case OR -> evaluate(expr.get(0)) != 0 || evaluate(expr.get(1)) != 0 ? 1 : 0;
			case IMPLY -> evaluate(expr.get(0)) == 0 || evaluate(expr.get(1)) != 0 ? 1 : 0;
			case INLINE_IF -> evaluate(expr.get(0)) != 0 ? evaluate(expr.get(1)) : evaluate(expr.get(2));
			default -> throw notConstant(expr);
		};
	}

	private long divisor(Expression expr)
	{
		long value = evaluate(expr);
		if (value == 0)
		{
			throw new SemanticException(ErrorKind.GENERAL, "Division by zero in '" + expr + "'");
		}
		return value;
	}

	private long evaluateSymbol(Symbol symbol)
	{
		if (!visiting.add(symbol))
		{
			throw new SemanticException(ErrorKind.GENERAL, "Circular definition of '" + symbol.getName() + "'");
		}
		try
		{
			Expression bound = bindings.get(symbol);
			if (bound != null)
			{
				return evaluate(bound);
			}
			Variable variable = symbol.getDataAs(Variable.class);
			if (variable != null && variable.hasInitializer() && symbol.getType().isConstant()
					&& symbol.getType().strip().isIntegral())
			{
				return evaluate(variable.getInitializer());
			}
			throw new SemanticException(ErrorKind.GENERAL, "'" + symbol.getName() + "' is not a compile-time constant");
		}
		finally
		{
			visiting.remove(symbol);
		}
	}

	private static SemanticException notConstant(Expression expr)
	{
		return new SemanticException(ErrorKind.GENERAL, "'" + expr + "' is not a compile-time constant");
	}
}
