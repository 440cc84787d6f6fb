package org.lokray.tamodel.expression;

import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Position-tagged operator tree. Nodes are built bottom-up and never change their children
 * afterwards; the only mutable part is the type annotation written by the type checker,
 * which is set at most once.
 */
public final class Expression
{
	public static final Expression EMPTY = new Expression(ExprKind.EMPTY, Position.UNKNOWN, List.of(), null, 0, 0.0, null, null);

	private final ExprKind kind;
	private final Position position;
	private final List<Expression> children;
	private final Symbol symbol;
	private final long value;
	private final double doubleValue;
	private final String text;
	private final Frame frame;
	private Type type;

	private Expression(ExprKind kind, Position position, List<Expression> children, Symbol symbol, long value, double doubleValue, String text, Frame frame)
	{
		this.kind = kind;
		this.position = position;
		this.children = children;
		this.symbol = symbol;
		this.value = value;
		this.doubleValue = doubleValue;
		this.text = text;
		this.frame = frame;
	}

	// --- Factories ---

	public static Expression createConstant(long value, Position position)
	{
		return new Expression(ExprKind.CONSTANT, position, List.of(), null, value, value, null, null);
	}

	public static Expression createDouble(double value, Position position)
	{
		return new Expression(ExprKind.DOUBLE_CONSTANT, position, List.of(), null, (long) value, value, null, null);
	}

	public static Expression createBool(boolean value, Position position)
	{
		return new Expression(ExprKind.BOOL_CONSTANT, position, List.of(), null, value ? 1 : 0, value ? 1 : 0, null, null);
	}

	/**
	 * @param poolIndex index of the literal in the document string pool
	 */
	public static Expression createString(String text, int poolIndex, Position position)
	{
		return new Expression(ExprKind.STRING_CONSTANT, position, List.of(), null, poolIndex, poolIndex, text, null);
	}

	public static Expression createIdentifier(Symbol symbol, Position position)
	{
		return new Expression(ExprKind.IDENTIFIER, position, List.of(), symbol, 0, 0.0, symbol.getName(), null);
	}

	public static Expression createUnary(ExprKind kind, Expression operand, Position position)
	{
		return new Expression(kind, position, List.of(operand), null, 0, 0.0, null, null);
	}

	public static Expression createBinary(ExprKind kind, Expression left, Expression right, Position position)
	{
		return new Expression(kind, position, List.of(left, right), null, 0, 0.0, null, null);
	}

	public static Expression createTernary(ExprKind kind, Expression first, Expression second, Expression third, Position position)
	{
		return new Expression(kind, position, List.of(first, second, third), null, 0, 0.0, null, null);
	}

	public static Expression createNary(ExprKind kind, List<Expression> operands, Position position)
	{
		return new Expression(kind, position, Collections.unmodifiableList(new ArrayList<>(operands)), null, 0, 0.0, null, null);
	}

	/** {@code record.field} or {@code process.location}. */
	public static Expression createDot(Expression owner, String member, Position position)
	{
		return new Expression(ExprKind.DOT, position, List.of(owner), null, 0, 0.0, member, null);
	}

	/** forall/exists/sum: the binder frame holds exactly one symbol. */
	public static Expression createBinder(ExprKind kind, Frame binder, Expression body, Position position)
	{
		if (!kind.isBinder())
		{
			throw new IllegalArgumentException(kind + " is not a binder");
		}
		return new Expression(kind, position, List.of(body), binder.get(0), 0, 0.0, null, binder);
	}

	// --- Accessors ---

	public ExprKind getKind()
	{
		return kind;
	}

	public Position getPosition()
	{
		return position;
	}

	public boolean isEmpty()
	{
		return kind == ExprKind.EMPTY;
	}

	public int getSize()
	{
		return children.size();
	}

	public Expression get(int index)
	{
		return children.get(index);
	}

	public List<Expression> getChildren()
	{
		return children;
	}

	/** Referenced symbol for identifiers; bound variable for binders. */
	public Symbol getSymbol()
	{
		return symbol;
	}

	public long getValue()
	{
		return value;
	}

	public double getDoubleValue()
	{
		return doubleValue;
	}

	/** Field name of a DOT node, or the literal text of a string constant. */
	public String getText()
	{
		return text;
	}

	public Frame getFrame()
	{
		return frame;
	}

	public Type getType()
	{
		return type;
	}

	public boolean isTyped()
	{
		return type != null;
	}

	/**
	 * Records the resolved type. An already annotated node keeps its first type.
	 */
	public void setType(Type type)
	{
		if (this.type == null && this != EMPTY)
		{
			this.type = type;
		}
	}

	// --- Queries over the tree ---

	/** All symbols referenced anywhere in the tree, in first-occurrence order. */
	public Set<Symbol> collectSymbols()
	{
		Set<Symbol> result = new LinkedHashSet<>();
		collectSymbols(result);
		return result;
	}

	public void collectSymbols(Set<Symbol> into)
	{
		if (kind == ExprKind.IDENTIFIER)
		{
			into.add(symbol);
		}
		for (Expression child : children)
		{
			child.collectSymbols(into);
		}
	}

	public boolean dependsOn(Symbol s)
	{
		return collectSymbols().contains(s);
	}

	/** True if evaluating the tree may modify state. Function calls count as effects. */
	public boolean hasSideEffect()
	{
		if (kind.isAssignment() || kind.isIncrementOrDecrement() || kind == ExprKind.FUNCALL
				|| kind == ExprKind.SPAWN || kind == ExprKind.EXIT)
		{
			return true;
		}
		for (Expression child : children)
		{
			if (child.hasSideEffect())
			{
				return true;
			}
		}
		return false;
	}

	public boolean contains(ExprKind wanted)
	{
		if (kind == wanted)
		{
			return true;
		}
		for (Expression child : children)
		{
			if (child.contains(wanted))
			{
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString()
	{
		return switch (kind)
		{
			case EMPTY -> "";
			case CONSTANT -> Long.toString(value);
			case DOUBLE_CONSTANT -> Double.toString(doubleValue);
			case BOOL_CONSTANT -> value != 0 ? "true" : "false";
			case STRING_CONSTANT -> "\"" + text + "\"";
			case IDENTIFIER -> symbol.getName();
			case DOT -> get(0) + "." + text;
			case INDEX -> get(0) + "[" + get(1) + "]";
			case RATE -> get(0) + "'";
			case FUNCALL, SPAWN -> (kind == ExprKind.SPAWN ? "spawn " : "") + get(0) + "(" + joinFrom(1, ", ") + ")";
			case EXIT -> "exit()";
			case DEADLOCK -> "deadlock";
			case POST_INCREMENT, POST_DECREMENT -> get(0) + kind.getSymbol();
			case PRE_INCREMENT, PRE_DECREMENT, UNARY_MINUS, UNARY_PLUS, NOT -> kind.getSymbol() + get(0);
			case INLINE_IF -> get(0) + " ? " + get(1) + " : " + get(2);
			case COMMA -> joinFrom(0, ", ");
			case LIST -> "{" + joinFrom(0, ", ") + "}";
			case FORALL, EXISTS, SUM -> kind.getSymbol() + " (" + symbol.getName() + ":" + symbol.getType() + ") " + get(0);
			case SYNC_SEND, SYNC_RECV -> get(0) + kind.getSymbol();
			case EF, EG, AF, AG -> kind.getSymbol() + " " + get(0);
			case PROBA_DIAMOND, PROBA_BOX, EXP_MAX, EXP_MIN, MIN_EXP, MAX_EXP -> kind.getSymbol() + "[" + joinFrom(0, "; ") + "]";
			default -> children.size() == 2 ? get(0) + " " + kind.getSymbol() + " " + get(1) : kind + "(" + joinFrom(0, ", ") + ")";
		};
	}

	private String joinFrom(int from, String separator)
	{
		StringBuilder result = new StringBuilder();
		for (int i = from; i < children.size(); i++)
		{
			if (i > from)
			{
				result.append(separator);
			}
			result.append(children.get(i));
		}
		return result.toString();
	}
}
