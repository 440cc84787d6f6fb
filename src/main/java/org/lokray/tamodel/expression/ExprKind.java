package org.lokray.tamodel.expression;

public enum ExprKind
{
	EMPTY(""),

	// Leaves
	CONSTANT(""),
	DOUBLE_CONSTANT(""),
	BOOL_CONSTANT(""),
	STRING_CONSTANT(""),
	IDENTIFIER(""),

	// Postfix and access
	DOT("."),
	INDEX("[]"),
	RATE("'"),
	FUNCALL("()"),
	POST_INCREMENT("++"),
	POST_DECREMENT("--"),
	PRE_INCREMENT("++"),
	PRE_DECREMENT("--"),

	// Unary
	UNARY_MINUS("-"),
	UNARY_PLUS("+"),
	NOT("!"),

	// Arithmetic
	POW("**"),
	MULT("*"),
	DIV("/"),
	MOD("%"),
	PLUS("+"),
	MINUS("-"),
	LSHIFT("<<"),
	RSHIFT(">>"),
	MIN("<?"),
	MAX(">?"),
	BIT_AND("&"),
	BIT_XOR("^"),
	BIT_OR("|"),

	// Relational
	LT("<"),
	LE("<="),
	EQ("=="),
	NEQ("!="),
	GE(">="),
	GT(">"),

	// Logical
	AND("&&"),
	OR("||"),
	IMPLY("imply"),

	INLINE_IF("?:"),

	// Assignment
	ASSIGN("="),
	ASS_PLUS("+="),
	ASS_MINUS("-="),
	ASS_MULT("*="),
	ASS_DIV("/="),
	ASS_MOD("%="),
	ASS_OR("|="),
	ASS_AND("&="),
	ASS_XOR("^="),
	ASS_LSHIFT("<<="),
	ASS_RSHIFT(">>="),
	COMMA(","),

	// Binders, frame attached to the node
	FORALL("forall"),
	EXISTS("exists"),
	SUM("sum"),

	// Dynamic processes
	SPAWN("spawn"),
	EXIT("exit"),

	// Synchronisation labels
	SYNC_SEND("!"),
	SYNC_RECV("?"),

	LIST("{}"),

	// Queries
	DEADLOCK("deadlock"),
	EF("E<>"),
	EG("E[]"),
	AF("A<>"),
	AG("A[]"),
	LEADS_TO("-->"),
	PROBA_DIAMOND("Pr<>"),
	PROBA_BOX("Pr[]"),
	EXP_MAX("E max"),
	EXP_MIN("E min"),
	MIN_EXP("minE"),
	MAX_EXP("maxE");

	private final String symbol;

	ExprKind(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public boolean isAssignment()
	{
		return compareTo(ASSIGN) >= 0 && compareTo(ASS_RSHIFT) <= 0;
	}

	public boolean isIncrementOrDecrement()
	{
		return this == POST_INCREMENT || this == POST_DECREMENT || this == PRE_INCREMENT || this == PRE_DECREMENT;
	}

	public boolean isRelational()
	{
		return compareTo(LT) >= 0 && compareTo(GT) <= 0;
	}

	/** Relational operators that exclude equality of the two sides. */
	public boolean isStrict()
	{
		return this == LT || this == GT;
	}

	public boolean isArithmetic()
	{
		return compareTo(POW) >= 0 && compareTo(BIT_OR) <= 0;
	}

	public boolean isBinder()
	{
		return this == FORALL || this == EXISTS || this == SUM;
	}

	public boolean isSync()
	{
		return this == SYNC_SEND || this == SYNC_RECV;
	}

	/** Path quantifiers and estimations; {@code deadlock} is a state predicate, not a query. */
	public boolean isQuery()
	{
		return compareTo(EF) >= 0;
	}

	/** Maps {@code a op= b} to the arithmetic operator it applies. */
	public ExprKind arithmeticOfAssignment()
	{
		return switch (this)
		{
			case ASS_PLUS -> PLUS;
			case ASS_MINUS -> MINUS;
			case ASS_MULT -> MULT;
			case ASS_DIV -> DIV;
			case ASS_MOD -> MOD;
			case ASS_OR -> BIT_OR;
			case ASS_AND -> BIT_AND;
			case ASS_XOR -> BIT_XOR;
			case ASS_LSHIFT -> LSHIFT;
			case ASS_RSHIFT -> RSHIFT;
			default -> null;
		};
	}
}
