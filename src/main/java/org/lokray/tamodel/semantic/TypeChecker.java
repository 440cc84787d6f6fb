// File: src/main/java/org/lokray/tamodel/semantic/TypeChecker.java
package org.lokray.tamodel.semantic;

import org.lokray.tamodel.document.ChanPriority;
import org.lokray.tamodel.document.Condition;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.DocumentVisitor;
import org.lokray.tamodel.document.Edge;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.document.Gantt;
import org.lokray.tamodel.document.Instance;
import org.lokray.tamodel.document.IoDecl;
import org.lokray.tamodel.document.Location;
import org.lokray.tamodel.document.Message;
import org.lokray.tamodel.document.ProgressMeasure;
import org.lokray.tamodel.document.Query;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.document.TypeDefinition;
import org.lokray.tamodel.document.Update;
import org.lokray.tamodel.document.Variable;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.ArrayType;
import org.lokray.tamodel.semantic.type.ConstantEvaluator;
import org.lokray.tamodel.semantic.type.ErrorType;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.PrimitiveType;
import org.lokray.tamodel.semantic.type.ProcessType;
import org.lokray.tamodel.semantic.type.QualifiedType;
import org.lokray.tamodel.semantic.type.Qualifier;
import org.lokray.tamodel.semantic.type.RangeType;
import org.lokray.tamodel.semantic.type.RecordType;
import org.lokray.tamodel.semantic.type.ScalarType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.semantic.type.TypeSystem;
import org.lokray.tamodel.statement.BlockStatement;
import org.lokray.tamodel.statement.DoWhileStatement;
import org.lokray.tamodel.statement.EmptyStatement;
import org.lokray.tamodel.statement.ExprStatement;
import org.lokray.tamodel.statement.ForStatement;
import org.lokray.tamodel.statement.IfStatement;
import org.lokray.tamodel.statement.IterationStatement;
import org.lokray.tamodel.statement.ReturnStatement;
import org.lokray.tamodel.statement.StatementVisitor;
import org.lokray.tamodel.statement.WhileStatement;
import org.lokray.tamodel.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a built {@link Document} in one pass and annotates every expression with its
 * type. Violations are recorded on the document and replaced by the error type, so the
 * traversal always reaches the end. The capability flags found on the way are returned
 * and attached to the document.
 */
public class TypeChecker implements DocumentVisitor
{
	private final Document document;
	private final Capabilities capabilities = new Capabilities();
	private final Set<Expression> checkedArguments = Collections.newSetFromMap(new IdentityHashMap<>());
	private Template currentTemplate;
	private Function currentFunction;

	public TypeChecker(Document document)
	{
		this.document = document;
	}

	public static Capabilities check(Document document)
	{
		TypeChecker checker = new TypeChecker(document);
		document.accept(checker);
		return checker.capabilities;
	}

	public Capabilities getCapabilities()
	{
		return capabilities;
	}

	private void error(Position position, ErrorKind kind, String message, Object context)
	{
		document.addError(position, kind, message, String.valueOf(context));
	}

	private void warning(Position position, String message, Object context)
	{
		document.addWarning(position, message, String.valueOf(context));
	}

	// =========================================================================
	// Document traversal
	// =========================================================================

	@Override
	public void visitDocumentBefore(Document document)
	{
		Debug.logDebug("Type checking " + document.getAllTemplates().size() + " template(s)");
		if (document.hasPriorityDeclaration())
		{
			capabilities.recordPriorityDeclaration();
		}
		if (!document.getDynamicTemplates().isEmpty())
		{
			capabilities.recordDynamicTemplates();
		}
	}

	@Override
	public void visitDocumentAfter(Document document)
	{
		checkUpdateHook(document.getBeforeUpdate());
		checkUpdateHook(document.getAfterUpdate());
		document.setCapabilities(capabilities);
		Debug.logDebug("Type checking done: " + document.getErrors().size() + " error(s), " + document.getWarnings().size() + " warning(s), " + capabilities);
	}

	private void checkUpdateHook(Expression update)
	{
		if (!update.isEmpty())
		{
			checkEffects(update);
		}
	}

	@Override
	public void visitTypeDefinition(TypeDefinition definition)
	{
		Symbol symbol = definition.getSymbol();
		// Keywords of the builtin frame are typedefs without anything to check.
		if (symbol.getFrame() != document.getBuiltinFrame())
		{
			checkType(symbol.getType(), symbol.getPosition());
		}
	}

	@Override
	public void visitVariable(Variable variable)
	{
		checkVariable(variable, true);
	}

	private void checkVariable(Variable variable, boolean global)
	{
		Symbol symbol = variable.getSymbol();
		Type type = symbol.getType();
		checkType(type, symbol.getPosition());
		if (!variable.hasInitializer())
		{
			if (type.isConstant() && !type.strip().isError())
			{
				error(symbol.getPosition(), ErrorKind.GENERAL, "Constant '" + symbol.getName() + "' must be initialized.", symbol.getName());
			}
			return;
		}
		Expression init = variable.getInitializer();
		if (type.strip().isClock() || type.strip().isChannel())
		{
			error(init.getPosition(), ErrorKind.TYPE_MISMATCH, "A variable of type '" + type.strip().getName() + "' cannot have an initializer.", symbol.getName());
			return;
		}
		checkInitializer(type, init);
		if (global && hasEffect(init))
		{
			error(init.getPosition(), ErrorKind.GENERAL, "Initializer of '" + symbol.getName() + "' must not have side effects.", init);
		}
		else if (type.isConstant() && !TypeSystem.isCompileTimeConstant(init, symbolicConstants()))
		{
			error(init.getPosition(), ErrorKind.GENERAL, "Initializer of constant '" + symbol.getName() + "' must be computable at compile time.", init);
		}
	}

	private void checkInitializer(Type target, Expression init)
	{
		Type type = target.strip();
		if (init.getKind() != ExprKind.LIST)
		{
			Type actual = checkExpression(init);
			if (!TypeSystem.isAssignable(target, actual))
			{
				error(init.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible types: cannot assign '" + actual.getName() + "' to '" + target.getName() + "'.", init);
			}
			return;
		}
		if (type instanceof ArrayType array)
		{
			Optional<Long> size = new ConstantEvaluator().tryEvaluate(array.getSize());
			if (size.isPresent() && size.get() != init.getSize())
			{
				error(init.getPosition(), ErrorKind.TYPE_MISMATCH, "Initializer has " + init.getSize() + " element(s), but the array has " + size.get() + ".", init);
			}
			for (Expression element : init.getChildren())
			{
				checkInitializer(array.getElementType(), element);
			}
			init.setType(target);
		}
		else if (type instanceof RecordType record)
		{
			if (record.getFieldCount() != init.getSize())
			{
				error(init.getPosition(), ErrorKind.TYPE_MISMATCH, "Initializer has " + init.getSize() + " field(s), but the record has " + record.getFieldCount() + ".", init);
			}
			for (int i = 0; i < Math.min(record.getFieldCount(), init.getSize()); i++)
			{
				checkInitializer(record.getFields().get(i).getType(), init.get(i));
			}
			init.setType(target);
		}
		else if (!type.isError())
		{
			error(init.getPosition(), ErrorKind.TYPE_MISMATCH, "Initializer list cannot initialize a value of type '" + target.getName() + "'.", init);
			init.setType(ErrorType.INSTANCE);
		}
	}

	/** Template parameters whose values are fixed per process and may size arrays. */
	private Set<Symbol> symbolicConstants()
	{
		Set<Symbol> result = new HashSet<>();
		if (currentTemplate != null)
		{
			currentTemplate.getParameters().forEachSymbol(p ->
			{
				if (!p.getType().isReference())
				{
					result.add(p);
				}
			});
		}
		return result;
	}

	// --- Types ---

	private void checkType(Type type, Position position)
	{
		if (type instanceof QualifiedType qualified)
		{
			Qualifier qualifier = qualified.getQualifier();
			if ((qualifier == Qualifier.URGENT || qualifier == Qualifier.BROADCAST) && !qualified.getInner().strip().isChannel())
			{
				error(position, ErrorKind.TYPE_MISMATCH, "Prefix '" + qualifier.getKeyword() + "' only applies to channels.", type);
			}
			checkType(qualified.getInner(), position);
		}
		else if (type instanceof RangeType range)
		{
			for (Expression bound : List.of(range.getLower(), range.getUpper()))
			{
				Type boundType = checkExpression(bound);
				if (!boundType.strip().isError() && !boundType.isIntegral())
				{
					error(bound.getPosition(), ErrorKind.TYPE_MISMATCH, "Range bounds must be integers, but found '" + boundType.getName() + "'.", bound);
				}
				else if (!TypeSystem.isCompileTimeConstant(bound, symbolicConstants()))
				{
					error(bound.getPosition(), ErrorKind.GENERAL, "Range bounds must be computable at compile time.", bound);
				}
			}
		}
		else if (type instanceof ScalarType scalar)
		{
			checkSize(scalar.getSize());
		}
		else if (type instanceof ArrayType array)
		{
			checkSize(array.getSize());
			checkType(array.getElementType(), position);
		}
		else if (type instanceof RecordType record)
		{
			record.getFields().forEachSymbol(f -> checkType(f.getType(), f.getPosition()));
		}
	}

	/**
	 * An array or scalar size must be an integer computable at compile time. Sizes over
	 * template parameters are folded per process.
	 */
	private void checkSize(Expression size)
	{
		Type type = checkExpression(size);
		if (type.strip().isError())
		{
			return;
		}
		if (!type.isIntegral())
		{
			error(size.getPosition(), ErrorKind.INVALID_ARRAY_SIZE, "Array size must be an integer, but found '" + type.getName() + "'.", size);
			return;
		}
		if (!TypeSystem.isCompileTimeConstant(size, symbolicConstants()))
		{
			error(size.getPosition(), ErrorKind.INVALID_ARRAY_SIZE, "Array size must be a compile-time constant.", size);
			return;
		}
		if (new ConstantEvaluator().tryEvaluate(size).isPresent() || !dependsOnParameters(size))
		{
			try
			{
				TypeSystem.evaluateConstantSize(size);
			}
			catch (SemanticException e)
			{
				error(size.getPosition(), e.getKind(), e.getMessage(), size);
			}
		}
	}

	private boolean dependsOnParameters(Expression expr)
	{
		return currentTemplate != null && dependsOnAny(expr, new HashSet<>(currentTemplate.getParameters().getSymbols()), Map.of(), new HashSet<>());
	}

	/** Does the expression read one of {@code targets}, directly, via constants or via bindings? */
	private static boolean dependsOnAny(Expression expr, Set<Symbol> targets, Map<Symbol, Expression> bindings, Set<Symbol> seen)
	{
		for (Symbol s : expr.collectSymbols())
		{
			if (targets.contains(s))
			{
				return true;
			}
			if (!seen.add(s))
			{
				continue;
			}
			Expression bound = bindings.get(s);
			if (bound != null && dependsOnAny(bound, targets, bindings, seen))
			{
				return true;
			}
			Variable variable = s.getDataAs(Variable.class);
			if (variable != null && s.getType().isConstant() && dependsOnAny(variable.getInitializer(), targets, bindings, seen))
			{
				return true;
			}
		}
		return false;
	}

	// --- Functions ---

	@Override
	public void visitFunction(Function function)
	{
		FunctionType type = function.getType();
		checkType(type.getReturnType(), function.getSymbol().getPosition());
		function.getParameters().forEachSymbol(p -> checkType(p.getType(), p.getPosition()));
		if (function.isExternal() || function.getBody() == null)
		{
			return;
		}
		currentFunction = function;
		BlockStatement body = function.getBody();
		body.accept(new StatementChecker());
		if (!type.getReturnType().strip().isVoid() && !type.getReturnType().strip().isError() && !body.returns())
		{
			error(function.getBodyPosition().isKnown() ? function.getBodyPosition() : function.getSymbol().getPosition(), ErrorKind.TYPE_MISMATCH,
					"Function must return a result of type '" + type.getReturnType().getName() + "'. Not all code paths return a value.", function.getName());
		}
		currentFunction = null;
	}

	private final class StatementChecker implements StatementVisitor<Void>
	{
		@Override
		public Void visitEmpty(EmptyStatement statement)
		{
			return null;
		}

		@Override
		public Void visitExpression(ExprStatement statement)
		{
			checkEffects(statement.getExpression());
			return null;
		}

		@Override
		public Void visitBlock(BlockStatement statement)
		{
			for (Variable variable : statement.getVariables())
			{
				checkVariable(variable, false);
			}
			statement.getStatements().forEach(s -> s.accept(this));
			return null;
		}

		@Override
		public Void visitIf(IfStatement statement)
		{
			checkCondition(statement.getCondition(), "If condition");
			statement.getThen().accept(this);
			if (statement.getElse() != null)
			{
				statement.getElse().accept(this);
			}
			return null;
		}

		@Override
		public Void visitWhile(WhileStatement statement)
		{
			checkCondition(statement.getCondition(), "While condition");
			statement.getBody().accept(this);
			return null;
		}

		@Override
		public Void visitDoWhile(DoWhileStatement statement)
		{
			statement.getBody().accept(this);
			checkCondition(statement.getCondition(), "Do-while condition");
			return null;
		}

		@Override
		public Void visitFor(ForStatement statement)
		{
			checkExpression(statement.getInit());
			if (!statement.getCondition().isEmpty())
			{
				checkCondition(statement.getCondition(), "For loop condition");
			}
			checkExpression(statement.getStep());
			statement.getBody().accept(this);
			return null;
		}

		@Override
		public Void visitIteration(IterationStatement statement)
		{
			Symbol variable = statement.getVariable();
			if (!isBoundedType(variable.getType()))
			{
				error(variable.getPosition(), ErrorKind.TYPE_MISMATCH, "Iteration variable must be of a bounded integer or scalar type, but found '" + variable.getType().getName() + "'.", variable.getName());
			}
			statement.getBody().accept(this);
			return null;
		}

		@Override
		public Void visitReturn(ReturnStatement statement)
		{
			Type expected = currentFunction.getReturnType();
			Expression value = statement.getValue();
			if (value.isEmpty())
			{
				if (!expected.strip().isVoid())
				{
					error(statement.getPosition(), ErrorKind.TYPE_MISMATCH, "Function expects return type '" + expected.getName() + "' but found 'return;' statement.", currentFunction.getName());
				}
				return null;
			}
			Type actual = checkExpression(value);
			if (expected.strip().isVoid())
			{
				error(value.getPosition(), ErrorKind.TYPE_MISMATCH, "Void function cannot return a value.", value);
			}
			else if (!TypeSystem.isAssignable(expected, actual))
			{
				error(value.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible return type: cannot convert '" + actual.getName() + "' to '" + expected.getName() + "'.", value);
			}
			return null;
		}
	}

	private static boolean isBoundedType(Type type)
	{
		Type t = type.strip();
		return t instanceof RangeType || t instanceof ScalarType || t.isError() || t == PrimitiveType.BOOL;
	}

	private void checkCondition(Expression condition, String what)
	{
		Type type = checkExpression(condition);
		if (!type.strip().isError() && !type.isIntegral())
		{
			error(condition.getPosition(), ErrorKind.TYPE_MISMATCH, what + " must be of type 'bool', but found '" + type.getName() + "'.", condition);
		}
	}

	/** Checks an expression used for its effect; each part without one is reported. */
	private void checkEffects(Expression expr)
	{
		checkExpression(expr);
		List<Expression> parts = expr.getKind() == ExprKind.COMMA ? expr.getChildren() : List.of(expr);
		for (Expression part : parts)
		{
			if (!part.isEmpty() && !hasEffect(part))
			{
				warning(part.getPosition(), "Expression has no effect", part);
			}
		}
	}

	private void checkSideEffectFree(Expression expr, String what)
	{
		if (hasEffect(expr))
		{
			error(expr.getPosition(), ErrorKind.GENERAL, what + " must not have side effects.", expr);
		}
	}

	/**
	 * Like {@link Expression#hasSideEffect()}, except that calling a function only counts
	 * if the function changes variables or reference parameters. External functions are
	 * assumed to change state.
	 */
	private static boolean hasEffect(Expression expr)
	{
		ExprKind kind = expr.getKind();
		if (kind == ExprKind.FUNCALL)
		{
			Expression callee = expr.get(0);
			Function function = callee.getKind() == ExprKind.IDENTIFIER ? callee.getSymbol().getDataAs(Function.class) : null;
			if (function == null || function.isExternal() || !function.getChanges().isEmpty())
			{
				return true;
			}
			for (Expression argument : expr.getChildren().subList(1, expr.getSize()))
			{
				if (hasEffect(argument))
				{
					return true;
				}
			}
			return false;
		}
		if (kind.isAssignment() || kind.isIncrementOrDecrement() || kind == ExprKind.SPAWN || kind == ExprKind.EXIT)
		{
			return true;
		}
		for (Expression child : expr.getChildren())
		{
			if (hasEffect(child))
			{
				return true;
			}
		}
		return false;
	}

	// --- Misc declarations ---

	@Override
	public void visitProgressMeasure(ProgressMeasure measure)
	{
		if (!measure.getGuard().isEmpty())
		{
			checkCondition(measure.getGuard(), "Progress guard");
		}
		Type type = checkExpression(measure.getMeasure());
		if (!type.strip().isError() && !type.isIntegral())
		{
			error(measure.getMeasure().getPosition(), ErrorKind.TYPE_MISMATCH, "Progress measure must be an integer, but found '" + type.getName() + "'.", measure.getMeasure());
		}
	}

	@Override
	public void visitGantt(Gantt gantt)
	{
		checkBinders(gantt.getParameters(), "Gantt parameter");
		for (Gantt.Mapping mapping : gantt.getMappings())
		{
			checkBinders(mapping.getParameters(), "Gantt binder");
			checkCondition(mapping.getPredicate(), "Gantt predicate");
			Type colour = checkExpression(mapping.getColour());
			if (!colour.strip().isError() && !colour.isIntegral())
			{
				error(mapping.getColour().getPosition(), ErrorKind.TYPE_MISMATCH, "Gantt colour must be an integer, but found '" + colour.getName() + "'.", mapping.getColour());
			}
		}
	}

	private void checkBinders(Frame binders, String what)
	{
		binders.forEachSymbol(b ->
		{
			if (!isBoundedType(b.getType()))
			{
				error(b.getPosition(), ErrorKind.TYPE_MISMATCH, what + " must be of a bounded integer or scalar type, but found '" + b.getType().getName() + "'.", b.getName());
			}
		});
	}

	@Override
	public void visitIoDecl(IoDecl decl)
	{
		decl.getParameters().forEach(this::checkExpression);
		List<Expression> channels = new ArrayList<>(decl.getInputs());
		channels.addAll(decl.getOutputs());
		channels.addAll(decl.getCsp());
		channels.forEach(c -> checkChannel(c, "I/O declaration"));
	}

	private Type checkChannel(Expression channel, String what)
	{
		Type type = checkExpression(channel);
		if (!type.strip().isError() && !type.strip().isChannel())
		{
			error(channel.getPosition(), ErrorKind.TYPE_MISMATCH, what + " requires a channel, but found '" + type.getName() + "'.", channel);
		}
		return type;
	}

	@Override
	public void visitChanPriority(ChanPriority priority)
	{
		priority.getChannels().forEach(c -> checkChannel(c, "Channel priority"));
	}

	// =========================================================================
	// Templates
	// =========================================================================

	@Override
	public boolean visitTemplateBefore(Template template)
	{
		currentTemplate = template;
		if (template.isDynamic() && !template.isDefined())
		{
			error(template.getInstance().getPosition(), ErrorKind.UNDECLARED_SYMBOL, "Dynamic template '" + template.getName() + "' is declared but never defined.", template.getName());
		}
		template.getParameters().forEachSymbol(p -> checkType(p.getType(), p.getPosition()));
		return true;
	}

	@Override
	public void visitTemplateAfter(Template template)
	{
		if (template.isTA() && template.isDefined() && template.getInit() == null)
		{
			error(template.getInstance().getPosition(), ErrorKind.GENERAL, "Template '" + template.getName() + "' has no initial location.", template.getName());
		}
		currentTemplate = null;
	}

	@Override
	public void visitLocation(Location location)
	{
		Expression invariant = location.getInvariant();
		if (!invariant.isEmpty())
		{
			checkInvariant(location, invariant);
		}
		Expression expRate = location.getExpRate();
		if (!expRate.isEmpty())
		{
			Type type = checkExpression(expRate);
			if (!type.strip().isError() && !type.isNumeric())
			{
				error(expRate.getPosition(), ErrorKind.TYPE_MISMATCH, "Exponential rate must be a number, but found '" + type.getName() + "'.", expRate);
			}
			checkSideEffectFree(expRate, "Exponential rate");
		}
	}

	private void checkInvariant(Location location, Expression invariant)
	{
		checkCondition(invariant, "Invariant");
		checkSideEffectFree(invariant, "Invariant");
		for (Expression conjunct : conjuncts(invariant))
		{
			Optional<Expression> rateOf = rateVariable(conjunct);
			if (rateOf.isPresent())
			{
				Expression rate = conjunct.get(0).getKind() == ExprKind.RATE ? conjunct.get(1) : conjunct.get(0);
				location.addRate(conjunct);
				Type variable = rateOf.get().getType();
				if (variable != null && variable.strip().isDouble())
				{
					location.setCostRate(rate);
				}
				else if (mayBeZero(rate))
				{
					capabilities.recordStopWatch();
				}
			}
			else if (isStrictClockBound(conjunct))
			{
				capabilities.recordStrictInvariant();
			}
		}
	}

	private static List<Expression> conjuncts(Expression expr)
	{
		if (expr.getKind() != ExprKind.AND)
		{
			return List.of(expr);
		}
		List<Expression> result = new ArrayList<>(conjuncts(expr.get(0)));
		result.addAll(conjuncts(expr.get(1)));
		return result;
	}

	/** For {@code x' == e} or {@code e == x'}, the rated variable. */
	private static Optional<Expression> rateVariable(Expression conjunct)
	{
		if (conjunct.getKind() != ExprKind.EQ)
		{
			return Optional.empty();
		}
		for (Expression side : conjunct.getChildren())
		{
			if (side.getKind() == ExprKind.RATE)
			{
				return Optional.of(side.get(0));
			}
		}
		return Optional.empty();
	}

	private static boolean mayBeZero(Expression rate)
	{
		if (rate.getKind() == ExprKind.DOUBLE_CONSTANT)
		{
			return rate.getDoubleValue() == 0.0;
		}
		return new ConstantEvaluator().tryEvaluate(rate).map(v -> v == 0).orElse(true);
	}

	private static boolean isStrictClockBound(Expression conjunct)
	{
		ExprKind kind = conjunct.getKind();
		if (kind != ExprKind.LT && kind != ExprKind.GT)
		{
			return false;
		}
		for (Expression side : conjunct.getChildren())
		{
			if (side.getType() != null && side.getType().strip().isClock())
			{
				return true;
			}
		}
		return false;
	}

	@Override
	public void visitEdge(Edge edge)
	{
		if (edge.getSelect() != null)
		{
			checkBinders(edge.getSelect(), "Select variable");
		}

		Expression guard = edge.getGuard();
		if (!guard.isEmpty())
		{
			checkCondition(guard, "Guard");
			checkSideEffectFree(guard, "Guard");
		}

		Expression sync = edge.getSync();
		if (!sync.isEmpty())
		{
			checkSync(sync, guard);
		}

		Expression assign = edge.getAssign();
		if (!assign.isEmpty())
		{
			checkEffects(assign);
		}

		Expression probability = edge.getProbability();
		if (!probability.isEmpty())
		{
			Type type = checkExpression(probability);
			if (!type.strip().isError() && !type.isNumeric())
			{
				error(probability.getPosition(), ErrorKind.TYPE_MISMATCH, "Probability weight must be a number, but found '" + type.getName() + "'.", probability);
			}
			checkSideEffectFree(probability, "Probability weight");
		}
	}

	private void checkSync(Expression sync, Expression guard)
	{
		Expression channel = sync.get(0);
		Type type = checkChannel(channel, "Synchronisation");
		sync.setType(PrimitiveType.VOID);
		checkSideEffectFree(channel, "Synchronisation");
		if (!type.strip().isChannel())
		{
			return;
		}
		boolean urgent = type.is(Qualifier.URGENT);
		boolean broadcast = type.is(Qualifier.BROADCAST);
		boolean clockGuard = !guard.isEmpty() && readsClock(guard);
		if (urgent)
		{
			capabilities.recordUrgentTransition();
			if (clockGuard)
			{
				error(guard.getPosition(), ErrorKind.GENERAL, "Clock guards are not allowed on edges synchronising on urgent channels.", guard);
			}
		}
		if (broadcast && sync.getKind() == ExprKind.SYNC_RECV && clockGuard)
		{
			capabilities.recordClockGuardRecvBroadcast();
		}
		capabilities.recordSync(broadcast);
	}

	private static boolean readsClock(Expression expr)
	{
		for (Symbol s : expr.collectSymbols())
		{
			Type t = s.getType().strip();
			if (t.isClock() || t instanceof ArrayType array && array.getElementType().strip().isClock())
			{
				return true;
			}
		}
		return false;
	}

	@Override
	public void visitMessage(Message message)
	{
		if (!message.getLabel().isEmpty())
		{
			checkExpression(message.getLabel());
		}
	}

	@Override
	public void visitCondition(Condition condition)
	{
		if (!condition.getLabel().isEmpty())
		{
			checkCondition(condition.getLabel(), "Condition");
			checkSideEffectFree(condition.getLabel(), "Condition");
		}
	}

	@Override
	public void visitUpdate(Update update)
	{
		if (!update.getLabel().isEmpty())
		{
			checkEffects(update.getLabel());
		}
	}

	// =========================================================================
	// System
	// =========================================================================

	@Override
	public void visitInstance(Instance instance)
	{
		for (Map.Entry<Symbol, Expression> binding : instance.getMapping().entrySet())
		{
			Expression argument = binding.getValue();
			if (!checkedArguments.add(argument))
			{
				continue;
			}
			checkArgument(binding.getKey(), argument, "parameter '" + binding.getKey().getName() + "' of " + instance.getName());
			checkSideEffectFree(argument, "Template argument");
		}
	}

	private void checkArgument(Symbol parameter, Expression argument, String what)
	{
		Type expected = parameter.getType();
		Type actual = checkExpression(argument);
		if (expected.isReference())
		{
			if (!actual.strip().isError() && !isLValue(argument))
			{
				error(argument.getPosition(), ErrorKind.TYPE_MISMATCH, "Reference argument for " + what + " must be a variable.", argument);
			}
			else if (!TypeSystem.structuralEqual(expected, actual))
			{
				error(argument.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible argument for " + what + ": cannot bind '" + actual.getName() + "' to '" + expected.getName() + "'.", argument);
			}
			else if (actual.isConstant() && !expected.isConstant())
			{
				error(argument.getPosition(), ErrorKind.TYPE_MISMATCH, "Constant argument cannot be bound to non-constant reference " + what + ".", argument);
			}
		}
		else if (!TypeSystem.isAssignable(expected, actual))
		{
			error(argument.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible argument for " + what + ": cannot convert '" + actual.getName() + "' to '" + expected.getName() + "'.", argument);
		}
	}

	@Override
	public void visitProcess(Instance process)
	{
		for (Symbol free : process.getUnboundParameters())
		{
			if (free.getType().isReference() || !(free.getType().strip() instanceof RangeType || free.getType().strip() instanceof ScalarType))
			{
				error(process.getPosition(), ErrorKind.TYPE_MISMATCH, "Free process parameters must be a bounded integer or a scalar: '" + free.getName() + "' of " + process.getName() + ".", free.getName());
			}
		}
		checkProcessSizes(process);
	}

	/** Folds every size of the template that depends on its parameters with the process' arguments. */
	private void checkProcessSizes(Instance process)
	{
		Template template = process.getTemplate();
		Set<Symbol> parameters = new HashSet<>(template.getParameters().getSymbols());
		Set<Symbol> free = new HashSet<>(process.getUnboundParameters());
		Map<Symbol, Expression> bindings = process.getMapping();

		List<Expression> sizes = new ArrayList<>();
		template.getParameters().forEachSymbol(p -> collectSizes(p.getType(), sizes));
		template.getDeclarations().getVariables().forEach(v -> collectSizes(v.getSymbol().getType(), sizes));

		for (Expression size : sizes)
		{
			if (!dependsOnAny(size, parameters, Map.of(), new HashSet<>()) || dependsOnAny(size, free, bindings, new HashSet<>()))
			{
				continue;
			}
			try
			{
				TypeSystem.evaluateConstantSize(size, bindings);
			}
			catch (SemanticException e)
			{
				error(process.getPosition(), e.getKind(), "In process " + process.getName() + ": " + e.getMessage(), size);
			}
		}
	}

	private static void collectSizes(Type type, List<Expression> into)
	{
		Type t = type.strip();
		if (t instanceof ArrayType array)
		{
			into.add(array.getSize());
			collectSizes(array.getElementType(), into);
		}
		else if (t instanceof ScalarType scalar)
		{
			into.add(scalar.getSize());
		}
		else if (t instanceof RecordType record)
		{
			record.getFields().forEachSymbol(f -> collectSizes(f.getType(), into));
		}
	}

	// =========================================================================
	// Queries
	// =========================================================================

	@Override
	public void visitQuery(Query query)
	{
		checkQuery(query.getFormula());
	}

	public void checkQuery(Expression formula)
	{
		if (formula.isEmpty())
		{
			return;
		}
		checkExpression(formula);
		checkSideEffectFree(formula, "Property");
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * Types the expression bottom-up and returns its type. Already typed nodes are not
	 * looked at again. A node whose operands include the error type gets the error type
	 * without a further diagnostic.
	 */
	public Type checkExpression(Expression expr)
	{
		if (expr.isEmpty())
		{
			return PrimitiveType.VOID;
		}
		if (expr.isTyped())
		{
			return expr.getType();
		}
		Type type;
		try
		{
			type = computeType(expr);
		}
		catch (SemanticException e)
		{
			error(expr.getPosition(), e.getKind(), e.getMessage(), expr);
			type = ErrorType.INSTANCE;
		}
		expr.setType(type);
		return type;
	}

	private List<Type> checkChildren(Expression expr)
	{
		List<Type> types = new ArrayList<>();
		for (Expression child : expr.getChildren())
		{
			types.add(checkExpression(child));
		}
		return types;
	}

	private static boolean anyError(List<Type> types)
	{
		for (Type t : types)
		{
			if (t.strip().isError())
			{
				return true;
			}
		}
		return false;
	}

	private Type computeType(Expression expr)
	{
		ExprKind kind = expr.getKind();
		switch (kind)
		{
			case CONSTANT:
				return PrimitiveType.INT;
			case DOUBLE_CONSTANT:
				return PrimitiveType.DOUBLE;
			case BOOL_CONSTANT:
			case DEADLOCK:
				return PrimitiveType.BOOL;
			case STRING_CONSTANT:
				return PrimitiveType.STRING;
			case IDENTIFIER:
				return identifierType(expr);
			case DOT:
				return dotType(expr);
			case INDEX:
				return indexType(expr);
			case RATE:
				return rateType(expr);
			case FUNCALL:
				return callType(expr);
			case PRE_INCREMENT:
			case PRE_DECREMENT:
			case POST_INCREMENT:
			case POST_DECREMENT:
				return incrementType(expr);
			case INLINE_IF:
				return conditionalType(expr);
			case COMMA:
			{
				List<Type> types = checkChildren(expr);
				return types.get(types.size() - 1);
			}
			case FORALL:
			case EXISTS:
			case SUM:
				return binderType(expr);
			case SPAWN:
				return spawnType(expr);
			case EXIT:
				if (currentTemplate == null || !currentTemplate.isDynamic())
				{
					error(expr.getPosition(), ErrorKind.GENERAL, "exit() is only allowed in dynamic templates.", expr);
				}
				return PrimitiveType.VOID;
			case SYNC_SEND:
			case SYNC_RECV:
				checkChannel(expr.get(0), "Synchronisation");
				return PrimitiveType.VOID;
			case LIST:
				checkChildren(expr);
				error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Initializer list is not allowed here.", expr);
				return ErrorType.INSTANCE;
			default:
				break;
		}
		if (kind.isAssignment())
		{
			return assignmentType(expr);
		}
		if (kind.isQuery())
		{
			return queryType(expr);
		}
		return operatorType(expr);
	}

	private Type identifierType(Expression expr)
	{
		Symbol symbol = expr.getSymbol();
		if (currentFunction != null && symbol.getData() instanceof Variable && !symbol.getFrame().isWithin(currentFunction.getParameters()))
		{
			currentFunction.getDepends().add(symbol);
		}
		return symbol.getType();
	}

	private Type dotType(Expression expr)
	{
		Type owner = checkExpression(expr.get(0));
		Type stripped = owner.strip();
		String member = expr.getText();
		if (stripped.isError())
		{
			return ErrorType.INSTANCE;
		}
		if (stripped instanceof RecordType record)
		{
			Optional<Symbol> field = record.getField(member);
			if (field.isEmpty())
			{
				error(expr.getPosition(), ErrorKind.UNDECLARED_SYMBOL, "Record has no field '" + member + "'.", expr);
				return ErrorType.INSTANCE;
			}
			Type fieldType = field.get().getType();
			// Fields of a constant record are constant as well.
			return owner.isConstant() && !fieldType.isConstant() ? QualifiedType.of(Qualifier.CONST, fieldType) : fieldType;
		}
		if (stripped instanceof ProcessType process)
		{
			Optional<Symbol> symbol = process.getInstance().getTemplate().getFrame().resolveLocally(member);
			if (symbol.isEmpty())
			{
				error(expr.getPosition(), ErrorKind.UNDECLARED_SYMBOL, "Process '" + process.getInstance().getName() + "' has no member '" + member + "'.", expr);
				return ErrorType.INSTANCE;
			}
			return symbol.get().getData() instanceof Location ? PrimitiveType.BOOL : symbol.get().getType();
		}
		error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Cannot access member '" + member + "' of a value of type '" + owner.getName() + "'.", expr);
		return ErrorType.INSTANCE;
	}

	private Type indexType(Expression expr)
	{
		List<Type> types = checkChildren(expr);
		if (anyError(types))
		{
			return ErrorType.INSTANCE;
		}
		Type base = types.get(0);
		Type index = types.get(1);
		if (!(base.strip() instanceof ArrayType array))
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Cannot index a value of type '" + base.getName() + "'.", expr);
			return ErrorType.INSTANCE;
		}
		if (!index.isIntegral() && !index.strip().isScalar())
		{
			error(expr.get(1).getPosition(), ErrorKind.TYPE_MISMATCH, "Array index must be an integer or scalar, but found '" + index.getName() + "'.", expr.get(1));
			return ErrorType.INSTANCE;
		}
		ConstantEvaluator evaluator = new ConstantEvaluator();
		Optional<Long> position = evaluator.tryEvaluate(expr.get(1));
		Optional<Long> size = evaluator.tryEvaluate(array.getSize());
		if (position.isPresent() && size.isPresent() && (position.get() < 0 || position.get() >= size.get()))
		{
			error(expr.get(1).getPosition(), ErrorKind.GENERAL, "Array index " + position.get() + " is out of bounds for size " + size.get() + ".", expr);
		}
		Type element = array.getElementType();
		return base.isConstant() && !element.isConstant() ? QualifiedType.of(Qualifier.CONST, element) : element;
	}

	private Type rateType(Expression expr)
	{
		Type operand = checkExpression(expr.get(0));
		if (operand.strip().isError())
		{
			return ErrorType.INSTANCE;
		}
		if (!operand.strip().isClock() && !operand.strip().isDouble())
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Rate operator requires a clock or double, but found '" + operand.getName() + "'.", expr);
			return ErrorType.INSTANCE;
		}
		return PrimitiveType.DOUBLE;
	}

	private Type callType(Expression expr)
	{
		Expression callee = expr.get(0);
		Type calleeType = checkExpression(callee);
		List<Expression> arguments = expr.getChildren().subList(1, expr.getSize());
		List<Type> argumentTypes = new ArrayList<>();
		for (Expression argument : arguments)
		{
			argumentTypes.add(checkExpression(argument));
		}
		if (calleeType.strip().isError())
		{
			return ErrorType.INSTANCE;
		}
		if (!(calleeType.strip() instanceof FunctionType function))
		{
			error(callee.getPosition(), ErrorKind.TYPE_MISMATCH, "'" + callee + "' is not a function.", expr);
			return ErrorType.INSTANCE;
		}
		if (function.getArity() != arguments.size())
		{
			error(expr.getPosition(), ErrorKind.ARITY_MISMATCH, "Function '" + callee + "' expects " + function.getArity() + " argument(s), but got " + arguments.size() + ".", expr);
			return function.getReturnType();
		}
		Frame parameters = callee.getKind() == ExprKind.IDENTIFIER && callee.getSymbol().getData() instanceof Function f ? f.getParameters() : null;
		for (int i = 0; i < arguments.size(); i++)
		{
			Type expected = function.getParameterTypes().get(i);
			Type actual = argumentTypes.get(i);
			if (actual.strip().isError())
			{
				continue;
			}
			if (expected.isReference())
			{
				if (!isLValue(arguments.get(i)))
				{
					error(arguments.get(i).getPosition(), ErrorKind.TYPE_MISMATCH, "Argument " + (i + 1) + " of '" + callee + "' is passed by reference and must be a variable.", arguments.get(i));
				}
				else if (!TypeSystem.structuralEqual(expected, actual))
				{
					error(arguments.get(i).getPosition(), ErrorKind.TYPE_MISMATCH, "Argument " + (i + 1) + " of '" + callee + "': cannot bind '" + actual.getName() + "' to '" + expected.getName() + "'.", arguments.get(i));
				}
				else if (currentFunction != null && parameters != null && !expected.isConstant())
				{
					recordChange(arguments.get(i));
				}
			}
			else if (!TypeSystem.isAssignable(expected, actual))
			{
				error(arguments.get(i).getPosition(), ErrorKind.TYPE_MISMATCH, "Argument " + (i + 1) + " of '" + callee + "': cannot convert '" + actual.getName() + "' to '" + expected.getName() + "'.", arguments.get(i));
			}
		}
		if (currentFunction != null && callee.getKind() == ExprKind.IDENTIFIER && callee.getSymbol().getData() instanceof Function called)
		{
			for (Symbol changed : called.getChanges())
			{
				if (!changed.getFrame().isWithin(called.getParameters()))
				{
					currentFunction.getChanges().add(changed);
				}
			}
			currentFunction.getDepends().addAll(called.getDepends());
		}
		return function.getReturnType();
	}

	private Type incrementType(Expression expr)
	{
		Expression operand = expr.get(0);
		Type type = checkExpression(operand);
		if (type.strip().isError())
		{
			return ErrorType.INSTANCE;
		}
		if (!type.isIntegral())
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Operator '" + expr.getKind().getSymbol() + "' cannot be applied to '" + type.getName() + "'.", expr);
			return ErrorType.INSTANCE;
		}
		checkWritable(operand);
		return PrimitiveType.INT;
	}

	private Type assignmentType(Expression expr)
	{
		Expression target = expr.get(0);
		Type left = checkExpression(target);
		Type right = checkExpression(expr.get(1));
		if (left.strip().isError() || right.strip().isError())
		{
			return ErrorType.INSTANCE;
		}
		if (expr.getKind() == ExprKind.ASSIGN)
		{
			if (!TypeSystem.isAssignable(left, right))
			{
				error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible types: cannot assign '" + right.getName() + "' to '" + left.getName() + "'.", expr);
				return ErrorType.INSTANCE;
			}
		}
		else
		{
			ExprKind operator = expr.getKind().arithmeticOfAssignment();
			Type result = TypeSystem.compatibleForOperator(operator, List.of(left, right));
			if (result.isError() || left.strip().isClock() || !TypeSystem.isAssignable(left, result))
			{
				error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Operator '" + expr.getKind().getSymbol() + "' cannot be applied to '" + left.getName() + "' and '" + right.getName() + "'.", expr);
				return ErrorType.INSTANCE;
			}
		}
		checkWritable(target);
		return left;
	}

	private void checkWritable(Expression target)
	{
		if (!isLValue(target))
		{
			error(target.getPosition(), ErrorKind.GENERAL, "Left-hand side of assignment is not a variable.", target);
		}
		else if (isConstantPath(target))
		{
			error(target.getPosition(), ErrorKind.GENERAL, "Cannot assign to constant '" + target + "'.", target);
		}
		else if (currentFunction != null)
		{
			recordChange(target);
		}
	}

	private void recordChange(Expression target)
	{
		Symbol base = baseSymbol(target);
		if (base == null)
		{
			return;
		}
		// Writes through reference parameters are kept so callers see the function as effectful.
		boolean local = base.getFrame().isWithin(currentFunction.getParameters());
		if (!local || currentFunction.getParameters().contains(base) && base.getType().isReference())
		{
			currentFunction.getChanges().add(base);
		}
	}

	private static Symbol baseSymbol(Expression expr)
	{
		return switch (expr.getKind())
		{
			case IDENTIFIER -> expr.getSymbol();
			case INDEX, DOT -> baseSymbol(expr.get(0));
			default -> null;
		};
	}

	private static boolean isLValue(Expression expr)
	{
		switch (expr.getKind())
		{
			case IDENTIFIER:
			{
				Symbol symbol = expr.getSymbol();
				Type type = symbol.getType().strip();
				return (symbol.getData() == null || symbol.getData() instanceof Variable)
						&& !type.isFunction() && !type.isProcess() && !type.isLabel() && !type.isError();
			}
			case INDEX:
			case DOT:
				return isLValue(expr.get(0));
			case INLINE_IF:
				return isLValue(expr.get(1)) && isLValue(expr.get(2));
			default:
				return false;
		}
	}

	private static boolean isConstantPath(Expression expr)
	{
		if (expr.getType() != null && expr.getType().isConstant())
		{
			return true;
		}
		return switch (expr.getKind())
		{
			case INDEX, DOT -> isConstantPath(expr.get(0));
			case INLINE_IF -> isConstantPath(expr.get(1)) || isConstantPath(expr.get(2));
			default -> false;
		};
	}

	private Type conditionalType(Expression expr)
	{
		List<Type> types = checkChildren(expr);
		if (anyError(types))
		{
			return ErrorType.INSTANCE;
		}
		Type condition = types.get(0);
		Type first = types.get(1);
		Type second = types.get(2);
		if (!condition.isIntegral())
		{
			error(expr.get(0).getPosition(), ErrorKind.TYPE_MISMATCH, "Condition must be of type 'bool', but found '" + condition.getName() + "'.", expr.get(0));
			return ErrorType.INSTANCE;
		}
		if (first.isIntegral() && second.isIntegral())
		{
			return first.strip() == second.strip() ? first.strip() : PrimitiveType.INT;
		}
		if (first.isNumeric() && second.isNumeric())
		{
			return PrimitiveType.DOUBLE;
		}
		if (TypeSystem.structuralEqual(first, second))
		{
			return first;
		}
		error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Incompatible branches in conditional expression: '" + first.getName() + "' and '" + second.getName() + "'.", expr);
		return ErrorType.INSTANCE;
	}

	private Type binderType(Expression expr)
	{
		Symbol variable = expr.getSymbol();
		if (!isBoundedType(variable.getType()))
		{
			error(variable.getPosition(), ErrorKind.TYPE_MISMATCH, "Quantified variable must be of a bounded integer or scalar type, but found '" + variable.getType().getName() + "'.", variable.getName());
		}
		Type body = checkExpression(expr.get(0));
		if (body.strip().isError())
		{
			return ErrorType.INSTANCE;
		}
		if (expr.getKind() == ExprKind.SUM)
		{
			if (!body.isNumeric())
			{
				error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Sum requires a numeric body, but found '" + body.getName() + "'.", expr);
				return ErrorType.INSTANCE;
			}
			return body.isIntegral() ? PrimitiveType.INT : PrimitiveType.DOUBLE;
		}
		if (!body.isIntegral())
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, "Quantifier body must be of type 'bool', but found '" + body.getName() + "'.", expr);
			return ErrorType.INSTANCE;
		}
		return PrimitiveType.BOOL;
	}

	private Type spawnType(Expression expr)
	{
		Expression target = expr.get(0);
		List<Expression> arguments = expr.getChildren().subList(1, expr.getSize());
		arguments.forEach(this::checkExpression);
		Optional<Template> template = document.getDynamicTemplate(target.getSymbol().getName())
				.filter(t -> t.getSymbol() == target.getSymbol());
		if (template.isEmpty())
		{
			if (!target.getSymbol().getType().strip().isError())
			{
				error(target.getPosition(), ErrorKind.TYPE_MISMATCH, "'" + target + "' is not a dynamic template.", expr);
			}
			return ErrorType.INSTANCE;
		}
		Frame parameters = template.get().getParameters();
		if (parameters.size() != arguments.size())
		{
			error(expr.getPosition(), ErrorKind.ARITY_MISMATCH, "Template '" + target + "' expects " + parameters.size() + " argument(s), but got " + arguments.size() + ".", expr);
		}
		else
		{
			for (int i = 0; i < arguments.size(); i++)
			{
				checkArgument(parameters.get(i), arguments.get(i), "parameter '" + parameters.get(i).getName() + "' of " + target);
			}
		}
		if (currentTemplate != null)
		{
			currentTemplate.addDynamicEval(expr);
		}
		return PrimitiveType.INT;
	}

	private Type operatorType(Expression expr)
	{
		List<Type> types = checkChildren(expr);
		if (anyError(types))
		{
			return ErrorType.INSTANCE;
		}
		Type result = TypeSystem.compatibleForOperator(expr.getKind(), types);
		if (result.isError())
		{
			String operator = expr.getKind().getSymbol();
			String message = types.size() == 1
					? "Operator '" + operator + "' cannot be applied to '" + types.get(0).getName() + "'."
					: "Operator '" + operator + "' cannot be applied to '" + types.get(0).getName() + "' and '" + types.get(1).getName() + "'.";
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, message, expr);
		}
		return result;
	}

	// --- Queries ---

	private Type queryType(Expression expr)
	{
		switch (expr.getKind())
		{
			case EF:
			case EG:
			case AF:
			case AG:
				expectBoolean(expr.get(0), "Property");
				return PrimitiveType.BOOL;
			case LEADS_TO:
				expectBoolean(expr.get(0), "Property");
				expectBoolean(expr.get(1), "Property");
				return PrimitiveType.BOOL;
			case PROBA_DIAMOND:
			case PROBA_BOX:
				checkRuns(expr.get(0));
				checkRunBound(expr, 1);
				expectBoolean(expr.get(4), "Probability path formula");
				return PrimitiveType.DOUBLE;
			case EXP_MAX:
			case EXP_MIN:
				checkRuns(expr.get(0));
				checkRunBound(expr, 1);
				expectNumber(expr.get(4), "Estimated value");
				return PrimitiveType.DOUBLE;
			case MIN_EXP:
			case MAX_EXP:
				expectNumber(expr.get(0), "Learning objective");
				checkRunBound(expr, 1);
				for (Expression space : List.of(expr.get(4), expr.get(5)))
				{
					space.getChildren().forEach(this::checkExpression);
					space.setType(PrimitiveType.VOID);
				}
				expectBoolean(expr.get(6), "Learning goal");
				return PrimitiveType.DOUBLE;
			default:
				checkChildren(expr);
				return PrimitiveType.BOOL;
		}
	}

	/** Explicit run counts must be positive; -1 stands for the engine's default. */
	private void checkRuns(Expression runs)
	{
		checkExpression(runs);
		if (runs.getKind() == ExprKind.CONSTANT && (runs.getValue() == 0 || runs.getValue() < -1))
		{
			error(runs.getPosition(), ErrorKind.GENERAL, "Number of runs must be positive.", runs);
		}
	}

	/** Checks the (kind, variable, bound) triple starting at child {@code first}. */
	private void checkRunBound(Expression expr, int first)
	{
		checkExpression(expr.get(first));
		Expression variable = expr.get(first + 1);
		if (!variable.isEmpty())
		{
			Type type = checkExpression(variable);
			if (!type.strip().isError() && !type.strip().isClock())
			{
				error(variable.getPosition(), ErrorKind.TYPE_MISMATCH, "Run bound variable must be a clock, but found '" + type.getName() + "'.", variable);
			}
		}
		expectNumber(expr.get(first + 2), "Run bound");
	}

	private void expectBoolean(Expression expr, String what)
	{
		Type type = checkExpression(expr);
		if (!type.strip().isError() && !type.isIntegral())
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, what + " must be of type 'bool', but found '" + type.getName() + "'.", expr);
		}
	}

	private void expectNumber(Expression expr, String what)
	{
		Type type = checkExpression(expr);
		if (!type.strip().isError() && !type.isNumeric() && !type.strip().isClock())
		{
			error(expr.getPosition(), ErrorKind.TYPE_MISMATCH, what + " must be a number, but found '" + type.getName() + "'.", expr);
		}
	}
}
