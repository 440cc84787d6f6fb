// File: src/main/java/org/lokray/tamodel/document/Document.java
package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.Diagnostic;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.PositionIndex;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.position.SourceLocation;
import org.lokray.tamodel.semantic.BuiltInLoader;
import org.lokray.tamodel.semantic.Capabilities;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.ProcessType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.semantic.type.TypeSystem;
import org.lokray.tamodel.util.Debug;
import org.lokray.tamodel.util.ErrorHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The intermediate representation of one model: global declarations, templates,
 * instances and processes, channel and process priorities, queries and the diagnostics
 * found while building and checking it.
 * <p>
 * Frames nest as builtin, global, then one frame per template and one for the system
 * declarations. The document is written by a single builder and then checked once; after
 * that it is only read.
 */
public class Document
{
	private final Frame builtinFrame;
	private final Declarations globals;
	private final Frame systemFrame;

	private final List<Template> templates = new ArrayList<>();
	private final List<Template> dynamicTemplates = new ArrayList<>();
	private final List<Template> lscTemplates = new ArrayList<>();
	private final List<Instance> instances = new ArrayList<>();
	private final List<Instance> lscInstances = new ArrayList<>();
	private final List<Instance> processes = new ArrayList<>();

	private final List<ChanPriority> chanPriorities = new ArrayList<>();
	private final Map<String, Integer> processPriority = new LinkedHashMap<>();
	private int currentPriority;

	private final List<Query> queries = new ArrayList<>();
	private final List<Option> options = new ArrayList<>();
	private final List<String> strings = new ArrayList<>();
	private Expression beforeUpdate = Expression.EMPTY;
	private Expression afterUpdate = Expression.EMPTY;

	private final PositionIndex positions = new PositionIndex();
	private final ErrorHandler errorHandler = new ErrorHandler(positions);
	private int nextOffset;
	private Capabilities capabilities = new Capabilities();

	public Document()
	{
		builtinFrame = Frame.createRoot();
		BuiltInLoader.definePrimitives(builtinFrame);
		BuiltInLoader.defineFunctions(builtinFrame);
		globals = new Declarations(builtinFrame.child());
		systemFrame = globals.getFrame().child();
	}

	// --- Frames ---

	public Frame getBuiltinFrame()
	{
		return builtinFrame;
	}

	public Declarations getGlobals()
	{
		return globals;
	}

	public Frame getGlobalFrame()
	{
		return globals.getFrame();
	}

	/** Scope of the system section: partial instantiations and the system line. */
	public Frame getSystemFrame()
	{
		return systemFrame;
	}

	// --- Declarations ---

	/**
	 * Declares a variable in the given scope.
	 *
	 * @throws SemanticException with {@link ErrorKind#DUPLICATE_SYMBOL}
	 */
	public Variable addVariable(Declarations scope, Type type, String name, Expression initializer, Position position)
	{
		Symbol symbol = scope.getFrame().declare(name, type, position);
		Variable variable = new Variable(symbol, initializer);
		scope.addVariable(variable);
		return variable;
	}

	/**
	 * Declares a local variable of a function body in the frame of its block.
	 */
	public Variable addVariableToFunction(Function function, Frame block, Type type, String name, Expression initializer, Position position)
	{
		Symbol symbol = block.declare(name, type, position);
		Variable variable = new Variable(symbol, initializer);
		function.addVariable(variable);
		return variable;
	}

	public TypeDefinition addTypeDefinition(Frame frame, Type type, String name, Position position)
	{
		Symbol symbol = frame.declare(name, type, position);
		return new TypeDefinition(symbol);
	}

	/**
	 * Declares a function. The parameter frame is expected to be a child of the scope's
	 * frame; the body is attached later with {@link Function#setBody}.
	 */
	public Function addFunction(Declarations scope, FunctionType type, String name, Frame parameters, Position position)
	{
		Symbol symbol = scope.getFrame().declare(name, type, position);
		Function function = new Function(symbol, parameters);
		scope.addFunction(function);
		return function;
	}

	/**
	 * Declares a function implemented by an external library. The function is callable by
	 * its alias inside the model and looked up by its name in the library.
	 */
	public Function addExternalFunction(FunctionType type, String alias, String name, String library, Frame parameters, Position position)
	{
		Function function = addFunction(globals, type, alias, parameters, position);
		function.markExternal(library, name);
		return function;
	}

	public void addProgressMeasure(Declarations scope, Expression guard, Expression measure)
	{
		scope.addProgress(new ProgressMeasure(guard, measure));
	}

	public void addGantt(Declarations scope, Gantt gantt)
	{
		scope.addGantt(gantt);
	}

	public void addIoDecl(Declarations scope, IoDecl decl)
	{
		scope.addIoDecl(decl);
	}

	// --- Templates ---

	/**
	 * Creates a timed automaton template. Its frame is chained under the global frame and
	 * includes the parameters.
	 *
	 * @throws SemanticException with {@link ErrorKind#DUPLICATE_SYMBOL}
	 */
	public Template addTemplate(String name, Frame parameters, Position position)
	{
		return addTemplate(name, parameters, position, true, "", "");
	}

	/**
	 * @param ta   false for scenario charts
	 * @param type scenario chart type, e.g. "existential" or "universal"
	 * @param mode scenario chart mode, e.g. "initial" or "invariant"
	 */
	public Template addTemplate(String name, Frame parameters, Position position, boolean ta, String type, String mode)
	{
		Template template = createTemplate(name, parameters, position, ta, type, mode, false, -1);
		(ta ? templates : lscTemplates).add(template);
		return template;
	}

	/**
	 * Declares a template whose processes are spawned at run time. Its body may be
	 * given later by {@link #defineDynamicTemplate}.
	 */
	public Template addDynamicTemplate(String name, Frame parameters, Position position)
	{
		Template template = createTemplate(name, parameters, position, true, "", "", true, dynamicTemplates.size());
		dynamicTemplates.add(template);
		return template;
	}

	public void defineDynamicTemplate(Template template)
	{
		template.markDefined();
	}

	private Template createTemplate(String name, Frame parameters, Position position, boolean ta, String type, String mode, boolean dynamic, int dynIndex)
	{
		Template template = new Template(parameters, globals.getFrame().child(), position, ta, type, mode, dynamic, dynIndex);
		Symbol symbol = globals.getFrame().declare(name, new ProcessType(template.getInstance()), position);
		template.getInstance().attach(symbol);
		Debug.logDebug("Template " + template);
		return template;
	}

	public List<Template> getTemplates()
	{
		return Collections.unmodifiableList(templates);
	}

	public List<Template> getDynamicTemplates()
	{
		return Collections.unmodifiableList(dynamicTemplates);
	}

	public Optional<Template> getDynamicTemplate(String name)
	{
		return dynamicTemplates.stream().filter(t -> t.getName().equals(name)).findFirst();
	}

	public List<Template> getLscTemplates()
	{
		return Collections.unmodifiableList(lscTemplates);
	}

	/** Static, dynamic and scenario templates in this order. */
	public List<Template> getAllTemplates()
	{
		List<Template> result = new ArrayList<>(templates);
		result.addAll(dynamicTemplates);
		result.addAll(lscTemplates);
		return result;
	}

	// --- Instantiation ---

	/**
	 * Binds the first {@code arguments.size()} unbound parameters of {@code target}. The
	 * new instance's own parameters come first, followed by the parameters of the target
	 * that remain unbound; so chains like {@code Q(const int a) = P(a, 1); Q1 = Q(2);}
	 * bind parameters step by step.
	 * <p>
	 * An argument for a restricted parameter may only read literals, constants and
	 * constant, non-reference parameters of the new instance. Such parameters become
	 * restricted themselves.
	 *
	 * @param newParameters frame holding the new instance's parameters; the arguments are
	 *                      resolved in it
	 * @throws SemanticException with {@link ErrorKind#TOO_MANY_ARGUMENTS},
	 *                           {@link ErrorKind#RESTRICTED_PARAMETER_VIOLATION} or
	 *                           {@link ErrorKind#DUPLICATE_SYMBOL}
	 */
	public Instance addInstance(String name, Instance target, Frame newParameters, List<Expression> arguments, Position position)
	{
		Instance instance = instantiate(target, newParameters, arguments, position);
		Symbol symbol = systemFrame.declare(name, new ProcessType(instance), position);
		instance.attach(symbol);
		instances.add(instance);
		Debug.logDebug("Instance " + name + " = " + target.getName() + "(" + instance.argumentsString() + ")");
		return instance;
	}

	/**
	 * Same as {@link #addInstance} for instances of scenario chart templates, which are
	 * kept apart from the instances of timed automata.
	 */
	public Instance addLscInstance(String name, Instance target, Frame newParameters, List<Expression> arguments, Position position)
	{
		Instance instance = instantiate(target, newParameters, arguments, position);
		Symbol symbol = systemFrame.declare(name, new ProcessType(instance), position);
		instance.attach(symbol);
		lscInstances.add(instance);
		return instance;
	}

	private Instance instantiate(Instance target, Frame newParameters, List<Expression> arguments, Position position)
	{
		int supplied = arguments.size();
		int unbound = target.getUnbound();
		if (supplied > unbound)
		{
			throw new SemanticException(ErrorKind.TOO_MANY_ARGUMENTS,
					"Too many arguments for " + target.getName() + ": expected at most " + unbound + ", got " + supplied);
		}

		List<Symbol> targetParameters = target.getParameters().getSymbols();
		for (int i = 0; i < supplied; i++)
		{
			Symbol parameter = targetParameters.get(i);
			if (target.isRestricted(parameter))
			{
				checkRestrictedArgument(parameter, arguments.get(i), newParameters);
			}
		}

		Frame parameters = systemFrame.child();
		parameters.includeAll(newParameters);
		targetParameters.subList(supplied, unbound).forEach(parameters::include);
		targetParameters.subList(0, supplied).forEach(parameters::include);
		targetParameters.subList(unbound, targetParameters.size()).forEach(parameters::include);

		Instance instance = new Instance(parameters, newParameters.size() + unbound - supplied, target.getTemplate(), position);
		instance.inheritMapping(target);
		for (int i = 0; i < supplied; i++)
		{
			instance.bind(targetParameters.get(i), arguments.get(i));
		}
		instance.setArguments(supplied);

		for (int i = 0; i < supplied; i++)
		{
			if (target.isRestricted(targetParameters.get(i)))
			{
				for (Symbol s : arguments.get(i).collectSymbols())
				{
					if (newParameters.contains(s))
					{
						instance.addRestricted(s);
					}
				}
			}
		}
		for (Symbol parameter : targetParameters.subList(supplied, unbound))
		{
			if (target.isRestricted(parameter))
			{
				instance.addRestricted(parameter);
			}
		}
		return instance;
	}

	private static void checkRestrictedArgument(Symbol parameter, Expression argument, Frame newParameters)
	{
		if (argument.contains(ExprKind.FUNCALL) || argument.hasSideEffect())
		{
			throw restrictedViolation(parameter, argument);
		}
		for (Symbol s : argument.collectSymbols())
		{
			boolean ok = newParameters.contains(s)
					? s.getType().isConstant() && !s.getType().isReference()
					: TypeSystem.isConstantVariable(s, Set.of());
			if (!ok)
			{
				throw restrictedViolation(parameter, argument);
			}
		}
	}

	private static SemanticException restrictedViolation(Symbol parameter, Expression argument)
	{
		return new SemanticException(ErrorKind.RESTRICTED_PARAMETER_VIOLATION,
				"Parameter '" + parameter.getName() + "' determines an array size; argument '" + argument + "' must be a compile-time constant");
	}

	public List<Instance> getInstances()
	{
		return Collections.unmodifiableList(instances);
	}

	public List<Instance> getLscInstances()
	{
		return Collections.unmodifiableList(lscInstances);
	}

	// --- Processes ---

	/** Adds an entry of the system line. */
	public void addProcess(Instance instance)
	{
		processes.add(instance);
	}

	/**
	 * Detaches a process from the system. Templates and instances it was made from are
	 * left untouched.
	 */
	public boolean removeProcess(Instance instance)
	{
		processPriority.remove(instance.getName());
		return processes.remove(instance);
	}

	public List<Instance> getProcesses()
	{
		return Collections.unmodifiableList(processes);
	}

	// --- Priorities ---

	public void addChanPriority(ChanPriority priority)
	{
		chanPriorities.add(priority);
	}

	public List<ChanPriority> getChanPriorities()
	{
		return Collections.unmodifiableList(chanPriorities);
	}

	/** Processes listed after a '<' on the system line get the next priority level. */
	public void incrementProcessPriority()
	{
		currentPriority++;
	}

	public void setProcessPriority(String name)
	{
		processPriority.put(name, currentPriority);
	}

	public int getProcessPriority(String name)
	{
		return processPriority.getOrDefault(name, 0);
	}

	public Map<String, Integer> getProcessPriorities()
	{
		return Collections.unmodifiableMap(processPriority);
	}

	public boolean hasPriorityDeclaration()
	{
		return !chanPriorities.isEmpty() || currentPriority > 0;
	}

	// --- Queries, options, strings ---

	public void addQuery(Query query)
	{
		queries.add(query);
	}

	public List<Query> getQueries()
	{
		return Collections.unmodifiableList(queries);
	}

	public List<Option> getOptions()
	{
		return Collections.unmodifiableList(options);
	}

	public void setOptions(List<Option> options)
	{
		this.options.clear();
		this.options.addAll(options);
	}

	/** Appends a string literal to the pool. @return its index */
	public int addString(String s)
	{
		strings.add(s);
		return strings.size() - 1;
	}

	/** @return the index of an equal string already pooled, or of the newly added one */
	public int addStringIfNew(String s)
	{
		int index = strings.indexOf(s);
		return index >= 0 ? index : addString(s);
	}

	public List<String> getStrings()
	{
		return Collections.unmodifiableList(strings);
	}

	public Expression getBeforeUpdate()
	{
		return beforeUpdate;
	}

	public void setBeforeUpdate(Expression beforeUpdate)
	{
		this.beforeUpdate = beforeUpdate == null ? Expression.EMPTY : beforeUpdate;
	}

	public Expression getAfterUpdate()
	{
		return afterUpdate;
	}

	public void setAfterUpdate(Expression afterUpdate)
	{
		this.afterUpdate = afterUpdate == null ? Expression.EMPTY : afterUpdate;
	}

	// --- Positions and diagnostics ---

	/**
	 * Reserves a range of virtual offsets for one chunk of input.
	 *
	 * @return the first offset of the range
	 */
	public int reserveOffsets(int length)
	{
		int base = nextOffset;
		nextOffset += length + 1;
		return base;
	}

	public void addPosition(int position, int offset, int line, String path)
	{
		positions.add(position, offset, line, path, null);
	}

	/** Records a breakpoint for a line that sits inside an element of a structured source. */
	public void addPosition(int position, int offset, int line, String path, String structuralPath)
	{
		positions.add(position, offset, line, path, structuralPath);
	}

	public PositionIndex getPositions()
	{
		return positions;
	}

	public SourceLocation locate(Position position)
	{
		return positions.locate(position.getStart());
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}

	public Diagnostic addError(Position position, ErrorKind kind, String msg, String context)
	{
		return errorHandler.logError(position, kind, msg, context);
	}

	public Diagnostic addWarning(Position position, String msg, String context)
	{
		return errorHandler.logWarning(position, msg, context);
	}

	public boolean hasErrors()
	{
		return errorHandler.hasErrors();
	}

	public boolean hasWarnings()
	{
		return errorHandler.hasWarnings();
	}

	public List<Diagnostic> getErrors()
	{
		return errorHandler.getErrors();
	}

	public List<Diagnostic> getWarnings()
	{
		return errorHandler.getWarnings();
	}

	public void clearErrors()
	{
		errorHandler.clearErrors();
	}

	public void clearWarnings()
	{
		errorHandler.clearWarnings();
	}

	// --- Capabilities ---

	/** Capabilities computed by the last type check; all false before it ran. */
	public Capabilities getCapabilities()
	{
		return capabilities;
	}

	public void setCapabilities(Capabilities capabilities)
	{
		this.capabilities = capabilities;
	}

	// --- Traversal ---

	public void accept(DocumentVisitor visitor)
	{
		visitor.visitDocumentBefore(this);
		visitDeclarations(globals, visitor);
		for (Template template : getAllTemplates())
		{
			if (visitor.visitTemplateBefore(template))
			{
				visitDeclarations(template.getDeclarations(), visitor);
				template.getLocations().forEach(visitor::visitLocation);
				template.getBranchpoints().forEach(visitor::visitBranchpoint);
				template.getEdges().forEach(visitor::visitEdge);
				template.getInstanceLines().forEach(visitor::visitInstanceLine);
				template.getMessages().forEach(visitor::visitMessage);
				template.getConditions().forEach(visitor::visitCondition);
				template.getUpdates().forEach(visitor::visitUpdate);
				visitor.visitTemplateAfter(template);
			}
		}
		instances.forEach(visitor::visitInstance);
		lscInstances.forEach(visitor::visitInstance);
		processes.forEach(visitor::visitProcess);
		chanPriorities.forEach(visitor::visitChanPriority);
		queries.forEach(visitor::visitQuery);
		visitor.visitDocumentAfter(this);
	}

	private static void visitDeclarations(Declarations declarations, DocumentVisitor visitor)
	{
		declarations.getFrame().forEachSymbol(s ->
		{
			if (s.getData() instanceof TypeDefinition definition)
			{
				visitor.visitTypeDefinition(definition);
			}
		});
		declarations.getVariables().forEach(visitor::visitVariable);
		declarations.getFunctions().forEach(visitor::visitFunction);
		declarations.getProgress().forEach(visitor::visitProgressMeasure);
		declarations.getGanttChart().forEach(visitor::visitGantt);
		declarations.getIoDecls().forEach(visitor::visitIoDecl);
	}
}
