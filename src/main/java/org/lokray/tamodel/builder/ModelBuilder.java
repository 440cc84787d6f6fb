// File: src/main/java/org/lokray/tamodel/builder/ModelBuilder.java
package org.lokray.tamodel.builder;

import org.lokray.tamodel.document.Branchpoint;
import org.lokray.tamodel.document.ChanPriority;
import org.lokray.tamodel.document.Declarations;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Edge;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.document.Gantt;
import org.lokray.tamodel.document.Instance;
import org.lokray.tamodel.document.InstanceLine;
import org.lokray.tamodel.document.IoDecl;
import org.lokray.tamodel.document.Location;
import org.lokray.tamodel.document.Message;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.document.TypeDefinition;
import org.lokray.tamodel.document.Update;
import org.lokray.tamodel.document.Variable;
import org.lokray.tamodel.dto.FunctionDTO;
import org.lokray.tamodel.dto.LibraryDTO;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.library.LibraryLoader;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.ErrorType;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.ProcessType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.semantic.type.TypeSystem;
import org.lokray.tamodel.statement.BlockStatement;
import org.lokray.tamodel.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link DocumentBuilder}. Turns every {@link SemanticException} raised by the
 * document into a recorded diagnostic, and marks template parameters as restricted when
 * an array size depends on them.
 */
public class ModelBuilder implements DocumentBuilder
{
	private final Document document;
	private final LibraryLoader libraries;
	private final Deque<Frame> scopes = new ArrayDeque<>();
	/** Error-typed stand-ins for undeclared names, one per name. */
	private final Frame placeholders;

	private Template currentTemplate;
	private Function currentFunction;
	private String currentLibraryName;
	private Optional<LibraryDTO> currentLibrary = Optional.empty();
	private Position currentImport;
	private int importedFunctions;

	public ModelBuilder(Document document, LibraryLoader libraries)
	{
		this.document = document;
		this.libraries = libraries;
		this.placeholders = document.getBuiltinFrame().child();
		scopes.push(document.getGlobalFrame());
	}

	@Override
	public Document getDocument()
	{
		return document;
	}

	private void record(Position position, SemanticException e, String context)
	{
		document.addError(position, e.getKind(), e.getMessage(), context);
	}

	@Override
	public void reportError(Position position, ErrorKind kind, String message, String context)
	{
		document.addError(position, kind, message, context);
	}

	private Declarations currentDeclarations()
	{
		return currentTemplate != null ? currentTemplate.getDeclarations() : document.getGlobals();
	}

	// --- Scopes ---

	@Override
	public Frame currentFrame()
	{
		return scopes.peek();
	}

	@Override
	public Frame pushScope()
	{
		Frame frame = currentFrame().child();
		scopes.push(frame);
		return frame;
	}

	@Override
	public void pushScope(Frame frame)
	{
		scopes.push(frame);
	}

	@Override
	public void popScope()
	{
		scopes.pop();
	}

	// --- Symbols ---

	@Override
	public Expression identifier(String name, Position position)
	{
		Optional<Symbol> symbol = currentFrame().resolve(name);
		if (symbol.isPresent())
		{
			return Expression.createIdentifier(symbol.get(), position);
		}
		document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Undeclared identifier", name);
		// Typed as error so the checker does not report the name again.
		Symbol placeholder = placeholders.resolveLocally(name)
				.orElseGet(() -> placeholders.declare(name, ErrorType.INSTANCE, position));
		return Expression.createIdentifier(placeholder, position);
	}

	@Override
	public Type typeName(String name, Position position)
	{
		Optional<Symbol> symbol = currentFrame().resolve(name);
		if (symbol.isPresent() && symbol.get().getData() instanceof TypeDefinition)
		{
			return symbol.get().getType();
		}
		document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Unknown type", name);
		return ErrorType.INSTANCE;
	}

	@Override
	public Optional<Symbol> declare(Frame frame, Type type, String name, Position position)
	{
		try
		{
			return Optional.of(frame.declare(name, type, position));
		}
		catch (SemanticException e)
		{
			record(position, e, name);
			return Optional.empty();
		}
	}

	@Override
	public int addString(String text)
	{
		return document.addStringIfNew(text);
	}

	// --- Declarations ---

	@Override
	public void addVariable(Type type, String name, Expression initializer, Position position)
	{
		try
		{
			document.addVariable(currentDeclarations(), type, name, initializer, position);
			markRestricted(currentTemplate, type);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public void addLocalVariable(BlockStatement block, Type type, String name, Expression initializer, Position position)
	{
		if (currentFunction == null)
		{
			throw new IllegalStateException("Local variable '" + name + "' outside of a function");
		}
		try
		{
			Variable variable = document.addVariableToFunction(currentFunction, currentFrame(), type, name, initializer, position);
			block.addVariable(variable);
			markRestricted(currentTemplate, type);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public void addTypeDefinition(Type type, String name, Position position)
	{
		try
		{
			document.addTypeDefinition(currentFrame(), type, name, position);
			markRestricted(currentTemplate, type);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public Optional<Function> addFunction(Type returnType, String name, Frame parameters, Position position)
	{
		try
		{
			return Optional.of(document.addFunction(currentDeclarations(), signature(returnType, parameters), name, parameters, position));
		}
		catch (SemanticException e)
		{
			record(position, e, name);
			return Optional.empty();
		}
	}

	private static FunctionType signature(Type returnType, Frame parameters)
	{
		List<Type> types = new ArrayList<>();
		parameters.forEachSymbol(p -> types.add(p.getType()));
		return new FunctionType(returnType, types);
	}

	@Override
	public void beginFunction(Function function)
	{
		currentFunction = function;
		pushScope(function.getParameters());
	}

	@Override
	public void endFunction(BlockStatement body)
	{
		currentFunction.setBody(body);
		popScope();
		currentFunction = null;
	}

	@Override
	public void beginImport(String library, Position position)
	{
		currentLibraryName = library;
		currentLibrary = libraries.load(library);
		currentImport = position;
		importedFunctions = 0;
	}

	@Override
	public void addExternalFunction(FunctionType type, String name, String alias, Frame parameters, Position position)
	{
		String modelName = alias != null ? alias : name;
		importedFunctions++;
		try
		{
			document.addExternalFunction(type, modelName, name, currentLibraryName, parameters, position);
		}
		catch (SemanticException e)
		{
			record(position, e, modelName);
			return;
		}
		if (currentLibrary.isEmpty())
		{
			document.addError(position, ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, "Library not found: " + currentLibraryName, name);
		}
		else
		{
			Optional<FunctionDTO> exported = LibraryLoader.findFunction(currentLibrary.get(), name);
			if (exported.isEmpty())
			{
				document.addError(position, ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, "Function not found in library " + currentLibraryName, name);
			}
			else if (!LibraryLoader.matches(type, exported.get()))
			{
				document.addError(position, ErrorKind.TYPE_MISMATCH,
						"Declared signature does not match library " + currentLibraryName + ": " + LibraryLoader.toFunctionType(exported.get()), name);
			}
		}
	}

	@Override
	public void endImport()
	{
		if (currentLibrary.isEmpty() && importedFunctions == 0)
		{
			document.addError(currentImport, ErrorKind.UNRESOLVED_EXTERNAL_FUNCTION, "Library not found", currentLibraryName);
		}
		currentLibraryName = null;
		currentImport = null;
		currentLibrary = Optional.empty();
	}

	@Override
	public void addChanPriority(ChanPriority priority)
	{
		document.addChanPriority(priority);
	}

	@Override
	public void addProgressMeasure(Expression guard, Expression measure)
	{
		document.addProgressMeasure(currentDeclarations(), guard, measure);
	}

	@Override
	public void addGantt(Gantt gantt)
	{
		document.addGantt(currentDeclarations(), gantt);
	}

	@Override
	public void addIoDecl(IoDecl decl)
	{
		document.addIoDecl(currentDeclarations(), decl);
	}

	@Override
	public void setBeforeUpdate(Expression update)
	{
		document.setBeforeUpdate(update);
	}

	@Override
	public void setAfterUpdate(Expression update)
	{
		document.setAfterUpdate(update);
	}

	// --- Templates ---

	@Override
	public Frame newParameterFrame()
	{
		return currentFrame().child();
	}

	@Override
	public void declareDynamicTemplate(String name, Frame parameters, Position position)
	{
		try
		{
			Template template = document.addDynamicTemplate(name, parameters, position);
			parameters.forEachSymbol(p -> markRestricted(template, p.getType()));
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public Optional<Template> beginTemplate(String name, Frame parameters, Position position)
	{
		Optional<Template> declared = document.getDynamicTemplate(name).filter(t -> !t.isDefined());
		Template template;
		if (declared.isPresent())
		{
			template = declared.get();
			if (!sameParameters(template.getParameters(), parameters))
			{
				document.addError(position, ErrorKind.TYPE_MISMATCH, "Parameters do not match the declaration of dynamic template", name);
			}
			document.defineDynamicTemplate(template);
		}
		else
		{
			try
			{
				template = document.addTemplate(name, parameters, position);
			}
			catch (SemanticException e)
			{
				record(position, e, name);
				return Optional.empty();
			}
		}
		return Optional.of(enter(template));
	}

	@Override
	public Optional<Template> beginScenario(String name, Frame parameters, String type, String mode, Position position)
	{
		try
		{
			return Optional.of(enter(document.addTemplate(name, parameters, position, false, type, mode)));
		}
		catch (SemanticException e)
		{
			record(position, e, name);
			return Optional.empty();
		}
	}

	private Template enter(Template template)
	{
		currentTemplate = template;
		pushScope(template.getFrame());
		template.getParameters().forEachSymbol(p -> markRestricted(template, p.getType()));
		Debug.logDebug("Building template " + template.getName());
		return template;
	}

	private static boolean sameParameters(Frame declared, Frame defined)
	{
		if (declared.size() != defined.size())
		{
			return false;
		}
		for (int i = 0; i < declared.size(); i++)
		{
			Symbol d = declared.get(i);
			Symbol p = defined.get(i);
			if (!d.getName().equals(p.getName()) || !TypeSystem.structuralEqual(d.getType(), p.getType())
					|| d.getType().isReference() != p.getType().isReference())
			{
				return false;
			}
		}
		return true;
	}

	@Override
	public void endTemplate()
	{
		popScope();
		currentTemplate = null;
	}

	/**
	 * Marks the parameters of the template that a size inside the type depends on,
	 * following the initializers of constants.
	 */
	private static void markRestricted(Template template, Type type)
	{
		if (template != null)
		{
			restrict(template, TypeSystem.collectSizeDependencies(type), new HashSet<>());
		}
	}

	private static void restrict(Template template, Set<Symbol> symbols, Set<Symbol> seen)
	{
		for (Symbol s : symbols)
		{
			if (!seen.add(s))
			{
				continue;
			}
			if (template.getParameters().contains(s))
			{
				template.getInstance().addRestricted(s);
			}
			else
			{
				Variable variable = s.getDataAs(Variable.class);
				if (variable != null && s.getType().isConstant())
				{
					restrict(template, variable.getInitializer().collectSymbols(), seen);
				}
			}
		}
	}

	@Override
	public void addLocation(String name, Expression invariant, Expression expRate, Position position)
	{
		try
		{
			currentTemplate.addLocation(name, invariant, expRate, position);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	private Optional<Location> location(String name, Position position)
	{
		Location location = currentTemplate.getFrame().resolveLocally(name).map(s -> s.getDataAs(Location.class)).orElse(null);
		if (location == null)
		{
			document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Unknown location", name);
		}
		return Optional.ofNullable(location);
	}

	@Override
	public void setCommitted(String name, Position position)
	{
		location(name, position).ifPresent(l -> l.setCommitted(true));
	}

	@Override
	public void setUrgent(String name, Position position)
	{
		location(name, position).ifPresent(l -> l.setUrgent(true));
	}

	@Override
	public void addBranchpoint(String name, Position position)
	{
		try
		{
			currentTemplate.addBranchpoint(name, position);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public void setInit(String name, Position position)
	{
		location(name, position).ifPresent(l -> currentTemplate.setInit(l.getSymbol()));
	}

	@Override
	public Optional<Edge> addEdge(String source, String destination, boolean controllable, String actionName, Position position)
	{
		Optional<Symbol> from = node(source, position);
		Optional<Symbol> to = node(destination, position);
		if (from.isEmpty() || to.isEmpty())
		{
			return Optional.empty();
		}
		try
		{
			return Optional.of(currentTemplate.addEdge(from.get(), to.get(), controllable, actionName));
		}
		catch (SemanticException e)
		{
			record(position, e, source + " -> " + destination);
			return Optional.empty();
		}
	}

	private Optional<Symbol> node(String name, Position position)
	{
		Optional<Symbol> symbol = currentTemplate.getFrame().resolveLocally(name)
				.filter(s -> s.getData() instanceof Location || s.getData() instanceof Branchpoint);
		if (symbol.isEmpty())
		{
			document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Unknown location or branchpoint", name);
		}
		return symbol;
	}

	@Override
	public void addInstanceLine(String name, String process, Position position)
	{
		Instance instance = null;
		if (process != null)
		{
			instance = processInstance(document.getSystemFrame(), process, position).orElse(null);
		}
		try
		{
			currentTemplate.addInstanceLine(name, instance, position);
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	private Optional<Symbol> line(String name, Position position)
	{
		Optional<Symbol> symbol = currentTemplate.getFrame().resolveLocally(name).filter(s -> s.getData() instanceof InstanceLine);
		if (symbol.isEmpty())
		{
			document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Unknown instance line", name);
		}
		return symbol;
	}

	@Override
	public void addMessage(int location, String source, String destination, Expression label, boolean inPrechart, Position position)
	{
		Optional<Symbol> from = line(source, position);
		Optional<Symbol> to = line(destination, position);
		if (from.isPresent() && to.isPresent())
		{
			Message message = currentTemplate.addMessage(from.get(), to.get(), location, inPrechart);
			message.setLabel(label);
		}
	}

	@Override
	public void addCondition(int location, List<String> anchors, Expression label, boolean hot, boolean inPrechart, Position position)
	{
		List<Symbol> lines = new ArrayList<>();
		for (String anchor : anchors)
		{
			line(anchor, position).ifPresent(lines::add);
		}
		if (lines.size() == anchors.size())
		{
			currentTemplate.addCondition(lines, location, inPrechart, hot).setLabel(label);
		}
	}

	@Override
	public void addUpdate(int location, String anchor, Expression label, boolean inPrechart, Position position)
	{
		line(anchor, position).ifPresent(s ->
		{
			Update update = currentTemplate.addUpdate(s, location, inPrechart);
			update.setLabel(label);
		});
	}

	// --- System ---

	private Optional<Instance> processInstance(Frame frame, String name, Position position)
	{
		Optional<Symbol> symbol = frame.resolve(name);
		if (symbol.isPresent() && symbol.get().getType().strip() instanceof ProcessType process)
		{
			return Optional.of(process.getInstance());
		}
		document.addError(position, ErrorKind.UNDECLARED_SYMBOL, "Unknown template or instance", name);
		return Optional.empty();
	}

	@Override
	public void addInstance(String name, String target, Frame parameters, List<Expression> arguments, Position position)
	{
		Optional<Instance> instance = processInstance(currentFrame(), target, position);
		if (instance.isEmpty())
		{
			return;
		}
		try
		{
			if (instance.get().getTemplate().isTA())
			{
				document.addInstance(name, instance.get(), parameters, arguments, position);
			}
			else
			{
				document.addLscInstance(name, instance.get(), parameters, arguments, position);
			}
		}
		catch (SemanticException e)
		{
			record(position, e, name);
		}
	}

	@Override
	public void addProcess(String name, Position position)
	{
		processInstance(document.getSystemFrame(), name, position).ifPresent(instance ->
		{
			if (document.getProcesses().contains(instance))
			{
				document.addError(position, ErrorKind.DUPLICATE_SYMBOL, "Process listed twice in the system line", name);
				return;
			}
			document.addProcess(instance);
			document.setProcessPriority(name);
		});
	}

	@Override
	public void incrementProcessPriority()
	{
		document.incrementProcessPriority();
	}
}
