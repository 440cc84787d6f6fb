package org.lokray.tamodel.builder;

import org.lokray.tamodel.document.ChanPriority;
import org.lokray.tamodel.document.Document;
import org.lokray.tamodel.document.Edge;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.document.Gantt;
import org.lokray.tamodel.document.IoDecl;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.statement.BlockStatement;

import java.util.List;
import java.util.Optional;

/**
 * Callbacks a parser invokes, in source order, to populate a {@link Document}.
 * Implementations never throw on semantic problems: they record a diagnostic and carry on
 * with a placeholder so later declarations are still processed.
 */
public interface DocumentBuilder
{
	Document getDocument();

	// --- Scopes ---

	Frame currentFrame();

	/** Opens a new frame nested in the current one and makes it current. */
	Frame pushScope();

	void pushScope(Frame frame);

	void popScope();

	// --- Symbols ---

	/**
	 * Resolves an identifier in the current scope. An undeclared name is reported and
	 * yields an identifier of the error type.
	 */
	Expression identifier(String name, Position position);

	/** Resolves a type name declared with typedef. Unknown names are reported. */
	Type typeName(String name, Position position);

	/**
	 * Declares a parameter, record field or binder in the given frame.
	 *
	 * @return the symbol, or empty if the name was already taken
	 */
	Optional<Symbol> declare(Frame frame, Type type, String name, Position position);

	int addString(String text);

	// --- Declarations ---

	void addVariable(Type type, String name, Expression initializer, Position position);

	void addLocalVariable(BlockStatement block, Type type, String name, Expression initializer, Position position);

	void addTypeDefinition(Type type, String name, Position position);

	Optional<Function> addFunction(Type returnType, String name, Frame parameters, Position position);

	/** Makes the function's parameter frame current until {@link #endFunction}. */
	void beginFunction(Function function);

	void endFunction(BlockStatement body);

	/**
	 * Starts an {@code import} block. Each function imported from a library that cannot be
	 * found is unresolved; an empty block naming such a library is reported on its own.
	 */
	void beginImport(String library, Position position);

	void addExternalFunction(FunctionType type, String name, String alias, Frame parameters, Position position);

	void endImport();

	void addChanPriority(ChanPriority priority);

	void addProgressMeasure(Expression guard, Expression measure);

	void addGantt(Gantt gantt);

	void addIoDecl(IoDecl decl);

	void setBeforeUpdate(Expression update);

	void setAfterUpdate(Expression update);

	// --- Templates ---

	/** Frame for the parameters of a template or instance, nested in the current one. */
	Frame newParameterFrame();

	void declareDynamicTemplate(String name, Frame parameters, Position position);

	/**
	 * Opens a timed automaton template, or gives the body of a declared dynamic template,
	 * and makes its frame current until {@link #endTemplate}. Empty if the name is taken,
	 * in which case the body is skipped.
	 */
	Optional<Template> beginTemplate(String name, Frame parameters, Position position);

	Optional<Template> beginScenario(String name, Frame parameters, String type, String mode, Position position);

	void endTemplate();

	void addLocation(String name, Expression invariant, Expression expRate, Position position);

	void setCommitted(String name, Position position);

	void setUrgent(String name, Position position);

	void addBranchpoint(String name, Position position);

	void setInit(String name, Position position);

	Optional<Edge> addEdge(String source, String destination, boolean controllable, String actionName, Position position);

	void addInstanceLine(String name, String process, Position position);

	void addMessage(int location, String source, String destination, Expression label, boolean inPrechart, Position position);

	void addCondition(int location, List<String> anchors, Expression label, boolean hot, boolean inPrechart, Position position);

	void addUpdate(int location, String anchor, Expression label, boolean inPrechart, Position position);

	// --- System ---

	void addInstance(String name, String target, Frame parameters, List<Expression> arguments, Position position);

	void addProcess(String name, Position position);

	/** Processes added after this call get the next higher priority. */
	void incrementProcessPriority();

	void reportError(Position position, ErrorKind kind, String message, String context);
}
