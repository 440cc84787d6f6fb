package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.Token;
import org.lokray.tamodel.builder.DocumentBuilder;
import org.lokray.tamodel.document.ChanPriority;
import org.lokray.tamodel.document.Edge;
import org.lokray.tamodel.document.Function;
import org.lokray.tamodel.document.Gantt;
import org.lokray.tamodel.document.IoDecl;
import org.lokray.tamodel.document.Template;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.type.FunctionType;
import org.lokray.tamodel.semantic.type.QualifiedType;
import org.lokray.tamodel.semantic.type.Qualifier;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.statement.BlockStatement;
import org.lokray.tamodel.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a parsed model in source order and feeds every declaration, template and system
 * line to a {@link DocumentBuilder}.
 */
public class DeclarationVisitor extends TimedAutomataBaseVisitor<Void>
{
	private final DocumentBuilder builder;
	private final ExpressionVisitor expressions;
	private final TypeVisitor types;
	private final BodyVisitor bodies;
	private boolean systemSeen;

	public DeclarationVisitor(DocumentBuilder builder, int base)
	{
		this.builder = builder;
		this.expressions = new ExpressionVisitor(builder, base);
		this.types = expressions.getTypes();
		this.bodies = new BodyVisitor(builder, expressions);
	}

	// --- Declarations ---

	@Override
	public Void visitVariableDecl(TimedAutomataParser.VariableDeclContext ctx)
	{
		Type type = types.visit(ctx.type());
		for (TimedAutomataParser.VariableIdContext id : ctx.variableId())
		{
			Expression init = expressions.visitOptional(id.initializer());
			builder.addVariable(types.arrayOf(type, id.arraySize()), id.ID().getText(), init, expressions.position(id));
		}
		return null;
	}

	@Override
	public Void visitTypeDecl(TimedAutomataParser.TypeDeclContext ctx)
	{
		Type type = types.visit(ctx.type());
		for (TimedAutomataParser.TypeIdContext id : ctx.typeId())
		{
			builder.addTypeDefinition(types.arrayOf(type, id.arraySize()), id.ID().getText(), expressions.position(id));
		}
		return null;
	}

	@Override
	public Void visitFunctionDecl(TimedAutomataParser.FunctionDeclContext ctx)
	{
		Type returnType = types.visit(ctx.type());
		Frame parameters = parameters(ctx.parameterList());
		Optional<Function> function = builder.addFunction(returnType, ctx.ID().getText(), parameters, expressions.position(ctx.ID()));
		if (function.isPresent())
		{
			builder.beginFunction(function.get());
			BlockStatement body = bodies.visitBlock(ctx.block());
			builder.endFunction(body);
		}
		return null;
	}

	/**
	 * Declares parameters in a fresh frame. Array sizes may refer to earlier parameters
	 * of the same list.
	 */
	private Frame parameters(TimedAutomataParser.ParameterListContext ctx)
	{
		Frame parameters = builder.newParameterFrame();
		if (ctx == null)
		{
			return parameters;
		}
		builder.pushScope(parameters);
		for (TimedAutomataParser.ParameterContext p : ctx.parameter())
		{
			Type type = types.arrayOf(types.visit(p.type()), p.arraySize());
			if (p.REF() != null)
			{
				type = QualifiedType.of(Qualifier.REF, type);
			}
			builder.declare(parameters, type, p.ID().getText(), expressions.position(p.ID()));
		}
		builder.popScope();
		return parameters;
	}

	private static List<Type> parameterTypes(Frame parameters)
	{
		List<Type> result = new ArrayList<>();
		parameters.forEachSymbol(p -> result.add(p.getType()));
		return result;
	}

	@Override
	public Void visitImportDecl(TimedAutomataParser.ImportDeclContext ctx)
	{
		String library = ExpressionVisitor.unquote(ctx.STRING().getText());
		builder.beginImport(library, expressions.position(ctx.STRING()));
		for (TimedAutomataParser.ImportedFunctionContext f : ctx.importedFunction())
		{
			Type returnType = types.visit(f.type());
			Frame parameters = parameters(f.parameterList());
			FunctionType type = new FunctionType(returnType, parameterTypes(parameters));
			String alias = f.alias == null ? null : f.alias.getText();
			builder.addExternalFunction(type, f.ID(0).getText(), alias, parameters, expressions.position(f));
		}
		builder.endImport();
		return null;
	}

	// --- Priorities, progress, gantt, io, hooks ---

	@Override
	public Void visitChanPriorityDecl(TimedAutomataParser.ChanPriorityDeclContext ctx)
	{
		List<TimedAutomataParser.ChanPriorityEntryContext> entries = ctx.chanPriorityEntry();
		ChanPriority priority = new ChanPriority(priorityEntry(entries.get(0)), expressions.position(ctx));
		for (int i = 1; i < entries.size(); i++)
		{
			priority.add(ctx.separator.get(i - 1).getText().charAt(0), priorityEntry(entries.get(i)));
		}
		builder.addChanPriority(priority);
		return null;
	}

	private Expression priorityEntry(TimedAutomataParser.ChanPriorityEntryContext ctx)
	{
		return ctx.channelRef() == null ? Expression.EMPTY : expressions.visit(ctx.channelRef());
	}

	@Override
	public Void visitProgressDecl(TimedAutomataParser.ProgressDeclContext ctx)
	{
		for (TimedAutomataParser.ProgressEntryContext entry : ctx.progressEntry())
		{
			builder.addProgressMeasure(expressions.visitOptional(entry.guard), expressions.visit(entry.measure));
		}
		return null;
	}

	@Override
	public Void visitGanttDecl(TimedAutomataParser.GanttDeclContext ctx)
	{
		for (TimedAutomataParser.GanttEntryContext entry : ctx.ganttEntry())
		{
			Frame parameters = builder.pushScope();
			declareBinders(entry.binderList(), parameters);
			Gantt gantt = new Gantt(entry.ID().getText(), parameters);
			for (TimedAutomataParser.GanttMappingContext mapping : entry.ganttMapping())
			{
				Frame select = builder.pushScope();
				declareBinders(mapping.binderList(), select);
				gantt.addMapping(new Gantt.Mapping(select, expressions.visit(mapping.predicate), expressions.visit(mapping.colour)));
				builder.popScope();
			}
			builder.popScope();
			builder.addGantt(gantt);
		}
		return null;
	}

	private void declareBinders(TimedAutomataParser.BinderListContext ctx, Frame frame)
	{
		if (ctx == null)
		{
			return;
		}
		for (TimedAutomataParser.BinderContext binder : ctx.binder())
		{
			builder.declare(frame, types.visit(binder.type()), binder.ID().getText(), expressions.position(binder.ID()));
		}
	}

	@Override
	public Void visitIoDecl(TimedAutomataParser.IoDeclContext ctx)
	{
		IoDecl decl = new IoDecl(ctx.ID().getText());
		decl.getParameters().addAll(expressions.arguments(ctx.argList()));
		for (TimedAutomataParser.IoItemContext item : ctx.ioItem())
		{
			Expression channel = expressions.visit(item.channelRef());
			if (item.direction == null)
			{
				decl.getCsp().add(channel);
			}
			else if ("?".equals(item.direction.getText()))
			{
				decl.getInputs().add(channel);
			}
			else
			{
				decl.getOutputs().add(channel);
			}
		}
		builder.addIoDecl(decl);
		return null;
	}

	@Override
	public Void visitUpdateHook(TimedAutomataParser.UpdateHookContext ctx)
	{
		Expression update = expressions.visitOptional(ctx.commaExpr());
		if ("before_update".equals(ctx.kind.getText()))
		{
			builder.setBeforeUpdate(update);
		}
		else
		{
			builder.setAfterUpdate(update);
		}
		return null;
	}

	// --- Templates ---

	@Override
	public Void visitDynamicDecl(TimedAutomataParser.DynamicDeclContext ctx)
	{
		builder.declareDynamicTemplate(ctx.ID().getText(), parameters(ctx.parameterList()), expressions.position(ctx.ID()));
		return null;
	}

	@Override
	public Void visitTemplateDecl(TimedAutomataParser.TemplateDeclContext ctx)
	{
		Frame parameters = parameters(ctx.parameterList());
		Optional<Template> template = builder.beginTemplate(ctx.ID().getText(), parameters, expressions.position(ctx.ID()));
		if (template.isEmpty())
		{
			Debug.logDebug("Skipping body of template " + ctx.ID().getText());
			return null;
		}
		for (TimedAutomataParser.DeclarationContext declaration : ctx.declaration())
		{
			visit(declaration);
		}
		for (TimedAutomataParser.LocationDeclContext location : ctx.stateDecl().locationDecl())
		{
			builder.addLocation(location.ID().getText(), expressions.visitOptional(location.invariant),
					expressions.visitOptional(location.expRate), expressions.position(location));
		}
		if (ctx.commitDecl() != null)
		{
			ctx.commitDecl().ID().forEach(id -> builder.setCommitted(id.getText(), expressions.position(id)));
		}
		if (ctx.urgentDecl() != null)
		{
			ctx.urgentDecl().ID().forEach(id -> builder.setUrgent(id.getText(), expressions.position(id)));
		}
		if (ctx.branchpointDecl() != null)
		{
			ctx.branchpointDecl().ID().forEach(id -> builder.addBranchpoint(id.getText(), expressions.position(id)));
		}
		builder.setInit(ctx.initDecl().ID().getText(), expressions.position(ctx.initDecl().ID()));
		if (ctx.transDecl() != null)
		{
			for (TimedAutomataParser.EdgeDeclContext edge : ctx.transDecl().edgeDecl())
			{
				edge(edge);
			}
		}
		builder.endTemplate();
		return null;
	}

	private void edge(TimedAutomataParser.EdgeDeclContext ctx)
	{
		String action = null;
		for (TimedAutomataParser.EdgeLabelContext label : ctx.edgeLabel())
		{
			if (label instanceof TimedAutomataParser.ActionLabelContext a)
			{
				action = a.ID().getText();
			}
		}
		Position position = expressions.position(ctx);
		Optional<Edge> edge = builder.addEdge(ctx.source.getText(), ctx.destination.getText(), "->".equals(ctx.arrow.getText()), action, position);

		// Labels of an edge that could not be created are still resolved for diagnostics.
		Frame select = edge.map(Edge::getSelect).orElseGet(() -> builder.currentFrame().child());
		builder.pushScope(select);
		for (TimedAutomataParser.EdgeLabelContext label : ctx.edgeLabel())
		{
			if (label instanceof TimedAutomataParser.SelectLabelContext s)
			{
				declareBinders(s.binderList(), select);
			}
			else if (label instanceof TimedAutomataParser.GuardLabelContext g)
			{
				Expression guard = expressions.visit(g.expression());
				edge.ifPresent(e -> e.setGuard(guard));
			}
			else if (label instanceof TimedAutomataParser.SyncLabelContext s)
			{
				ExprKind kind = "!".equals(s.direction.getText()) ? ExprKind.SYNC_SEND : ExprKind.SYNC_RECV;
				Expression sync = Expression.createUnary(kind, expressions.visit(s.expression()), expressions.position(s));
				edge.ifPresent(e -> e.setSync(sync));
			}
			else if (label instanceof TimedAutomataParser.AssignLabelContext a)
			{
				Expression assign = expressions.visit(a.commaExpr());
				edge.ifPresent(e -> e.setAssign(assign));
			}
			else if (label instanceof TimedAutomataParser.ProbabilityLabelContext p)
			{
				Expression probability = expressions.visit(p.expression());
				edge.ifPresent(e -> e.setProbability(probability));
			}
		}
		builder.popScope();
	}

	@Override
	public Void visitScenarioDecl(TimedAutomataParser.ScenarioDeclContext ctx)
	{
		Frame parameters = parameters(ctx.parameterList());
		String name = ctx.ID(0).getText();
		Optional<Template> template = builder.beginScenario(name, parameters, ctx.chartType.getText(), ctx.chartMode.getText(), expressions.position(ctx.ID(0)));
		if (template.isEmpty())
		{
			return null;
		}
		for (TimedAutomataParser.DeclarationContext declaration : ctx.declaration())
		{
			visit(declaration);
		}
		for (TimedAutomataParser.ScenarioItemContext item : ctx.scenarioItem())
		{
			visit(item);
		}
		builder.endTemplate();
		return null;
	}

	@Override
	public Void visitInstanceLineItem(TimedAutomataParser.InstanceLineItemContext ctx)
	{
		String process = ctx.process == null ? null : ctx.process.getText();
		builder.addInstanceLine(ctx.ID(0).getText(), process, expressions.position(ctx));
		return null;
	}

	@Override
	public Void visitMessageItem(TimedAutomataParser.MessageItemContext ctx)
	{
		builder.addMessage(location(ctx.NAT().getSymbol()), ctx.source.getText(), ctx.destination.getText(),
				expressions.visitOptional(ctx.expression()), ctx.PRECHART() != null, expressions.position(ctx));
		return null;
	}

	@Override
	public Void visitConditionItem(TimedAutomataParser.ConditionItemContext ctx)
	{
		List<String> anchors = new ArrayList<>();
		ctx.ID().forEach(id -> anchors.add(id.getText()));
		builder.addCondition(location(ctx.NAT().getSymbol()), anchors, expressions.visitOptional(ctx.expression()),
				ctx.HOT() != null, ctx.PRECHART() != null, expressions.position(ctx));
		return null;
	}

	@Override
	public Void visitUpdateItem(TimedAutomataParser.UpdateItemContext ctx)
	{
		builder.addUpdate(location(ctx.NAT().getSymbol()), ctx.ID().getText(), expressions.visitOptional(ctx.commaExpr()),
				ctx.PRECHART() != null, expressions.position(ctx));
		return null;
	}

	private int location(Token nat)
	{
		try
		{
			return Integer.parseInt(nat.getText());
		}
		catch (NumberFormatException e)
		{
			builder.reportError(expressions.position(nat), ErrorKind.GENERAL, "Location number out of range", nat.getText());
			return 0;
		}
	}

	// --- System ---

	@Override
	public Void visitInstantiation(TimedAutomataParser.InstantiationContext ctx)
	{
		builder.pushScope(builder.getDocument().getSystemFrame());
		Frame parameters = parameters(ctx.parameterList());
		builder.pushScope(parameters);
		List<Expression> arguments = expressions.arguments(ctx.argList());
		builder.popScope();
		builder.addInstance(ctx.ID(0).getText(), ctx.target.getText(), parameters, arguments, expressions.position(ctx));
		builder.popScope();
		return null;
	}

	@Override
	public Void visitSystemLine(TimedAutomataParser.SystemLineContext ctx)
	{
		if (systemSeen)
		{
			builder.reportError(expressions.position(ctx), ErrorKind.GENERAL, "Duplicate system line", "system");
			return null;
		}
		systemSeen = true;
		for (int i = 0; i < ctx.ID().size(); i++)
		{
			if (i > 0 && "<".equals(ctx.separator.get(i - 1).getText()))
			{
				builder.incrementProcessPriority();
			}
			builder.addProcess(ctx.ID(i).getText(), expressions.position(ctx.ID(i)));
		}
		return null;
	}
}
