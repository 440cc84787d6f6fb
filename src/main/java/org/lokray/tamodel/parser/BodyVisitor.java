package org.lokray.tamodel.parser;

import org.lokray.tamodel.builder.DocumentBuilder;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.type.Type;
import org.lokray.tamodel.statement.BlockStatement;
import org.lokray.tamodel.statement.DoWhileStatement;
import org.lokray.tamodel.statement.EmptyStatement;
import org.lokray.tamodel.statement.ExprStatement;
import org.lokray.tamodel.statement.ForStatement;
import org.lokray.tamodel.statement.IfStatement;
import org.lokray.tamodel.statement.IterationStatement;
import org.lokray.tamodel.statement.ReturnStatement;
import org.lokray.tamodel.statement.Statement;
import org.lokray.tamodel.statement.WhileStatement;

/**
 * Builds function bodies. Each block opens a frame for its local declarations.
 */
public class BodyVisitor extends TimedAutomataBaseVisitor<Statement>
{
	private final DocumentBuilder builder;
	private final ExpressionVisitor expressions;

	public BodyVisitor(DocumentBuilder builder, ExpressionVisitor expressions)
	{
		this.builder = builder;
		this.expressions = expressions;
	}

	@Override
	public BlockStatement visitBlock(TimedAutomataParser.BlockContext ctx)
	{
		Frame frame = builder.pushScope();
		BlockStatement block = new BlockStatement(frame, expressions.position(ctx));
		for (TimedAutomataParser.LocalDeclContext local : ctx.localDecl())
		{
			if (local.variableDecl() != null)
			{
				TimedAutomataParser.VariableDeclContext decl = local.variableDecl();
				Type type = expressions.getTypes().visit(decl.type());
				for (TimedAutomataParser.VariableIdContext id : decl.variableId())
				{
					Expression init = expressions.visitOptional(id.initializer());
					builder.addLocalVariable(block, expressions.getTypes().arrayOf(type, id.arraySize()), id.ID().getText(), init, expressions.position(id));
				}
			}
			else
			{
				TimedAutomataParser.TypeDeclContext decl = local.typeDecl();
				Type type = expressions.getTypes().visit(decl.type());
				for (TimedAutomataParser.TypeIdContext id : decl.typeId())
				{
					builder.addTypeDefinition(expressions.getTypes().arrayOf(type, id.arraySize()), id.ID().getText(), expressions.position(id));
				}
			}
		}
		for (TimedAutomataParser.StatementContext statement : ctx.statement())
		{
			block.add(visit(statement));
		}
		builder.popScope();
		return block;
	}

	@Override
	public Statement visitBlockStatement(TimedAutomataParser.BlockStatementContext ctx)
	{
		return visitBlock(ctx.block());
	}

	@Override
	public Statement visitEmptyStatement(TimedAutomataParser.EmptyStatementContext ctx)
	{
		return new EmptyStatement(expressions.position(ctx));
	}

	@Override
	public Statement visitExprStatement(TimedAutomataParser.ExprStatementContext ctx)
	{
		return new ExprStatement(expressions.visit(ctx.commaExpr()));
	}

	@Override
	public Statement visitForStatement(TimedAutomataParser.ForStatementContext ctx)
	{
		return new ForStatement(expressions.visitOptional(ctx.init), expressions.visitOptional(ctx.cond),
				expressions.visitOptional(ctx.step), visit(ctx.statement()), expressions.position(ctx));
	}

	@Override
	public Statement visitIterationStatement(TimedAutomataParser.IterationStatementContext ctx)
	{
		Type type = expressions.getTypes().visit(ctx.type());
		Frame frame = builder.pushScope();
		builder.declare(frame, type, ctx.ID().getText(), expressions.position(ctx.ID()));
		Statement body = visit(ctx.statement());
		builder.popScope();
		return new IterationStatement(frame, body, expressions.position(ctx));
	}

	@Override
	public Statement visitWhileStatement(TimedAutomataParser.WhileStatementContext ctx)
	{
		return new WhileStatement(expressions.visit(ctx.commaExpr()), visit(ctx.statement()), expressions.position(ctx));
	}

	@Override
	public Statement visitDoWhileStatement(TimedAutomataParser.DoWhileStatementContext ctx)
	{
		return new DoWhileStatement(visit(ctx.statement()), expressions.visit(ctx.commaExpr()), expressions.position(ctx));
	}

	@Override
	public Statement visitIfStatement(TimedAutomataParser.IfStatementContext ctx)
	{
		Statement elseBranch = ctx.statement().size() > 1 ? visit(ctx.statement(1)) : null;
		return new IfStatement(expressions.visit(ctx.commaExpr()), visit(ctx.statement(0)), elseBranch, expressions.position(ctx));
	}

	@Override
	public Statement visitReturnStatement(TimedAutomataParser.ReturnStatementContext ctx)
	{
		return new ReturnStatement(expressions.visitOptional(ctx.expression()), expressions.position(ctx));
	}
}
