package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.tamodel.builder.DocumentBuilder;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link Expression} trees. Identifiers are resolved while building, against
 * whatever scope the builder has current.
 */
public class ExpressionVisitor extends TimedAutomataBaseVisitor<Expression>
{
	private final DocumentBuilder builder;
	private final int base;
	private final TypeVisitor types;

	public ExpressionVisitor(DocumentBuilder builder, int base)
	{
		this.builder = builder;
		this.base = base;
		this.types = new TypeVisitor(builder, this, base);
	}

	public TypeVisitor getTypes()
	{
		return types;
	}

	Position position(ParserRuleContext ctx)
	{
		return SourceRange.of(ctx, base);
	}

	Position position(TerminalNode node)
	{
		return SourceRange.of(node, base);
	}

	Position position(Token token)
	{
		return SourceRange.of(token, base);
	}

	/** Visits an optional sub-tree, giving the empty expression when it is absent. */
	public Expression visitOptional(ParserRuleContext ctx)
	{
		return ctx == null ? Expression.EMPTY : visit(ctx);
	}

	public List<Expression> arguments(TimedAutomataParser.ArgListContext ctx)
	{
		List<Expression> arguments = new ArrayList<>();
		if (ctx != null)
		{
			for (TimedAutomataParser.ExpressionContext e : ctx.expression())
			{
				arguments.add(visit(e));
			}
		}
		return arguments;
	}

	@Override
	public Expression visitCommaExpr(TimedAutomataParser.CommaExprContext ctx)
	{
		if (ctx.expression().size() == 1)
		{
			return visit(ctx.expression(0));
		}
		List<Expression> parts = new ArrayList<>();
		for (TimedAutomataParser.ExpressionContext e : ctx.expression())
		{
			parts.add(visit(e));
		}
		return Expression.createNary(ExprKind.COMMA, parts, position(ctx));
	}

	@Override
	public Expression visitExprInitializer(TimedAutomataParser.ExprInitializerContext ctx)
	{
		return visit(ctx.expression());
	}

	@Override
	public Expression visitListInitializer(TimedAutomataParser.ListInitializerContext ctx)
	{
		// Field names in record initializers are positional; the names are not kept.
		List<Expression> elements = new ArrayList<>();
		for (TimedAutomataParser.FieldInitContext field : ctx.fieldInit())
		{
			elements.add(visit(field.initializer()));
		}
		return Expression.createNary(ExprKind.LIST, elements, position(ctx));
	}

	@Override
	public Expression visitChannelRef(TimedAutomataParser.ChannelRefContext ctx)
	{
		Expression channel = builder.identifier(ctx.ID().getText(), position(ctx.ID()));
		for (TimedAutomataParser.ExpressionContext index : ctx.expression())
		{
			channel = Expression.createBinary(ExprKind.INDEX, channel, visit(index), position(ctx));
		}
		return channel;
	}

	// --- Primaries ---

	@Override
	public Expression visitPrimaryExpr(TimedAutomataParser.PrimaryExprContext ctx)
	{
		return visit(ctx.primary());
	}

	@Override
	public Expression visitNatLiteral(TimedAutomataParser.NatLiteralContext ctx)
	{
		try
		{
			return Expression.createConstant(Long.parseLong(ctx.getText()), position(ctx));
		}
		catch (NumberFormatException e)
		{
			builder.reportError(position(ctx), ErrorKind.GENERAL, "Integer literal out of range", ctx.getText());
			return Expression.createConstant(0, position(ctx));
		}
	}

	@Override
	public Expression visitFloatLiteral(TimedAutomataParser.FloatLiteralContext ctx)
	{
		return Expression.createDouble(Double.parseDouble(ctx.getText()), position(ctx));
	}

	@Override
	public Expression visitBoolLiteral(TimedAutomataParser.BoolLiteralContext ctx)
	{
		return Expression.createBool("true".equals(ctx.getText()), position(ctx));
	}

	@Override
	public Expression visitStringLiteral(TimedAutomataParser.StringLiteralContext ctx)
	{
		String text = unquote(ctx.getText());
		return Expression.createString(text, builder.addString(text), position(ctx));
	}

	static String unquote(String literal)
	{
		String body = literal.substring(1, literal.length() - 1);
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++)
		{
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length())
			{
				char next = body.charAt(++i);
				sb.append(switch (next)
				{
					case 'n' -> '\n';
					case 't' -> '\t';
					default -> next;
				});
			}
			else
			{
				sb.append(c);
			}
		}
		return sb.toString();
	}

	@Override
	public Expression visitDeadlockLiteral(TimedAutomataParser.DeadlockLiteralContext ctx)
	{
		return Expression.createNary(ExprKind.DEADLOCK, List.of(), position(ctx));
	}

	@Override
	public Expression visitSpawnCall(TimedAutomataParser.SpawnCallContext ctx)
	{
		List<Expression> operands = new ArrayList<>();
		operands.add(builder.identifier(ctx.ID().getText(), position(ctx.ID())));
		operands.addAll(arguments(ctx.argList()));
		return Expression.createNary(ExprKind.SPAWN, operands, position(ctx));
	}

	@Override
	public Expression visitExitCall(TimedAutomataParser.ExitCallContext ctx)
	{
		return Expression.createNary(ExprKind.EXIT, List.of(), position(ctx));
	}

	@Override
	public Expression visitIdentifier(TimedAutomataParser.IdentifierContext ctx)
	{
		return builder.identifier(ctx.ID().getText(), position(ctx));
	}

	@Override
	public Expression visitParenthesized(TimedAutomataParser.ParenthesizedContext ctx)
	{
		return visit(ctx.commaExpr());
	}

	// --- Postfix and unary ---

	@Override
	public Expression visitIndexExpr(TimedAutomataParser.IndexExprContext ctx)
	{
		return binary(ExprKind.INDEX, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitDotExpr(TimedAutomataParser.DotExprContext ctx)
	{
		return Expression.createDot(visit(ctx.expression()), ctx.ID().getText(), position(ctx));
	}

	@Override
	public Expression visitRateExpr(TimedAutomataParser.RateExprContext ctx)
	{
		return Expression.createUnary(ExprKind.RATE, visit(ctx.expression()), position(ctx));
	}

	@Override
	public Expression visitCallExpr(TimedAutomataParser.CallExprContext ctx)
	{
		List<Expression> operands = new ArrayList<>();
		operands.add(visit(ctx.expression()));
		operands.addAll(arguments(ctx.argList()));
		return Expression.createNary(ExprKind.FUNCALL, operands, position(ctx));
	}

	@Override
	public Expression visitPostfixExpr(TimedAutomataParser.PostfixExprContext ctx)
	{
		ExprKind kind = "++".equals(ctx.op.getText()) ? ExprKind.POST_INCREMENT : ExprKind.POST_DECREMENT;
		return Expression.createUnary(kind, visit(ctx.expression()), position(ctx));
	}

	@Override
	public Expression visitPrefixExpr(TimedAutomataParser.PrefixExprContext ctx)
	{
		ExprKind kind = "++".equals(ctx.op.getText()) ? ExprKind.PRE_INCREMENT : ExprKind.PRE_DECREMENT;
		return Expression.createUnary(kind, visit(ctx.expression()), position(ctx));
	}

	@Override
	public Expression visitUnaryExpr(TimedAutomataParser.UnaryExprContext ctx)
	{
		ExprKind kind = switch (ctx.op.getText())
		{
			case "-" -> ExprKind.UNARY_MINUS;
			case "+" -> ExprKind.UNARY_PLUS;
			default -> ExprKind.NOT;
		};
		return Expression.createUnary(kind, visit(ctx.expression()), position(ctx));
	}

	// --- Binary operators ---

	private Expression binary(ExprKind kind, TimedAutomataParser.ExpressionContext left, TimedAutomataParser.ExpressionContext right, ParserRuleContext ctx)
	{
		return Expression.createBinary(kind, visit(left), visit(right), position(ctx));
	}

	@Override
	public Expression visitPowerExpr(TimedAutomataParser.PowerExprContext ctx)
	{
		return binary(ExprKind.POW, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitMultiplicativeExpr(TimedAutomataParser.MultiplicativeExprContext ctx)
	{
		ExprKind kind = switch (ctx.op.getText())
		{
			case "*" -> ExprKind.MULT;
			case "/" -> ExprKind.DIV;
			default -> ExprKind.MOD;
		};
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitAdditiveExpr(TimedAutomataParser.AdditiveExprContext ctx)
	{
		ExprKind kind = "+".equals(ctx.op.getText()) ? ExprKind.PLUS : ExprKind.MINUS;
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitShiftExpr(TimedAutomataParser.ShiftExprContext ctx)
	{
		ExprKind kind = "<<".equals(ctx.op.getText()) ? ExprKind.LSHIFT : ExprKind.RSHIFT;
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitMinMaxExpr(TimedAutomataParser.MinMaxExprContext ctx)
	{
		ExprKind kind = "<?".equals(ctx.op.getText()) ? ExprKind.MIN : ExprKind.MAX;
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitRelationalExpr(TimedAutomataParser.RelationalExprContext ctx)
	{
		ExprKind kind = switch (ctx.op.getText())
		{
			case "<" -> ExprKind.LT;
			case "<=" -> ExprKind.LE;
			case ">=" -> ExprKind.GE;
			default -> ExprKind.GT;
		};
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitEqualityExpr(TimedAutomataParser.EqualityExprContext ctx)
	{
		ExprKind kind = "==".equals(ctx.op.getText()) ? ExprKind.EQ : ExprKind.NEQ;
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitBitAndExpr(TimedAutomataParser.BitAndExprContext ctx)
	{
		return binary(ExprKind.BIT_AND, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitBitXorExpr(TimedAutomataParser.BitXorExprContext ctx)
	{
		return binary(ExprKind.BIT_XOR, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitBitOrExpr(TimedAutomataParser.BitOrExprContext ctx)
	{
		return binary(ExprKind.BIT_OR, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitAndExpr(TimedAutomataParser.AndExprContext ctx)
	{
		return binary(ExprKind.AND, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitOrExpr(TimedAutomataParser.OrExprContext ctx)
	{
		return binary(ExprKind.OR, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitImplyExpr(TimedAutomataParser.ImplyExprContext ctx)
	{
		return binary(ExprKind.IMPLY, ctx.expression(0), ctx.expression(1), ctx);
	}

	@Override
	public Expression visitBinderExpr(TimedAutomataParser.BinderExprContext ctx)
	{
		ExprKind kind = switch (ctx.quantifier.getText())
		{
			case "forall" -> ExprKind.FORALL;
			case "exists" -> ExprKind.EXISTS;
			default -> ExprKind.SUM;
		};
		Type type = types.visit(ctx.type());
		Frame binder = builder.pushScope();
		builder.declare(binder, type, ctx.ID().getText(), position(ctx.ID()));
		Expression body = visit(ctx.expression());
		builder.popScope();
		return Expression.createBinder(kind, binder, body, position(ctx));
	}

	@Override
	public Expression visitConditionalExpr(TimedAutomataParser.ConditionalExprContext ctx)
	{
		return Expression.createTernary(ExprKind.INLINE_IF, visit(ctx.expression(0)), visit(ctx.expression(1)), visit(ctx.expression(2)), position(ctx));
	}

	@Override
	public Expression visitAssignExpr(TimedAutomataParser.AssignExprContext ctx)
	{
		ExprKind kind = switch (ctx.op.getText())
		{
			case "+=" -> ExprKind.ASS_PLUS;
			case "-=" -> ExprKind.ASS_MINUS;
			case "*=" -> ExprKind.ASS_MULT;
			case "/=" -> ExprKind.ASS_DIV;
			case "%=" -> ExprKind.ASS_MOD;
			case "|=" -> ExprKind.ASS_OR;
			case "&=" -> ExprKind.ASS_AND;
			case "^=" -> ExprKind.ASS_XOR;
			case "<<=" -> ExprKind.ASS_LSHIFT;
			case ">>=" -> ExprKind.ASS_RSHIFT;
			default -> ExprKind.ASSIGN;
		};
		return binary(kind, ctx.expression(0), ctx.expression(1), ctx);
	}
}
