package org.lokray.tamodel.parser;

import org.antlr.v4.runtime.Token;
import org.lokray.tamodel.builder.DocumentBuilder;
import org.lokray.tamodel.expression.ExprKind;
import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds query formulas.
 * <p>
 * Estimation queries ({@code Pr}, {@code E[..](max: ..)}) become nodes with five children:
 * the number of runs (-1 when omitted), the bound kind (0 time, 1 steps, 2 clock), the
 * bounding clock or empty, the bound, and the body. Learning queries ({@code minE},
 * {@code maxE}) carry the expression, the bound triple, the discrete and continuous
 * observation lists and the goal.
 */
public class QueryVisitor extends TimedAutomataBaseVisitor<Expression>
{
	public static final int BOUND_TIME = 0;
	public static final int BOUND_STEPS = 1;
	public static final int BOUND_CLOCK = 2;

	private final DocumentBuilder builder;
	private final ExpressionVisitor expressions;

	public QueryVisitor(DocumentBuilder builder, int base)
	{
		this.builder = builder;
		this.expressions = new ExpressionVisitor(builder, base);
	}

	@Override
	public Expression visitAlwaysGlobally(TimedAutomataParser.AlwaysGloballyContext ctx)
	{
		return Expression.createUnary(ExprKind.AG, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	@Override
	public Expression visitExistsFinally(TimedAutomataParser.ExistsFinallyContext ctx)
	{
		return Expression.createUnary(ExprKind.EF, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	@Override
	public Expression visitAlwaysFinally(TimedAutomataParser.AlwaysFinallyContext ctx)
	{
		return Expression.createUnary(ExprKind.AF, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	@Override
	public Expression visitExistsGlobally(TimedAutomataParser.ExistsGloballyContext ctx)
	{
		return Expression.createUnary(ExprKind.EG, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	@Override
	public Expression visitLeadsTo(TimedAutomataParser.LeadsToContext ctx)
	{
		return Expression.createBinary(ExprKind.LEADS_TO, expressions.visit(ctx.expression(0)), expressions.visit(ctx.expression(1)), expressions.position(ctx));
	}

	@Override
	public Expression visitProbability(TimedAutomataParser.ProbabilityContext ctx)
	{
		ExprKind kind = "<>".equals(ctx.path.getText()) ? ExprKind.PROBA_DIAMOND : ExprKind.PROBA_BOX;
		return estimation(kind, ctx.bound(), ctx.runs, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	@Override
	public Expression visitValueEstimation(TimedAutomataParser.ValueEstimationContext ctx)
	{
		ExprKind kind;
		switch (ctx.extremum.getText())
		{
			case "max" -> kind = ExprKind.EXP_MAX;
			case "min" -> kind = ExprKind.EXP_MIN;
			default ->
			{
				builder.reportError(expressions.position(ctx.extremum), ErrorKind.SYNTAX, "Expected 'max' or 'min'", ctx.extremum.getText());
				kind = ExprKind.EXP_MAX;
			}
		}
		return estimation(kind, ctx.bound(), ctx.runs, expressions.visit(ctx.expression()), expressions.position(ctx));
	}

	private Expression estimation(ExprKind kind, TimedAutomataParser.BoundContext bound, Token runs, Expression body, Position position)
	{
		long count = runs == null ? -1 : runCount(runs);
		List<Expression> children = new ArrayList<>();
		children.add(Expression.createConstant(count, position));
		children.addAll(bound(bound));
		children.add(body);
		return Expression.createNary(kind, children, position);
	}

	private long runCount(Token runs)
	{
		try
		{
			return Long.parseLong(runs.getText());
		}
		catch (NumberFormatException e)
		{
			builder.reportError(expressions.position(runs), ErrorKind.GENERAL, "Integer literal out of range", runs.getText());
			return -1;
		}
	}

	/** Kind, bounding variable and bound value of a run bound. */
	private List<Expression> bound(TimedAutomataParser.BoundContext ctx)
	{
		Position position = expressions.position(ctx);
		if (ctx instanceof TimedAutomataParser.TimeBoundContext time)
		{
			return List.of(Expression.createConstant(BOUND_TIME, position), Expression.EMPTY, expressions.visit(time.expression()));
		}
		if (ctx instanceof TimedAutomataParser.StepBoundContext steps)
		{
			return List.of(Expression.createConstant(BOUND_STEPS, position), Expression.EMPTY, expressions.visit(steps.expression()));
		}
		TimedAutomataParser.ClockBoundContext clock = (TimedAutomataParser.ClockBoundContext) ctx;
		Expression variable = builder.identifier(clock.ID().getText(), expressions.position(clock.ID()));
		return List.of(Expression.createConstant(BOUND_CLOCK, position), variable, expressions.visit(clock.expression()));
	}

	@Override
	public Expression visitLearning(TimedAutomataParser.LearningContext ctx)
	{
		Position position = expressions.position(ctx);
		ExprKind kind = "minE".equals(ctx.learner.getText()) ? ExprKind.MIN_EXP : ExprKind.MAX_EXP;
		List<Expression> bound = bound(ctx.bound());

		List<Expression> children = new ArrayList<>();
		children.add(expressions.visit(ctx.expression(0)));
		children.addAll(bound);
		TimedAutomataParser.LearnSpaceContext space = ctx.learnSpace();
		children.add(observations(space == null ? null : space.discrete, position));
		children.add(observations(space == null ? null : space.continuous, position));
		if (ctx.goal != null)
		{
			children.add(expressions.visit(ctx.goal));
		}
		else if (bound.get(0).getValue() == BOUND_CLOCK)
		{
			// Without an explicit goal a clock-bounded run ends when the clock reaches the bound.
			children.add(Expression.createBinary(ExprKind.GE, bound.get(1), bound.get(2), position));
		}
		else
		{
			children.add(Expression.createBool(true, position));
		}
		return Expression.createNary(kind, children, position);
	}

	private Expression observations(TimedAutomataParser.CommaExprContext ctx, Position position)
	{
		List<Expression> items = new ArrayList<>();
		if (ctx != null)
		{
			for (TimedAutomataParser.ExpressionContext e : ctx.expression())
			{
				items.add(expressions.visit(e));
			}
		}
		return Expression.createNary(ExprKind.LIST, items, position);
	}
}
