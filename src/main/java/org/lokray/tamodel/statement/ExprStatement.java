package org.lokray.tamodel.statement;

import org.lokray.tamodel.expression.Expression;

public class ExprStatement extends Statement
{
	private final Expression expression;

	public ExprStatement(Expression expression)
	{
		super(expression.getPosition());
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitExpression(this);
	}
}
