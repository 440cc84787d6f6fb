package org.lokray.tamodel.statement;

public interface StatementVisitor<R>
{
	R visitEmpty(EmptyStatement statement);

	R visitExpression(ExprStatement statement);

	R visitBlock(BlockStatement statement);

	R visitIf(IfStatement statement);

	R visitWhile(WhileStatement statement);

	R visitDoWhile(DoWhileStatement statement);

	R visitFor(ForStatement statement);

	R visitIteration(IterationStatement statement);

	R visitReturn(ReturnStatement statement);
}
