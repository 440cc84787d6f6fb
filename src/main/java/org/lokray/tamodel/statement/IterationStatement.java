package org.lokray.tamodel.statement;

import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;

/**
 * {@code for (i : int[0,3]) body}: iterates a bounded type. The loop variable lives in
 * its own frame.
 */
public class IterationStatement extends Statement
{
	private final Frame frame;
	private final Statement body;

	public IterationStatement(Frame frame, Statement body, Position position)
	{
		super(position);
		this.frame = frame;
		this.body = body;
	}

	public Frame getFrame()
	{
		return frame;
	}

	public Symbol getVariable()
	{
		return frame.get(0);
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitIteration(this);
	}
}
