package org.lokray.tamodel.document;

import org.lokray.tamodel.semantic.symbol.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarations of one scope: the global scope, a template or the system section.
 */
public class Declarations
{
	private final Frame frame;
	private final List<Variable> variables = new ArrayList<>();
	private final List<Function> functions = new ArrayList<>();
	private final List<ProgressMeasure> progress = new ArrayList<>();
	private final List<IoDecl> ioDecls = new ArrayList<>();
	private final List<Gantt> ganttChart = new ArrayList<>();

	public Declarations(Frame frame)
	{
		this.frame = frame;
	}

	public Frame getFrame()
	{
		return frame;
	}

	public List<Variable> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	public List<Function> getFunctions()
	{
		return Collections.unmodifiableList(functions);
	}

	public List<ProgressMeasure> getProgress()
	{
		return Collections.unmodifiableList(progress);
	}

	public List<IoDecl> getIoDecls()
	{
		return Collections.unmodifiableList(ioDecls);
	}

	public List<Gantt> getGanttChart()
	{
		return Collections.unmodifiableList(ganttChart);
	}

	void addVariable(Variable variable)
	{
		variables.add(variable);
	}

	void addFunction(Function function)
	{
		functions.add(function);
	}

	void addProgress(ProgressMeasure measure)
	{
		progress.add(measure);
	}

	void addIoDecl(IoDecl decl)
	{
		ioDecls.add(decl);
	}

	void addGantt(Gantt gantt)
	{
		ganttChart.add(gantt);
	}
}
