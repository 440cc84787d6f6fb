package org.lokray.tamodel.semantic.type;

import org.lokray.tamodel.document.Instance;

/**
 * Type of a template, of a partial instance and of a process. It points at the instance
 * record so callers can reach the still-unbound parameters.
 */
public class ProcessType implements Type
{
	private final Instance instance;

	public ProcessType(Instance instance)
	{
		this.instance = instance;
	}

	public Instance getInstance()
	{
		return instance;
	}

	@Override
	public String getName()
	{
		return "process " + instance.getName();
	}

	@Override
	public boolean isProcess()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
