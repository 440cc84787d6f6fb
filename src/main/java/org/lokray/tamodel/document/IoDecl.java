package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Input/output interface declaration of one instance, used by refinement checking.
 */
public class IoDecl
{
	private final String instanceName;
	private final List<Expression> parameters = new ArrayList<>();
	private final List<Expression> inputs = new ArrayList<>();
	private final List<Expression> outputs = new ArrayList<>();
	private final List<Expression> csp = new ArrayList<>();

	public IoDecl(String instanceName)
	{
		this.instanceName = instanceName;
	}

	public String getInstanceName()
	{
		return instanceName;
	}

	public List<Expression> getParameters()
	{
		return parameters;
	}

	public List<Expression> getInputs()
	{
		return inputs;
	}

	public List<Expression> getOutputs()
	{
		return outputs;
	}

	public List<Expression> getCsp()
	{
		return csp;
	}
}
