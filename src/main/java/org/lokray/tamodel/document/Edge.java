package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.semantic.symbol.Frame;

import java.util.Optional;

/**
 * An edge of a template. Source and destination are handles into the owning template's
 * location or branchpoint list, never both for one endpoint.
 */
public class Edge
{
	public enum EndpointKind
	{
		LOCATION,
		BRANCHPOINT
	}

	/** Arena handle of one edge endpoint. */
	public static final class Endpoint
	{
		private final EndpointKind kind;
		private final int index;

		Endpoint(EndpointKind kind, int index)
		{
			this.kind = kind;
			this.index = index;
		}

		public EndpointKind getKind()
		{
			return kind;
		}

		public int getIndex()
		{
			return index;
		}

		public boolean isLocation()
		{
			return kind == EndpointKind.LOCATION;
		}
	}

	private final Template owner;
	private final int nr;
	private final Endpoint source;
	private final Endpoint destination;
	private final boolean controllable;
	private final String actionName;
	private Frame select;
	private Expression guard = Expression.EMPTY;
	private Expression sync = Expression.EMPTY;
	private Expression assign = Expression.EMPTY;
	private Expression probability = Expression.EMPTY;

	Edge(Template owner, int nr, Endpoint source, Endpoint destination, boolean controllable, String actionName)
	{
		this.owner = owner;
		this.nr = nr;
		this.source = source;
		this.destination = destination;
		this.controllable = controllable;
		this.actionName = actionName == null ? "" : actionName;
	}

	public Template getOwner()
	{
		return owner;
	}

	/** Placement of the edge in its template. */
	public int getNr()
	{
		return nr;
	}

	public Endpoint getSource()
	{
		return source;
	}

	public Endpoint getDestination()
	{
		return destination;
	}

	public Optional<Location> getSourceLocation()
	{
		return resolveLocation(source);
	}

	public Optional<Location> getDestinationLocation()
	{
		return resolveLocation(destination);
	}

	public Optional<Branchpoint> getSourceBranchpoint()
	{
		return resolveBranchpoint(source);
	}

	public Optional<Branchpoint> getDestinationBranchpoint()
	{
		return resolveBranchpoint(destination);
	}

	private Optional<Location> resolveLocation(Endpoint endpoint)
	{
		return endpoint.isLocation() ? Optional.of(owner.getLocations().get(endpoint.getIndex())) : Optional.empty();
	}

	private Optional<Branchpoint> resolveBranchpoint(Endpoint endpoint)
	{
		return endpoint.isLocation() ? Optional.empty() : Optional.of(owner.getBranchpoints().get(endpoint.getIndex()));
	}

	public boolean isControllable()
	{
		return controllable;
	}

	public String getActionName()
	{
		return actionName;
	}

	/** Frame of the non-deterministic select binders; empty when the edge has none. */
	public Frame getSelect()
	{
		return select;
	}

	public void setSelect(Frame select)
	{
		this.select = select;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public void setGuard(Expression guard)
	{
		this.guard = guard == null ? Expression.EMPTY : guard;
	}

	/** SYNC_SEND or SYNC_RECV node, or empty. */
	public Expression getSync()
	{
		return sync;
	}

	public void setSync(Expression sync)
	{
		this.sync = sync == null ? Expression.EMPTY : sync;
	}

	public Expression getAssign()
	{
		return assign;
	}

	public void setAssign(Expression assign)
	{
		this.assign = assign == null ? Expression.EMPTY : assign;
	}

	public Expression getProbability()
	{
		return probability;
	}

	public void setProbability(Expression probability)
	{
		this.probability = probability == null ? Expression.EMPTY : probability;
	}
}
