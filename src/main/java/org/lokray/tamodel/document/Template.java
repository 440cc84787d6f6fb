// File: src/main/java/org/lokray/tamodel/document/Template.java
package org.lokray.tamodel.document;

import org.lokray.tamodel.expression.Expression;
import org.lokray.tamodel.position.ErrorKind;
import org.lokray.tamodel.position.Position;
import org.lokray.tamodel.position.SemanticException;
import org.lokray.tamodel.semantic.symbol.Frame;
import org.lokray.tamodel.semantic.symbol.Symbol;
import org.lokray.tamodel.semantic.type.PrimitiveType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A parameterised automaton. A template is a fully unbound {@link Instance} of itself plus
 * its local declarations and its automaton: locations, branchpoints and edges. Scenario
 * templates carry instance lines, messages, conditions and updates instead.
 */
public class Template
{
	private final Instance instance;
	private final Declarations declarations;
	private final boolean dynamic;
	private final int dynIndex;
	private final boolean ta;
	private final String type;
	private final String mode;
	private Symbol init;
	private boolean defined;

	private final List<Location> locations = new ArrayList<>();
	private final List<Branchpoint> branchpoints = new ArrayList<>();
	private final List<Edge> edges = new ArrayList<>();
	private final List<Expression> dynamicEvals = new ArrayList<>();

	private final List<InstanceLine> instanceLines = new ArrayList<>();
	private final List<Message> messages = new ArrayList<>();
	private final List<Condition> conditions = new ArrayList<>();
	private final List<Update> updates = new ArrayList<>();

	Template(Frame parameters, Frame frame, Position position, boolean ta, String type, String mode, boolean dynamic, int dynIndex)
	{
		this.instance = new Instance(parameters, parameters.size(), this, position);
		this.declarations = new Declarations(frame);
		this.ta = ta;
		this.type = type;
		this.mode = mode;
		this.dynamic = dynamic;
		this.dynIndex = dynIndex;
		this.defined = !dynamic;
		frame.includeAll(parameters);
	}

	public Instance getInstance()
	{
		return instance;
	}

	public String getName()
	{
		return instance.getName();
	}

	public Symbol getSymbol()
	{
		return instance.getSymbol();
	}

	public Frame getParameters()
	{
		return instance.getParameters();
	}

	public Declarations getDeclarations()
	{
		return declarations;
	}

	/** Scope of the template body. Its parent is the global frame. */
	public Frame getFrame()
	{
		return declarations.getFrame();
	}

	public Symbol getInit()
	{
		return init;
	}

	public void setInit(Symbol init)
	{
		this.init = init;
	}

	/** True for timed automata, false for scenario charts. */
	public boolean isTA()
	{
		return ta;
	}

	public String getType()
	{
		return type;
	}

	public String getMode()
	{
		return mode;
	}

	/** Invariant scenario charts must hold at every point, not only from the start. */
	public boolean isInvariant()
	{
		return "invariant".equals(mode);
	}

	public boolean isDynamic()
	{
		return dynamic;
	}

	/** Declaration order among the dynamic templates; -1 for static templates. */
	public int getDynIndex()
	{
		return dynIndex;
	}

	/** False for a dynamic template that was declared but has no body yet. */
	public boolean isDefined()
	{
		return defined;
	}

	void markDefined()
	{
		defined = true;
	}

	// --- Automaton ---

	public List<Location> getLocations()
	{
		return Collections.unmodifiableList(locations);
	}

	public List<Branchpoint> getBranchpoints()
	{
		return Collections.unmodifiableList(branchpoints);
	}

	public List<Edge> getEdges()
	{
		return Collections.unmodifiableList(edges);
	}

	/**
	 * @throws SemanticException with {@link ErrorKind#DUPLICATE_SYMBOL}
	 */
	public Location addLocation(String name, Expression invariant, Expression expRate, Position position)
	{
		Symbol symbol = getFrame().declare(name, PrimitiveType.LABEL, position);
		Location location = new Location(symbol, invariant, expRate, locations.size());
		locations.add(location);
		return location;
	}

	public Branchpoint addBranchpoint(String name, Position position)
	{
		Symbol symbol = getFrame().declare(name, PrimitiveType.LABEL, position);
		Branchpoint branchpoint = new Branchpoint(symbol, branchpoints.size());
		branchpoints.add(branchpoint);
		return branchpoint;
	}

	/**
	 * Connects two locations or branchpoints of this template. The edge's select frame is
	 * a fresh child of the template frame so select binders are visible in its labels.
	 *
	 * @throws SemanticException if an endpoint is neither a location nor a branchpoint of
	 *                           this template
	 */
	public Edge addEdge(Symbol source, Symbol destination, boolean controllable, String actionName)
	{
		Edge edge = new Edge(this, edges.size(), endpoint(source), endpoint(destination), controllable, actionName);
		edge.setSelect(getFrame().child());
		edges.add(edge);
		return edge;
	}

	private Edge.Endpoint endpoint(Symbol symbol)
	{
		if (symbol.getData() instanceof Location l && l.getNr() < locations.size() && locations.get(l.getNr()) == l)
		{
			return new Edge.Endpoint(Edge.EndpointKind.LOCATION, l.getNr());
		}
		if (symbol.getData() instanceof Branchpoint b && b.getNr() < branchpoints.size() && branchpoints.get(b.getNr()) == b)
		{
			return new Edge.Endpoint(Edge.EndpointKind.BRANCHPOINT, b.getNr());
		}
		throw new SemanticException(ErrorKind.GENERAL, "'" + symbol.getName() + "' is not a location or branchpoint of " + getName());
	}

	// --- Dynamic evaluation table ---

	/**
	 * Registers an expression evaluated when a process of this template spawns or
	 * tests for another one.
	 *
	 * @return the slot of the expression
	 */
	public int addDynamicEval(Expression expression)
	{
		dynamicEvals.add(expression);
		return dynamicEvals.size() - 1;
	}

	public Expression getDynamicEval(int slot)
	{
		return dynamicEvals.get(slot);
	}

	public List<Expression> getDynamicEvals()
	{
		return Collections.unmodifiableList(dynamicEvals);
	}

	// --- Scenario charts ---

	public List<InstanceLine> getInstanceLines()
	{
		return Collections.unmodifiableList(instanceLines);
	}

	public List<Message> getMessages()
	{
		return Collections.unmodifiableList(messages);
	}

	public List<Condition> getConditions()
	{
		return Collections.unmodifiableList(conditions);
	}

	public List<Update> getUpdates()
	{
		return Collections.unmodifiableList(updates);
	}

	public InstanceLine addInstanceLine(String name, Instance process, Position position)
	{
		Symbol symbol = getFrame().declare(name, PrimitiveType.LABEL, position);
		InstanceLine line = new InstanceLine(symbol, instanceLines.size(), process);
		instanceLines.add(line);
		return line;
	}

	public Message addMessage(Symbol source, Symbol destination, int location, boolean inPrechart)
	{
		Message message = new Message(messages.size(), location, inPrechart, line(source), line(destination));
		messages.add(message);
		return message;
	}

	public Condition addCondition(List<Symbol> anchors, int location, boolean inPrechart, boolean hot)
	{
		List<Integer> lines = new ArrayList<>();
		for (Symbol anchor : anchors)
		{
			lines.add(line(anchor));
		}
		Condition condition = new Condition(conditions.size(), location, inPrechart, lines, hot);
		conditions.add(condition);
		return condition;
	}

	public Update addUpdate(Symbol anchor, int location, boolean inPrechart)
	{
		Update update = new Update(updates.size(), location, inPrechart, line(anchor));
		updates.add(update);
		return update;
	}

	private int line(Symbol symbol)
	{
		if (symbol.getData() instanceof InstanceLine l && l.getNr() < instanceLines.size() && instanceLines.get(l.getNr()) == l)
		{
			return l.getNr();
		}
		throw new SemanticException(ErrorKind.GENERAL, "'" + symbol.getName() + "' is not an instance line of " + getName());
	}

	public boolean hasPrechart()
	{
		return messages.stream().anyMatch(LscElement::isInPrechart)
				|| conditions.stream().anyMatch(LscElement::isInPrechart)
				|| updates.stream().anyMatch(LscElement::isInPrechart);
	}

	/**
	 * @return the first condition at the given chart location anchored on one of the lines,
	 * or null
	 */
	public Condition getCondition(List<Integer> lines, int location)
	{
		for (Condition c : conditions)
		{
			if (c.getLocation() == location && c.getAnchors().stream().anyMatch(lines::contains))
			{
				return c;
			}
		}
		return null;
	}

	/**
	 * @return the first update at the given chart location anchored on one of the lines,
	 * or null
	 */
	public Update getUpdate(List<Integer> lines, int location)
	{
		for (Update u : updates)
		{
			if (u.getLocation() == location && lines.contains(u.getAnchor()))
			{
				return u;
			}
		}
		return null;
	}

	/**
	 * Groups the chart elements into simregions. Every message opens a simregion and picks
	 * up the condition and update at its location on its two lines. Conditions left over
	 * open their own simregion and pick up an update; remaining updates stand alone.
	 */
	public List<SimRegion> getSimregions()
	{
		List<SimRegion> result = new ArrayList<>();
		Set<Integer> usedConditions = new HashSet<>();
		Set<Integer> usedUpdates = new HashSet<>();

		for (Message m : messages)
		{
			SimRegion s = new SimRegion(result.size());
			s.setMessage(m);
			List<Integer> lines = List.of(m.getSource(), m.getDestination());
			Condition c = getCondition(lines, m.getLocation());
			if (c != null && usedConditions.add(c.getNr()))
			{
				s.setCondition(c);
			}
			Update u = getUpdate(lines, m.getLocation());
			if (u != null && usedUpdates.add(u.getNr()))
			{
				s.setUpdate(u);
			}
			result.add(s);
		}
		for (Condition c : conditions)
		{
			if (!usedConditions.add(c.getNr()))
			{
				continue;
			}
			SimRegion s = new SimRegion(result.size());
			s.setCondition(c);
			Update u = getUpdate(c.getAnchors(), c.getLocation());
			if (u != null && usedUpdates.add(u.getNr()))
			{
				s.setUpdate(u);
			}
			result.add(s);
		}
		for (Update u : updates)
		{
			if (usedUpdates.add(u.getNr()))
			{
				SimRegion s = new SimRegion(result.size());
				s.setUpdate(u);
				result.add(s);
			}
		}
		return result;
	}

	/** The cut made of all simregions of the prechart. */
	public Cut getPrechartCut()
	{
		Cut cut = new Cut(0);
		getSimregions().stream().filter(SimRegion::isInPrechart).forEach(cut::add);
		return cut;
	}

	@Override
	public String toString()
	{
		return instance.toString();
	}
}
