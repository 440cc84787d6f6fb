package org.lokray.tamodel.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of simregions closed under the chart's partial order, i.e. a state of progress
 * through the scenario.
 */
public class Cut
{
	private final int id;
	private final List<SimRegion> simregions = new ArrayList<>();

	public Cut(int id)
	{
		this.id = id;
	}

	public Cut(int id, List<SimRegion> simregions)
	{
		this(id);
		simregions.forEach(this::add);
	}

	public int getId()
	{
		return id;
	}

	public List<SimRegion> getSimregions()
	{
		return Collections.unmodifiableList(simregions);
	}

	public void add(SimRegion s)
	{
		if (!contains(s))
		{
			simregions.add(s);
		}
	}

	public void remove(SimRegion s)
	{
		simregions.removeIf(r -> r.getNr() == s.getNr());
	}

	public boolean contains(SimRegion s)
	{
		return simregions.stream().anyMatch(r -> r.getNr() == s.getNr());
	}

	/** A cut lies in the prechart if all of its simregions do. */
	public boolean isInPrechart()
	{
		return simregions.stream().allMatch(SimRegion::isInPrechart);
	}

	/** Cuts are equal when they hold the same simregions, whatever their order. */
	public boolean equivalent(Cut other)
	{
		return simregions.size() == other.simregions.size() && simregions.stream().allMatch(other::contains);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Cut cut = (Cut) o;
		return id == cut.id && equivalent(cut);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, simregions.size());
	}
}
