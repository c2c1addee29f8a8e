package edu.upf.taln.enhancedsearch.core.structures;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Set;

/**
 * Decoded value of a label store entry: for each type, the (identifier, position in triple) pairs a label maps to.
 */
public final class LabelEntry
{
	private final ImmutableListMultimap<NamedEntityType, Pair<String, Integer>> uris;

	public LabelEntry(ListMultimap<NamedEntityType, Pair<String, Integer>> uris)
	{
		this.uris = ImmutableListMultimap.copyOf(uris);
	}

	public Set<NamedEntityType> getTypes() { return uris.keySet(); }
	public List<Pair<String, Integer>> getUris(NamedEntityType type) { return uris.get(type); }
	public boolean isEmpty() { return uris.isEmpty(); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return uris.equals(((LabelEntry) o).uris);
	}

	@Override
	public int hashCode() { return uris.hashCode(); }

	@Override
	public String toString() { return uris.toString(); }
}
