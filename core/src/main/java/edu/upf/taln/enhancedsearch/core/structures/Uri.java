package edu.upf.taln.enhancedsearch.core.structures;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Reference to an entity of the knowledge graph.
 * Identity is given by the url alone. Links to broader and narrower identifiers are kept in a {@link UriGraph}.
 */
public final class Uri
{
	public static final int PREDICATE_POSITION = 2;
	public static final int OBJECT_POSITION = 3;

	private final String url;
	private final int position_in_triple;
	private final boolean safe;
	private final ImmutableSet<String> labels;

	public Uri(String url)
	{
		this(url, OBJECT_POSITION, false, Set.of());
	}

	public Uri(String url, int position_in_triple, boolean safe, Collection<String> labels)
	{
		if (url == null || url.isEmpty())
			throw new IllegalArgumentException("Empty url");
		if (position_in_triple != PREDICATE_POSITION && position_in_triple != OBJECT_POSITION)
			throw new IllegalArgumentException("Invalid position in triple " + position_in_triple + " for " + url);
		this.url = url;
		this.position_in_triple = position_in_triple;
		this.safe = safe;
		this.labels = ImmutableSet.copyOf(labels);
	}

	public static boolean isValidPosition(int position)
	{
		return position == PREDICATE_POSITION || position == OBJECT_POSITION;
	}

	public Uri withSafe(boolean safe)
	{
		return this.safe == safe ? this : new Uri(url, position_in_triple, safe, labels);
	}

	public String getUrl() { return url; }
	public int getPositionInTriple() { return position_in_triple; }
	public boolean isPredicate() { return position_in_triple == PREDICATE_POSITION; }
	public boolean isSafe() { return safe; }
	public Set<String> getLabels() { return labels; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return url.equals(((Uri) o).url);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(url);
	}

	@Override
	public String toString()
	{
		return url;
	}
}
