package edu.upf.taln.enhancedsearch.core.structures;

import java.util.*;

import static java.util.stream.Collectors.toCollection;

/**
 * Non-owning graph of broader/narrower links between identifiers.
 * Identifiers are stored once in an arena and links are kept as index sets, so cycles in the source data are harmless.
 */
public final class UriGraph
{
	private final List<Uri> nodes = new ArrayList<>();
	private final Map<Uri, Integer> index = new HashMap<>();
	private final List<Set<Integer>> parents = new ArrayList<>();
	private final List<Set<Integer>> children = new ArrayList<>();

	public int add(Uri uri)
	{
		Integer i = index.get(uri);
		if (i != null)
			return i;

		int id = nodes.size();
		nodes.add(uri);
		index.put(uri, id);
		parents.add(new LinkedHashSet<>());
		children.add(new LinkedHashSet<>());
		return id;
	}

	public void link(Uri parent, Uri child)
	{
		int p = add(parent);
		int c = add(child);
		children.get(p).add(c);
		parents.get(c).add(p);
	}

	public boolean contains(Uri uri) { return index.containsKey(uri); }
	public int size() { return nodes.size(); }
	public Uri get(int i) { return nodes.get(i); }

	public Set<Uri> getParents(Uri uri)
	{
		return resolve(parents, uri);
	}

	public Set<Uri> getChildren(Uri uri)
	{
		return resolve(children, uri);
	}

	/**
	 * All identifiers reachable through children links, excluding the start node unless it is part of a cycle.
	 */
	public Set<Uri> getDescendants(Uri uri)
	{
		Integer start = index.get(uri);
		if (start == null)
			return Set.of();

		Set<Integer> visited = new LinkedHashSet<>();
		Deque<Integer> pending = new ArrayDeque<>(children.get(start));
		while (!pending.isEmpty())
		{
			int i = pending.pop();
			if (visited.add(i))
				pending.addAll(children.get(i));
		}
		return visited.stream()
				.map(nodes::get)
				.collect(toCollection(LinkedHashSet::new));
	}

	public void clear()
	{
		nodes.clear();
		index.clear();
		parents.clear();
		children.clear();
	}

	private Set<Uri> resolve(List<Set<Integer>> links, Uri uri)
	{
		Integer i = index.get(uri);
		if (i == null)
			return Set.of();
		return links.get(i).stream()
				.map(nodes::get)
				.collect(toCollection(LinkedHashSet::new));
	}
}
