package edu.upf.taln.enhancedsearch.core.structures;

import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class UriGraphTest
{
	private final Uri plants = new Uri("https://www.biofid.de/ontology/pflanzen");
	private final Uri fagaceae = new Uri("https://www.biofid.de/ontology/fagaceae");
	private final Uri fagus = new Uri("https://www.biofid.de/ontology/fagus");

	@Test
	public void links()
	{
		UriGraph graph = new UriGraph();
		graph.link(plants, fagaceae);
		graph.link(fagaceae, fagus);
		graph.link(plants, fagaceae);

		assertEquals(3, graph.size());
		assertEquals(Set.of(fagaceae), graph.getChildren(plants));
		assertEquals(Set.of(fagaceae), graph.getParents(fagus));
		assertEquals(Set.of(fagaceae, fagus), graph.getDescendants(plants));
		assertTrue(graph.getParents(plants).isEmpty());
	}

	@Test
	public void cyclesAreTraversedOnce()
	{
		UriGraph graph = new UriGraph();
		graph.link(plants, fagaceae);
		graph.link(fagaceae, fagus);
		graph.link(fagus, plants);

		assertEquals(Set.of(plants, fagaceae, fagus), graph.getDescendants(plants));
	}

	@Test
	public void identityIsTheUrl()
	{
		UriGraph graph = new UriGraph();
		final int i = graph.add(new Uri("https://pato.org/flower_part", Uri.PREDICATE_POSITION, false, Set.of("blüte")));
		final int j = graph.add(new Uri("https://pato.org/flower_part", Uri.PREDICATE_POSITION, true, Set.of()));

		assertEquals(i, j);
		assertEquals(1, graph.size());
		assertTrue(graph.getDescendants(new Uri("https://pato.org/unknown")).isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void subjectPositionIsRejected()
	{
		new Uri("https://www.biofid.de/ontology/pflanzen", 1, false, Set.of());
	}
}
