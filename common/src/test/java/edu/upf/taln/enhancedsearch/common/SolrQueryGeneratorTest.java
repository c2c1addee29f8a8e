package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.structures.*;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class SolrQueryGeneratorTest
{
	private static final String fagus_sylvatica = "https://www.biofid.de/ontology/fagus_sylvatica";
	private static final String another_fagus = "https://www.biofid.de/ontology/another_fagus";
	private static final String quercus = "https://www.biofid.de/ontology/quercus";
	private static final String berlin = "https://sws.geonames.org/2950159/";

	private static Uri safe(String url)
	{
		return new Uri(url, Uri.OBJECT_POSITION, true, Set.of());
	}

	private static Annotation entity(int begin, int end, String text, NamedEntityType type, Uri... uris)
	{
		return new Annotation(begin, end, text, text, type, List.of(uris), true);
	}

	private static Annotation literal(int begin, int end, String text, boolean quoted)
	{
		return Annotation.literal(new Token(begin, end, text, quoted));
	}

	private static Query query(String text, List<Annotation> annotations, List<Annotation> literals, List<Statement> statements)
	{
		Query query = new Query(text);
		query.update(null, annotations, literals, statements);
		return query;
	}

	@Test
	public void onlyLiterals()
	{
		final Query query = query("Blätter 3 'Foo Bar'", List.of(),
				List.of(literal(8, 9, "3", false), literal(11, 18, "Foo Bar", true)), List.of());
		assertEquals("q:(3 AND \"Foo Bar\")", new SolrQueryGenerator().generate(query));
	}

	@Test
	public void quotedLiteral()
	{
		final Query query = query("'Here is no annotation'", List.of(),
				List.of(literal(1, 22, "Here is no annotation", true)), List.of());
		assertEquals("q:\"Here is no annotation\"", new SolrQueryGenerator().generate(query));
	}

	@Test
	public void singleAnnotation()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica));
		final Query query = query("Fagus sylvatica", List.of(fagus), List.of(), List.of(Statement.identity("?taxon", fagus)));
		assertEquals("q:\"" + fagus_sylvatica + "\"", new SolrQueryGenerator().generate(query));
	}

	@Test
	public void annotationAndLiteral()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica));
		final Query query = query("Fagus sylvatica 'Test'", List.of(fagus), List.of(literal(17, 21, "Test", true)),
				List.of(Statement.identity("?taxon", fagus)));
		assertEquals("q:\"" + fagus_sylvatica + "\" AND q:\"Test\"", new SolrQueryGenerator().generate(query));
	}

	@Test
	public void andConjunctionWithLiteral()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica), safe(another_fagus));
		final Statement and = new Statement("?taxon", "0/15", fagus.getUris(), null, null, "21/24", "Foo", RelationshipType.AND);
		final Query query = query("Fagus sylvatica und 'Foo'", List.of(fagus), List.of(literal(21, 24, "Foo", true)), List.of(and));

		assertEquals("q:(\"" + another_fagus + "\" OR \"" + fagus_sylvatica + "\") AND q:\"Foo\"",
				new SolrQueryGenerator().generate(query));
	}

	@Test
	public void andConjunctionOfEntities()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica), safe(another_fagus));
		final Annotation oak = entity(20, 27, "Quercus", NamedEntityType.PLANT, safe(quercus));
		final Statement and = new Statement("?taxon", "0/15", fagus.getUris(), null, oak.getUris(), "20/27", null,
				RelationshipType.AND);
		final Query query = query("Fagus sylvatica und Quercus", List.of(fagus, oak), List.of(), List.of(and));

		assertEquals("q:(\"" + another_fagus + "\" OR \"" + fagus_sylvatica + "\") AND q:\"" + quercus + "\"",
				new SolrQueryGenerator().generate(query));
	}

	@Test
	public void orConjunction()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica), safe(another_fagus));
		final Statement or = new Statement("?taxon", "0/15", fagus.getUris(), null, null, "22/25", "Foo", RelationshipType.OR);
		final Query query = query("Fagus sylvatica oder 'Foo'", List.of(fagus), List.of(literal(22, 25, "Foo", true)), List.of(or));

		assertEquals("q:(\"" + another_fagus + "\" OR \"" + fagus_sylvatica + "\") OR q:\"Foo\"",
				new SolrQueryGenerator().generate(query));
	}

	@Test
	public void orConjunctionOfLiterals()
	{
		final Statement or = new Statement("?taxon", "1/4", Set.of(), null, null, "12/15", "Bar", RelationshipType.OR);
		final Query query = query("'Foo' oder 'Bar'", List.of(),
				List.of(literal(1, 4, "Foo", true), literal(12, 15, "Bar", true)), List.of(or));
		assertEquals("q:\"Foo\" OR q:\"Bar\"", new SolrQueryGenerator().generate(query));
	}

	@Test
	public void remainingElementsFollowConjunctions()
	{
		final Annotation fagus = entity(0, 5, "Fagus", NamedEntityType.PLANT, safe(fagus_sylvatica));
		final Annotation oak = entity(10, 17, "Quercus", NamedEntityType.PLANT, safe(quercus));
		final Annotation city = entity(21, 27, "Berlin", NamedEntityType.LOCATION, safe(berlin));
		final Statement and = new Statement("?taxon", "0/5", fagus.getUris(), null, oak.getUris(), "10/17", null,
				RelationshipType.AND);
		final Query query = query("Fagus und Quercus in Berlin", List.of(fagus, oak, city), List.of(),
				List.of(and, Statement.identity("?taxon", city)));

		assertEquals("q:\"" + fagus_sylvatica + "\" AND q:\"" + quercus + "\" AND q:\"" + berlin + "\"",
				new SolrQueryGenerator().generate(query));
	}

	@Test
	public void unsafeIdentifiersAreEscaped()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, new Uri(fagus_sylvatica));
		final Query query = query("Fagus sylvatica 'Foo Bar'", List.of(fagus), List.of(literal(17, 24, "Foo Bar", true)),
				List.of(Statement.identity("?taxon", fagus)));

		assertEquals("q:\"https\\:\\/\\/www.biofid.de\\/ontology\\/fagus_sylvatica\" AND q:\"Foo Bar\"",
				new SolrQueryGenerator().generate(query));
	}

	@Test
	public void defaultConjunctionAndFieldAreConfigurable()
	{
		final Annotation fagus = entity(0, 15, "Fagus sylvatica", NamedEntityType.PLANT, safe(fagus_sylvatica));
		final Query query = query("Fagus sylvatica 'Test'", List.of(fagus), List.of(literal(17, 21, "Test", true)), List.of());

		assertEquals("text:\"" + fagus_sylvatica + "\" OR text:\"Test\"",
				new SolrQueryGenerator("text", RelationshipType.OR).generate(query));
	}

	@Test
	public void terms()
	{
		assertEquals("\\-3", SolrQueryGenerator.term("-3"));
		assertEquals("3,5", SolrQueryGenerator.term("3,5"));
		assertEquals("\"rote \\\"Blüten\\\"\"", SolrQueryGenerator.term("rote \"Blüten\""));
	}

	@Test
	public void emptyQuery()
	{
		assertEquals("", new SolrQueryGenerator().generate(new Query("und")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void blankFieldIsRejected()
	{
		new SolrQueryGenerator(" ", RelationshipType.AND);
	}
}
