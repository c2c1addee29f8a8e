package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.query.SemanticEngine;
import edu.upf.taln.enhancedsearch.core.query.SemanticQueryProcessor;
import edu.upf.taln.enhancedsearch.core.structures.Annotation;
import edu.upf.taln.enhancedsearch.core.structures.Query;
import edu.upf.taln.enhancedsearch.core.structures.Statement;
import edu.upf.taln.enhancedsearch.core.structures.Uri;
import org.eclipse.rdf4j.repository.Repository;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.sail.SailRepository;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.sail.memory.MemoryStore;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.toSet;
import static org.junit.Assert.*;

public class SparqlSemanticEngineTest
{
	private static final String plants = "https://www.biofid.de/bio-ontologies/Tracheophyta/gbif/";
	private static final String birds = "https://www.biofid.de/bio-ontologies/Aves/gbif/";
	private static Repository repository;
	private static SparqlSemanticEngine engine;

	@BeforeClass
	public static void setUp() throws Exception
	{
		repository = new SailRepository(new MemoryStore());
		repository.init();
		try (RepositoryConnection connection = repository.getConnection();
		     InputStream input = SparqlSemanticEngineTest.class.getResourceAsStream("/default.nt"))
		{
			connection.add(input, "", RDFFormat.NTRIPLES);
		}
		engine = new SparqlSemanticEngine(repository, new SparqlQueryGenerator(), Statement.DEFAULT_VARIABLE);
	}

	@AfterClass
	public static void tearDown()
	{
		repository.shutDown();
	}

	private static SemanticQueryProcessor processor() throws Exception
	{
		return new ResourcesFactory(new SearchProperties(), engine).createProcessor();
	}

	private static Set<String> urls(Annotation a)
	{
		return a.getUris().stream().map(Uri::getUrl).collect(toSet());
	}

	@Test
	public void execute()
	{
		final Statement statement = new Statement("?taxon", "0/8", Set.of(new Uri(plants + "6")),
				Set.of(new Uri("http://purl.obolibrary.org/obo/PO_0009046", Uri.PREDICATE_POSITION, true, Set.of())),
				Set.of(new Uri("http://purl.obolibrary.org/obo/PATO_0000322")), "13/18", null);

		final List<String> bound = engine.execute(List.of(statement)).get(SemanticEngine.SUBJECT_POSITION);
		assertEquals(List.of(plants + "2882316", plants + "3189866"), bound);
		assertTrue(engine.execute(List.of()).isEmpty());
	}

	@Test
	public void resolveProperty() throws Exception
	{
		final SemanticQueryProcessor processor = processor();
		final Query query = new Query("Pflanzen mit roten Blüten");
		processor.updateQueryWithAnnotations(query);

		assertTrue(processor.resolveQueryAnnotations(query));
		assertEquals(Set.of(plants + "2882316", plants + "3189866"), urls(query.getAnnotation("0/8").orElseThrow()));
	}

	@Test
	public void resolveNumericalProperty() throws Exception
	{
		final SemanticQueryProcessor processor = processor();
		final Query query = new Query("Pflanzen mit 4 Kelchblättern");
		processor.updateQueryWithAnnotations(query);

		assertTrue(processor.resolveQueryAnnotations(query));
		assertEquals(Set.of(plants + "2742736"), urls(query.getAnnotation("0/8").orElseThrow()));
	}

	@Test
	public void resolveEverySubject() throws Exception
	{
		final SemanticQueryProcessor processor = processor();
		final Query query = new Query("Pflanzen mit roten Blüten und Vögel mit roten Blüten");
		processor.updateQueryWithAnnotations(query);

		assertTrue(processor.resolveQueryAnnotations(query));
		assertEquals(Set.of(plants + "2882316", plants + "3189866"), urls(query.getAnnotation("0/8").orElseThrow()));
		assertEquals(Set.of(birds + "9515117"), urls(query.getAnnotation("30/35").orElseThrow()));
	}

	@Test
	public void nothingBound() throws Exception
	{
		final SemanticQueryProcessor processor = processor();
		final Query query = new Query("Vögel mit gelben Blüten");
		processor.updateQueryWithAnnotations(query);

		assertFalse(processor.resolveQueryAnnotations(query));
		assertTrue(query.getAnnotation("0/5").orElseThrow().getUris().isEmpty());
	}
}
