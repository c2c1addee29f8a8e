package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.TextAnnotator;
import edu.upf.taln.enhancedsearch.core.engines.AnnotationEngine;
import edu.upf.taln.enhancedsearch.core.engines.SimpleTokenizer;
import edu.upf.taln.enhancedsearch.core.query.SemanticQueryProcessor;
import edu.upf.taln.enhancedsearch.core.structures.Annotation;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.Query;
import org.junit.Test;

import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.junit.Assert.*;

public class ResourcesFactoryTest
{
	@Test
	public void demoMode() throws Exception
	{
		final ResourcesFactory factory = new ResourcesFactory(new SearchProperties());
		assertNull(factory.getEngine());
		assertEquals(ResourcesFactory.DEFAULT_ENGINES.size(), factory.getAnnotator().getEngines().size());

		final AnnotationResult result = factory.getAnnotator().annotate("Pflanzen mit roten Blüten");
		assertEquals(List.of(NamedEntityType.PLANT, NamedEntityType.MISCELLANEOUS, NamedEntityType.MISCELLANEOUS),
				result.getAnnotations().stream().map(Annotation::getType).collect(toList()));
		assertEquals(1, result.getStatements().size());
	}

	@Test(expected = IllegalStateException.class)
	public void resolveWithoutKnowledgeStore() throws Exception
	{
		final SemanticQueryProcessor processor = new ResourcesFactory(new SearchProperties()).createProcessor();
		final Query query = new Query("Pflanzen mit roten Blüten");
		processor.updateQueryWithAnnotations(query);
		processor.resolveQueryAnnotations(query);
	}

	@Test
	public void createEngines() throws Exception
	{
		final ResourcesFactory factory = new ResourcesFactory(new SearchProperties());
		final List<AnnotationEngine> engines = factory.createEngines(List.of(ResourcesFactory.TOKENIZER));
		assertEquals(1, engines.size());
		assertTrue(engines.get(0) instanceof SimpleTokenizer);
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownEngine() throws Exception
	{
		new ResourcesFactory(new SearchProperties()).createEngines(List.of("tokenizer", "parser"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void enginesOutOfOrder() throws Exception
	{
		final ResourcesFactory factory = new ResourcesFactory(new SearchProperties());
		new TextAnnotator(factory.createEngines(List.of("lookup", "tokenizer")));
	}
}
