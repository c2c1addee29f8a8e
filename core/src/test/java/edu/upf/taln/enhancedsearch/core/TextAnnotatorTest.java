package edu.upf.taln.enhancedsearch.core;

import edu.upf.taln.enhancedsearch.core.engines.*;
import edu.upf.taln.enhancedsearch.core.structures.Annotation;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.Statement;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TextAnnotatorTest
{
	@Test
	public void fullPipeline()
	{
		final AnnotationResult result = TestResources.annotator().annotate("Wo finde ich Fagus sylvatica in Paris?");

		assertEquals("de", result.getLanguage().orElseThrow().getLanguage());
		final List<Annotation> annotations = result.getAnnotations();
		assertEquals(2, annotations.size());
		assertEquals("Fagus sylvatica", annotations.get(0).getText());
		assertEquals(NamedEntityType.PLANT, annotations.get(0).getType());
		assertEquals("Paris", annotations.get(1).getText());
		assertEquals(NamedEntityType.LOCATION, annotations.get(1).getType());

		// no pattern links a plant and a location, both are identity statements
		assertEquals(2, result.getStatements().size());
		assertTrue(result.getStatements().stream().allMatch(Statement::isIdentity));
	}

	@Test
	public void engineBeforePrerequisiteFails()
	{
		final Options options = new Options();
		try
		{
			new TextAnnotator(List.of(new SimpleTokenizer(), new UriLinkingEngine(options),
					new Lemmatizer((w, l) -> w, options.default_language), new LiteralAnnotationEngine(),
					new EntityLookupEngine(TestResources.labels(), options)));
			fail("Linking engine placed before lookup was accepted");
		}
		catch (IllegalArgumentException e)
		{
			assertTrue(e.getMessage().contains("EntityLookupEngine"));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void missingTokenizerFails()
	{
		new TextAnnotator(List.of(new LiteralAnnotationEngine()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyPipelineFails()
	{
		new TextAnnotator(List.of());
	}

	@Test
	public void partialPipeline()
	{
		final TextAnnotator annotator = new TextAnnotator(List.of(new SimpleTokenizer(), new LiteralAnnotationEngine()));
		final AnnotationResult result = annotator.annotate("Pflanzen mit 3 Kelchblättern");

		assertEquals(4, result.getTokens().size());
		assertEquals(1, result.getLiterals().size());
		assertEquals("3", result.getLiterals().get(0).getText());
		assertTrue(result.getAnnotations().isEmpty());
	}

	@Test
	public void emptyQuery()
	{
		final AnnotationResult result = TestResources.annotator().annotate("");
		assertTrue(result.getTokens().isEmpty());
		assertTrue(result.getAnnotations().isEmpty());
		assertTrue(result.getStatements().isEmpty());
	}
}
