package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.TestResources;
import edu.upf.taln.enhancedsearch.core.TextAnnotator;
import edu.upf.taln.enhancedsearch.core.structures.Annotation;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.Uri;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static edu.upf.taln.enhancedsearch.core.structures.NamedEntityType.*;
import static java.util.stream.Collectors.toList;
import static org.junit.Assert.*;

public class DisambiguationEngineTest
{
	private static AnnotationResult disambiguate(String text, Options options)
	{
		final TextAnnotator annotator = new TextAnnotator(List.of(new SimpleTokenizer(),
				new Lemmatizer(TestResources.lemmas(), options.default_language), new LiteralAnnotationEngine(),
				new EntityLookupEngine(TestResources.labels(), options), new UriLinkingEngine(options),
				new DisambiguationEngine(options)));
		return annotator.annotate(text);
	}

	private static AnnotationResult disambiguate(String text)
	{
		return disambiguate(text, new Options());
	}

	private static List<NamedEntityType> types(AnnotationResult result)
	{
		return result.getAnnotations().stream().map(Annotation::getType).collect(toList());
	}

	@Test
	public void contextCueSelectsLocation()
	{
		final AnnotationResult result = disambiguate("Wo finde ich Fagus sylvatica in Paris?");
		assertEquals(List.of(PLANT, LOCATION), types(result));

		final Annotation paris = result.getAnnotations().get(1);
		assertEquals("Paris", paris.getText());
		assertTrue(paris.isSafe());
		assertEquals(List.of("https://sws.geonames.org/2988507/"),
				paris.getUris().stream().map(Uri::getUrl).collect(toList()));
		assertTrue(paris.getUris().stream().allMatch(Uri::isSafe));
	}

	@Test
	public void singleTypeIsKept()
	{
		final AnnotationResult result = disambiguate("Fagus sylvatica Deutschland");
		assertEquals(List.of("Fagus sylvatica", "Deutschland"),
				result.getAnnotations().stream().map(Annotation::getText).collect(toList()));
		assertEquals(List.of(PLANT, LOCATION), types(result));
		assertTrue(result.getAnnotations().stream().allMatch(Annotation::isSafe));
	}

	@Test
	public void cuesApplyPerOccurrence()
	{
		final AnnotationResult result = disambiguate("Paris in Paris");
		assertEquals(List.of(PLANT, LOCATION), types(result));

		final Annotation first = result.getAnnotations().get(0);
		assertFalse(first.isSafe());
		assertEquals(List.of(LOCATION), new ArrayList<>(first.getAlternatives()));
		assertTrue(result.getAnnotations().get(1).isSafe());
	}

	@Test
	public void priorityFallbackIsTheSameForEveryOccurrence()
	{
		final AnnotationResult result = disambiguate("Paris, Paris und Paris");
		assertEquals(List.of(PLANT, PLANT, PLANT), types(result));
		assertTrue(result.getAnnotations().stream().noneMatch(Annotation::isSafe));
	}

	@Test
	public void priorityIsConfigurable()
	{
		Options options = new Options();
		options.annotation_priority = List.of(LOCATION, PLANT, ANIMAL, TAXON, MISCELLANEOUS);
		assertEquals(List.of(LOCATION), types(disambiguate("Paris", options)));
	}

	@Test
	public void cueIsSharedByEnumeration()
	{
		final AnnotationResult result = disambiguate("Fagus sylvatica in Berlin, New York und Paris");
		assertEquals(List.of(PLANT, LOCATION, LOCATION, LOCATION), types(result));
		assertEquals("Paris", result.getAnnotations().get(3).getText());
		assertTrue(result.getAnnotations().get(3).isSafe());
	}

	@Test
	public void cueForMissingTypeIsIgnored()
	{
		Options options = new Options();
		options.context_cues.put("mit", ANIMAL);
		final AnnotationResult result = disambiguate("Pflanzen mit Paris", options);
		assertEquals(PLANT, result.getAnnotations().get(1).getType());
		assertFalse(result.getAnnotations().get(1).isSafe());
	}

	@Test
	public void idempotent()
	{
		final Options options = new Options();
		final DisambiguationEngine engine = new DisambiguationEngine(options);
		for (String text : List.of("Paris in Paris", "Paris, Paris und Paris", "Wo finde ich Fagus sylvatica in Paris?"))
		{
			final AnnotationResult once = disambiguate(text, options);
			final AnnotationResult twice = engine.apply(once);

			assertEquals(once.getAnnotations().size(), twice.getAnnotations().size());
			for (int i = 0; i < once.getAnnotations().size(); ++i)
			{
				final Annotation a = once.getAnnotations().get(i);
				final Annotation b = twice.getAnnotations().get(i);
				assertEquals(a.getId(), b.getId());
				assertEquals(a.getType(), b.getType());
				assertEquals(a.getUris(), b.getUris());
				assertEquals(a.isSafe(), b.isSafe());
			}
		}
	}

	@Test
	public void cueDoesNotCrossOtherEntities()
	{
		final AnnotationResult result = disambiguate("in Berlin Fagus Paris");
		assertEquals(List.of(LOCATION, PLANT, PLANT), types(result));
		assertFalse(result.getAnnotations().get(2).isSafe());
		assertEquals(List.of(LOCATION), new ArrayList<>(result.getAnnotations().get(2).getAlternatives()));
	}

	@Test
	public void cueCrossesEnumeratedEntitiesOfAnyType()
	{
		final AnnotationResult result = disambiguate("in Berlin, Fagus und Paris");
		assertEquals(List.of(LOCATION, PLANT, LOCATION), types(result));
		assertTrue(result.getAnnotations().get(2).isSafe());
	}

	@Test
	public void selectedTypeWithSeveralIdentifiersIsUnsafe()
	{
		final AnnotationResult result = disambiguate("Eiche in Linden");
		assertEquals(List.of(PLANT, LOCATION), types(result));

		final Annotation eiche = result.getAnnotations().get(0);
		assertEquals(2, eiche.getUris().size());
		assertFalse(eiche.isSafe());

		final Annotation linden = result.getAnnotations().get(1);
		assertEquals(2, linden.getUris().size());
		assertFalse(linden.isSafe());
		assertEquals(List.of(PLANT), new ArrayList<>(linden.getAlternatives()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void incompletePriorityIsRejected()
	{
		Options options = new Options();
		options.annotation_priority = List.of(PLANT, LOCATION);
		new DisambiguationEngine(options);
	}

	@Test
	public void laterChangesToOptionsAreIgnored()
	{
		Options options = new Options();
		final DisambiguationEngine engine = new DisambiguationEngine(options);
		options.annotation_priority = List.of(LOCATION, PLANT, ANIMAL, TAXON, MISCELLANEOUS);
		options.context_cues.clear();

		final Options defaults = new Options();
		final AnnotationResult linked = new TextAnnotator(List.of(new SimpleTokenizer(),
				new Lemmatizer(TestResources.lemmas(), defaults.default_language), new LiteralAnnotationEngine(),
				new EntityLookupEngine(TestResources.labels(), defaults), new UriLinkingEngine(defaults)))
				.annotate("Paris in Paris");

		assertEquals(List.of(PLANT, LOCATION), types(engine.apply(linked)));
	}
}
