package edu.upf.taln.enhancedsearch.core;

import com.google.common.base.Stopwatch;
import edu.upf.taln.enhancedsearch.core.dictionaries.LabelStore;
import edu.upf.taln.enhancedsearch.core.dictionaries.LemmaLookup;
import edu.upf.taln.enhancedsearch.core.engines.*;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Runs a fixed sequence of annotation engines over a text, each engine receiving the output of the previous one.
 * The order is checked on construction: an engine cannot precede the engines it depends on.
 */
public final class TextAnnotator
{
	private final List<AnnotationEngine> engines;
	private final static Logger log = LogManager.getLogger();

	public TextAnnotator(List<AnnotationEngine> engines)
	{
		if (engines == null || engines.isEmpty())
			throw new IllegalArgumentException("No annotation engines");

		List<AnnotationEngine> previous = new ArrayList<>();
		for (AnnotationEngine engine : engines)
		{
			for (Class<? extends AnnotationEngine> prerequisite : engine.getPrerequisites())
			{
				if (previous.stream().noneMatch(prerequisite::isInstance))
					throw new IllegalArgumentException(engine.getName() + " requires " +
							prerequisite.getSimpleName() + " to run before it");
			}
			previous.add(engine);
		}

		this.engines = List.copyOf(engines);
		log.info("Annotation pipeline: " + this.engines.stream().map(AnnotationEngine::getName).collect(joining(" -> ")));
	}

	/**
	 * Full pipeline: tokenization, language detection, lemmatization, literals, lookup, linking,
	 * disambiguation and dependency linking
	 */
	public static List<AnnotationEngine> defaultEngines(LabelStore store, LemmaLookup lemmas, Options options)
	{
		options.validate();
		return List.of(new SimpleTokenizer(),
				new LanguageDetector(),
				new Lemmatizer(lemmas, options.default_language),
				new LiteralAnnotationEngine(),
				new EntityLookupEngine(store, options),
				new UriLinkingEngine(options),
				new DisambiguationEngine(options),
				new DependencyLinkingEngine(options));
	}

	public AnnotationResult annotate(String text)
	{
		Stopwatch timer = Stopwatch.createStarted();
		AnnotationResult result = new AnnotationResult(text);
		for (AnnotationEngine engine : engines)
		{
			Stopwatch engine_timer = Stopwatch.createStarted();
			result = engine.apply(result);
			log.debug(engine.getName() + " took " + engine_timer.stop());
		}
		log.debug("Annotated \"" + text + "\" in " + timer.stop());

		return result;
	}

	public List<AnnotationEngine> getEngines() { return engines; }
}
