package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.TextAnnotator;
import edu.upf.taln.enhancedsearch.core.dictionaries.*;
import edu.upf.taln.enhancedsearch.core.engines.*;
import edu.upf.taln.enhancedsearch.core.query.SemanticEngine;
import edu.upf.taln.enhancedsearch.core.query.SemanticQueryProcessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the label store, lemma lookup, annotation pipeline and query processor described by a set of properties.
 * All configuration is read on construction and never changes afterwards.
 */
public class ResourcesFactory
{
	public static final String TOKENIZER = "tokenizer";
	public static final String LANGUAGE = "language";
	public static final String LEMMATIZER = "lemmatizer";
	public static final String LITERALS = "literals";
	public static final String LOOKUP = "lookup";
	public static final String LINKING = "linking";
	public static final String DISAMBIGUATION = "disambiguation";
	public static final String DEPENDENCIES = "dependencies";
	public static final List<String> DEFAULT_ENGINES = List.of(TOKENIZER, LANGUAGE, LEMMATIZER, LITERALS, LOOKUP,
			LINKING, DISAMBIGUATION, DEPENDENCIES);
	public static final String FALLBACK_LABELS = "/fallback_labels.json";

	private final Options options;
	private final LabelStore labels;
	private final LemmaLookup lemmas;
	private final TextAnnotator annotator;
	private final SemanticEngine engine;
	private final static Logger log = LogManager.getLogger();

	public ResourcesFactory(SearchProperties properties) throws IOException
	{
		this(properties, null);
	}

	/**
	 * @param engine knowledge engine to use instead of the one configured in the properties, may be null
	 */
	public ResourcesFactory(SearchProperties properties, SemanticEngine engine) throws IOException
	{
		log.info("Loading resources");
		options = new Options();
		if (properties.getPriority() != null)
			options.annotation_priority = new ArrayList<>(properties.getPriority());
		if (properties.getDefaultLanguage() != null)
			options.default_language = properties.getDefaultLanguage();
		if (properties.getResultLimit() != null)
			options.result_limit = properties.getResultLimit();
		options.validate();
		log.debug(options);

		labels = new JsonLabelStore(createDatabase(properties));
		lemmas = properties.getLemmasFolder() != null ? new DictionaryLemmaLookup(properties.getLemmasFolder()) :
				LemmaLookup.lowercase();
		annotator = new TextAnnotator(createEngines(properties.getEngines()));

		if (engine != null)
			this.engine = engine;
		else if (properties.getSparqlEndpoint() != null)
			this.engine = SparqlSemanticEngine.connect(properties.getSparqlEndpoint(),
					new SparqlQueryGenerator(options.result_limit), options.getVariable());
		else
			this.engine = null;
	}

	public Options getOptions() { return options; }
	public LabelStore getLabels() { return labels; }
	public LemmaLookup getLemmas() { return lemmas; }
	public TextAnnotator getAnnotator() { return annotator; }
	public SemanticEngine getEngine() { return engine; }

	public SemanticQueryProcessor createProcessor()
	{
		return new SemanticQueryProcessor(annotator, engine);
	}

	/**
	 * @throws IllegalArgumentException for unknown engine names or engines placed before their prerequisites
	 */
	public List<AnnotationEngine> createEngines(List<String> names)
	{
		List<AnnotationEngine> engines = new ArrayList<>();
		for (String name : names)
		{
			switch (name)
			{
				case TOKENIZER: engines.add(new SimpleTokenizer()); break;
				case LANGUAGE: engines.add(new LanguageDetector()); break;
				case LEMMATIZER: engines.add(new Lemmatizer(lemmas, options.default_language)); break;
				case LITERALS: engines.add(new LiteralAnnotationEngine()); break;
				case LOOKUP: engines.add(new EntityLookupEngine(labels, options)); break;
				case LINKING: engines.add(new UriLinkingEngine(options)); break;
				case DISAMBIGUATION: engines.add(new DisambiguationEngine(options)); break;
				case DEPENDENCIES: engines.add(new DependencyLinkingEngine(options)); break;
				default: throw new IllegalArgumentException("Unknown annotation engine " + name);
			}
		}
		return engines;
	}

	private static KeyValueDatabase createDatabase(SearchProperties properties) throws IOException
	{
		if (properties.getLabelsFile() != null)
			return InMemoryKeyValueDatabase.load(properties.getLabelsFile());

		log.warn("No labels file configured, using demo labels");
		try (InputStream input = ResourcesFactory.class.getResourceAsStream(FALLBACK_LABELS))
		{
			if (input == null)
				throw new IOException("Cannot find " + FALLBACK_LABELS);
			return InMemoryKeyValueDatabase.load(input);
		}
	}
}
