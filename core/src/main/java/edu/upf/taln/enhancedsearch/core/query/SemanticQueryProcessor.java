package edu.upf.taln.enhancedsearch.core.query;

import com.google.common.base.Stopwatch;
import edu.upf.taln.enhancedsearch.core.TextAnnotator;
import edu.upf.taln.enhancedsearch.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.*;

/**
 * Annotates queries and resolves their statements against a knowledge engine.
 */
public class SemanticQueryProcessor
{
	private final TextAnnotator annotator;
	private final SemanticEngine engine;
	private final static Logger log = LogManager.getLogger();

	public SemanticQueryProcessor(TextAnnotator annotator, SemanticEngine engine)
	{
		this.annotator = annotator;
		this.engine = engine;
	}

	/**
	 * Annotates the query text and replaces the annotations, literals and statements of the query.
	 * Every annotation which is the subject of a statement, or either side of a conjunction, records its identifiers as
	 * an identity feature, and each filtering statement is recorded as a feature of its subject.
	 */
	public void updateQueryWithAnnotations(Query query)
	{
		if (annotator == null)
			throw new IllegalStateException("No text annotator");

		final AnnotationResult result = annotator.annotate(query.getText());
		query.update(result.getLanguage().orElse(null), result.getAnnotations(), result.getLiterals(), result.getStatements());

		Set<String> identified = new HashSet<>();
		for (Statement s : query.getStatements())
		{
			if (s.isConjunction())
				query.getAnnotation(s.getObjectId())
						.filter(o -> identified.add(o.getId()))
						.ifPresent(o -> o.addFeature(Feature.identity(o.getUris())));

			final Optional<Annotation> subject = query.getAnnotation(s.getSubjectId());
			if (subject.isEmpty())
				continue;

			final Annotation a = subject.get();
			if (identified.add(a.getId()))
				a.addFeature(Feature.identity(a.getUris()));
			if (s.isFiltering())
				a.addFeature(new Feature(s.getPredicate(), s.getObject(), s.getLiteral()));
		}

		log.info("Query \"" + query.getText() + "\" has " + query.getAnnotations().size() + " annotations, " +
				query.getLiterals().size() + " literals and " + query.getStatements().size() + " statements");
	}

	/**
	 * Sends the filtering statements of each subject to the knowledge engine and replaces the identifiers of the
	 * subject annotation with the bound ones, which are linked as children of the original identifiers.
	 * Engine failures propagate and leave the query untouched. Features are never modified.
	 * @return true if at least one annotation was bound to some identifier
	 */
	public boolean resolveQueryAnnotations(Query query)
	{
		if (engine == null)
			throw new IllegalStateException("No semantic engine");

		final Map<String, List<Statement>> groups = query.getStatements().stream()
				.filter(Statement::isFiltering)
				.collect(groupingBy(Statement::getSubjectId, LinkedHashMap::new, toList()));
		if (groups.isEmpty())
		{
			log.info("Nothing to resolve in \"" + query.getText() + "\"");
			return false;
		}

		// query the engine for every subject before touching any annotation
		Stopwatch timer = Stopwatch.createStarted();
		Map<Annotation, Set<Uri>> bindings = new LinkedHashMap<>();
		for (Map.Entry<String, List<Statement>> e : groups.entrySet())
		{
			final Annotation subject = query.getAnnotation(e.getKey())
					.orElseThrow(() -> new IllegalStateException("Statement refers to unknown annotation " + e.getKey()));
			final Set<Uri> bound = engine.execute(e.getValue()).get(SemanticEngine.SUBJECT_POSITION).stream()
					.map(url -> new Uri(url, Uri.OBJECT_POSITION, true, Set.of()))
					.collect(toCollection(LinkedHashSet::new));
			bindings.put(subject, bound);
		}

		final UriGraph graph = query.getUriGraph();
		bindings.forEach((subject, bound) ->
		{
			final Set<Uri> constraints = groups.get(subject.getId()).stream()
					.flatMap(s -> s.getSubject().stream())
					.collect(toCollection(LinkedHashSet::new));
			constraints.forEach(graph::add);
			constraints.forEach(c -> bound.forEach(b -> graph.link(c, b)));
			subject.setUris(bound);
			log.debug(subject.getText() + " resolved to " + bound.size() + " identifiers");
		});
		log.info("Resolved " + bindings.size() + " subjects in " + timer.stop());

		return bindings.values().stream().anyMatch(b -> !b.isEmpty());
	}
}
