package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.engines.LiteralAnnotationEngine;
import edu.upf.taln.enhancedsearch.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.solr.client.solrj.util.ClientUtils;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Builds a Solr document search from an annotated query.
 * Each conjunction statement becomes a pair of clauses joined by its relationship. Annotations and literals left out of
 * every conjunction follow, one clause per annotation and a single clause for all literals, and all pieces are joined
 * by the default conjunction. The identifiers of an annotation are ORed, the literals of the last clause ANDed.
 * Numbers are searched as terms, any other literal as a phrase.
 */
public final class SolrQueryGenerator
{
	public static final String DEFAULT_FIELD = "q";
	private final static Logger log = LogManager.getLogger();

	private final String field;
	private final RelationshipType default_conjunction;

	public SolrQueryGenerator()
	{
		this(DEFAULT_FIELD, RelationshipType.AND);
	}

	public SolrQueryGenerator(String field, RelationshipType default_conjunction)
	{
		if (field == null || field.isBlank())
			throw new IllegalArgumentException("Invalid search field " + field);
		this.field = field;
		this.default_conjunction = Objects.requireNonNull(default_conjunction);
	}

	/**
	 * @return the query string, empty if the query has neither annotations nor literals
	 */
	public String generate(Query query)
	{
		final Map<String, Annotation> annotations = new LinkedHashMap<>();
		query.getAnnotations().forEach(a -> annotations.putIfAbsent(a.getId(), a));
		final Map<String, Annotation> literals = new LinkedHashMap<>();
		query.getLiterals().forEach(l -> literals.putIfAbsent(l.getId(), l));

		List<String> pieces = new ArrayList<>();
		for (Statement s : query.getStatements())
		{
			if (!s.isConjunction())
				continue;

			final Optional<String> a = clause(s.getSubjectId(), annotations, literals);
			final Optional<String> b = clause(s.getObjectId(), annotations, literals);
			if (a.isPresent() && b.isPresent())
				pieces.add(a.get() + " " + s.getRelationship().name() + " " + b.get());
			else
				a.or(() -> b).ifPresent(pieces::add);
		}

		// remaining elements
		annotations.values().stream()
				.map(Annotation::getUris)
				.filter(uris -> !uris.isEmpty())
				.map(this::clause)
				.forEach(pieces::add);
		if (!literals.isEmpty())
		{
			final List<String> terms = literals.values().stream()
					.map(l -> term(l.getText()))
					.collect(toList());
			pieces.add(field + ":" + group(terms, RelationshipType.AND));
		}

		final String solr_query = String.join(" " + default_conjunction.name() + " ", pieces);
		log.debug("Solr query for \"" + query.getText() + "\": " + solr_query);
		return solr_query;
	}

	/**
	 * Removes the element from the remaining ones
	 */
	private Optional<String> clause(String id, Map<String, Annotation> annotations, Map<String, Annotation> literals)
	{
		final Annotation literal = literals.remove(id);
		if (literal != null)
			return Optional.of(field + ":" + term(literal.getText()));

		final Annotation annotation = annotations.remove(id);
		if (annotation == null || annotation.getUris().isEmpty())
			return Optional.empty();
		return Optional.of(clause(annotation.getUris()));
	}

	private String clause(Set<Uri> uris)
	{
		final List<String> terms = uris.stream()
				.map(SolrQueryGenerator::term)
				.sorted()
				.collect(toList());
		return field + ":" + group(terms, RelationshipType.OR);
	}

	private static String group(List<String> terms, RelationshipType relationship)
	{
		final String joined = String.join(" " + relationship.name() + " ", terms);
		return terms.size() > 1 ? "(" + joined + ")" : joined;
	}

	static String term(Uri uri)
	{
		final String url = uri.isSafe() ? uri.getUrl() : ClientUtils.escapeQueryChars(uri.getUrl());
		return "\"" + url + "\"";
	}

	static String term(String literal)
	{
		if (LiteralAnnotationEngine.isNumber(literal))
			return ClientUtils.escapeQueryChars(literal);
		return "\"" + literal.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
