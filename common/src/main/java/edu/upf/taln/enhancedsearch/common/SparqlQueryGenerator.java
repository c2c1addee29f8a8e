package edu.upf.taln.enhancedsearch.common;

import edu.upf.taln.enhancedsearch.core.structures.Statement;
import edu.upf.taln.enhancedsearch.core.structures.Uri;
import org.apache.commons.lang3.StringUtils;

import java.util.*;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.joining;

/**
 * Builds SPARQL SELECT queries from the statements describing one subject.
 * The subject variable is bound to taxa placed below the subject identifiers in the Darwin Core hierarchy. The first
 * statement is mandatory, the others are OPTIONAL patterns.
 */
public final class SparqlQueryGenerator
{
	public static final int DEFAULT_LIMIT = 1000;
	private static final Map<String, String> prefixes = Map.of("terms", "https://dwc.tdwg.org/terms/#");
	private static final List<String> hierarchy_predicates = List.of("terms:kingdom", "terms:class", "terms:order",
			"terms:family", "terms:genus", "terms:phylum", "terms:parentNameUsageID", "terms:acceptedNameUsageID");
	private static final Pattern INTEGER = Pattern.compile("-?\\d+");
	private static final Pattern DECIMAL = Pattern.compile("-?\\d+[.,]\\d+");
	private static final String XSD = "http://www.w3.org/2001/XMLSchema#";

	private final int limit;

	public SparqlQueryGenerator()
	{
		this(DEFAULT_LIMIT);
	}

	public SparqlQueryGenerator(int limit)
	{
		if (limit < 1)
			throw new IllegalArgumentException("Invalid limit " + limit);
		this.limit = limit;
	}

	public String generate(String variable, List<Statement> statements)
	{
		if (statements.isEmpty())
			throw new IllegalArgumentException("No statements to generate a query from");
		final String v = variable.startsWith("?") ? variable : "?" + variable;

		StringBuilder query = new StringBuilder();
		prefixes.forEach((p, ns) -> query.append("PREFIX ").append(p).append(": <").append(ns).append(">\n"));
		query.append("SELECT DISTINCT ").append(v).append(" WHERE {\n");
		for (int i = 0; i < statements.size(); ++i)
		{
			query.append(i == 0 ? "\t{\n" : "\tOPTIONAL {\n");
			addSubjectPattern(query, v, statements.get(i), i);
			addFilteringPattern(query, v, statements.get(i), i);
			query.append("\t}\n");
		}
		query.append("}\n");
		query.append("ORDER BY ").append(v).append("\n");
		query.append("LIMIT ").append(limit);

		return query.toString();
	}

	private static void addSubjectPattern(StringBuilder query, String variable, Statement statement, int index)
	{
		if (statement.getSubject().isEmpty())
			return;

		final String subject = "?subject" + index;
		final String parent = "?hasParent" + index;
		query.append("\t\tVALUES ").append(subject).append(" {").append(values(statement.getSubject())).append("}\n");
		query.append("\t\tVALUES ").append(parent).append(" {").append(String.join(" ", hierarchy_predicates)).append("}\n");
		query.append("\t\t").append(variable).append(" ").append(parent).append(" ").append(subject).append(" .\n");
	}

	private static void addFilteringPattern(StringBuilder query, String variable, Statement statement, int index)
	{
		if (statement.isIdentity())
			return;

		String predicate = "?predicates" + index;
		if (statement.getPredicate() != null && !statement.getPredicate().isEmpty())
			query.append("\t\tVALUES ").append(predicate).append(" {").append(values(statement.getPredicate())).append("}\n");

		String object = "?predicateValues" + index;
		if (statement.getLiteral() != null)
			object = literal(statement.getLiteral());
		else if (statement.getObject() != null && statement.getObject().size() == 1)
			object = iri(statement.getObject().iterator().next());
		else if (statement.getObject() != null && !statement.getObject().isEmpty())
			query.append("\t\tVALUES ").append(object).append(" {").append(values(statement.getObject())).append("}\n");

		query.append("\t\t").append(variable).append(" ").append(predicate).append(" ").append(object).append(" .\n");
	}

	private static String values(Set<Uri> uris)
	{
		return uris.stream()
				.map(SparqlQueryGenerator::iri)
				.sorted()
				.collect(joining(" "));
	}

	static String iri(Uri uri)
	{
		final String url = uri.isSafe() ? uri.getUrl() : StringUtils.replaceChars(uri.getUrl(), "'\"<> {}|^`\\", "");
		if (url.startsWith("<") || !url.startsWith("http"))
			return url; // prefixed names pass through
		return "<" + url + ">";
	}

	static String literal(String text)
	{
		if (INTEGER.matcher(text).matches())
			return "\"" + text + "\"^^<" + XSD + "integer>";
		if (DECIMAL.matcher(text).matches())
			return "\"" + text.replace(',', '.') + "\"^^<" + XSD + "decimal>";

		final String escaped = text.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("'", "\\'")
				.replace("\n", " ");
		return "\"" + escaped + "\"";
	}
}
