package edu.upf.taln.enhancedsearch.core.structures;

import com.ibm.icu.util.ULocale;

import java.util.*;

/**
 * User query. Populated by annotation and updated in place by resolution; owned by a single caller.
 */
public final class Query
{
	private final String text;
	private ULocale language;
	private final List<Annotation> annotations = new ArrayList<>();
	private final List<Annotation> literals = new ArrayList<>();
	private final List<Statement> statements = new ArrayList<>();
	private final UriGraph uri_graph = new UriGraph();

	public Query(String text)
	{
		this.text = Objects.requireNonNull(text);
	}

	public String getText() { return text; }
	public Optional<ULocale> getLanguage() { return Optional.ofNullable(language); }
	public List<Annotation> getAnnotations() { return Collections.unmodifiableList(annotations); }
	public List<Annotation> getLiterals() { return Collections.unmodifiableList(literals); }
	public List<Statement> getStatements() { return Collections.unmodifiableList(statements); }
	public UriGraph getUriGraph() { return uri_graph; }

	public Optional<Annotation> getAnnotation(String id)
	{
		return annotations.stream()
				.filter(a -> a.getId().equals(id))
				.findFirst();
	}

	/**
	 * Replaces, never appends to, the current contents of the query
	 */
	public void update(ULocale language, List<Annotation> annotations, List<Annotation> literals, List<Statement> statements)
	{
		this.language = language;
		this.annotations.clear();
		this.annotations.addAll(annotations);
		this.literals.clear();
		this.literals.addAll(literals);
		this.statements.clear();
		this.statements.addAll(statements);
		this.uri_graph.clear();
	}

	@Override
	public String toString()
	{
		return "Query{" + text + ", annotations=" + annotations + ", literals=" + literals +
				", statements=" + statements + "}";
	}
}
