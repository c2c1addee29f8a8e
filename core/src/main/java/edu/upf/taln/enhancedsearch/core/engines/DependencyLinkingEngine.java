package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.structures.*;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.regex.Matcher;

import static java.util.stream.Collectors.*;

/**
 * Extracts statements by matching an ordered list of patterns against the abstracted query.
 * A pattern never matches a window already taken by an earlier match. Annotations left out of every match become
 * identity statements, so two entities joined in a conjunction get none.
 */
public class DependencyLinkingEngine implements AnnotationEngine
{
	private final Options options;
	private final List<DependencyPattern> patterns;
	private final static Logger log = LogManager.getLogger();

	/**
	 * @throws IllegalArgumentException if the options are not valid
	 */
	public DependencyLinkingEngine(Options options)
	{
		this(options, DependencyPattern.defaults(validated(options)));
	}

	public DependencyLinkingEngine(Options options, List<DependencyPattern> patterns)
	{
		this.options = validated(options);
		this.patterns = List.copyOf(patterns);
	}

	private static Options validated(Options options)
	{
		final Options copy = new Options(options);
		copy.validate();
		return copy;
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(DisambiguationEngine.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final List<Annotation> annotations = result.getAnnotations();
		final Map<String, Annotation> by_id = new HashMap<>();
		annotations.forEach(a -> by_id.putIfAbsent(a.getId(), a));
		result.getLiterals().forEach(a -> by_id.putIfAbsent(a.getId(), a));

		final String abstracted = abstractQuery(result);
		log.debug("Abstracted query: " + abstracted);

		List<Pair<Integer, Integer>> windows = new ArrayList<>();
		Set<String> consumed = new HashSet<>();
		List<Statement> statements = new ArrayList<>();
		for (DependencyPattern pattern : patterns)
		{
			final Matcher m = pattern.getPattern().matcher(abstracted);
			int from = 0;
			while (from < abstracted.length() && m.find(from))
			{
				final int start = m.start();
				final int end = m.end();
				if (windows.stream().anyMatch(w -> w.getLeft() < end && start < w.getRight()))
				{
					from = start + 1;
					continue;
				}

				windows.add(Pair.of(start, end));
				statements.add(createStatement(pattern, m, by_id, consumed));
				log.debug("Pattern " + pattern.getName() + " matched " + m.group());
				from = end;
			}
		}

		annotations.stream()
				.filter(a -> !consumed.contains(a.getId()))
				.forEach(a -> statements.add(Statement.identity(options.getVariable(), a)));

		return result.withStatements(statements);
	}

	private Statement createStatement(DependencyPattern pattern, Matcher m, Map<String, Annotation> by_id, Set<String> consumed)
	{
		final Annotation subject = get(pattern, m, DependencyPattern.SUBJECT, by_id, consumed);
		if (pattern.getRelationship() != null)
		{
			final Annotation other = get(pattern, m, DependencyPattern.OBJECT, by_id, consumed);
			return new Statement(options.getVariable(), subject.getId(), subject.getUris(), null,
					other.isLiteral() ? null : other.getUris(), other.getId(),
					other.isLiteral() ? other.getText() : null, pattern.getRelationship());
		}

		final Annotation predicate = get(pattern, m, DependencyPattern.PREDICATE, by_id, consumed);
		final Annotation object = get(pattern, m, DependencyPattern.OBJECT, by_id, consumed);
		final Annotation literal = get(pattern, m, DependencyPattern.LITERAL, by_id, consumed);

		// identifiers are assigned to predicate or object by their declared position, not by surface order
		final Set<Uri> uris = new LinkedHashSet<>();
		if (predicate != null)
			uris.addAll(predicate.getUris());
		if (object != null)
			uris.addAll(object.getUris());
		final Map<Boolean, Set<Uri>> split = uris.stream()
				.collect(partitioningBy(Uri::isPredicate, toCollection(LinkedHashSet::new)));

		Set<Uri> predicate_uris = split.get(true);
		Set<Uri> object_uris = split.get(false);
		if (predicate != null && predicate_uris.isEmpty())
		{
			predicate_uris = new LinkedHashSet<>(predicate.getUris());
			object_uris.removeAll(predicate_uris);
		}

		final String object_id = literal != null ? literal.getId() : object != null ? object.getId() : null;
		return new Statement(options.getVariable(), subject.getId(), subject.getUris(),
				predicate_uris.isEmpty() ? null : predicate_uris,
				object_uris.isEmpty() ? null : object_uris,
				object_id, literal != null ? literal.getText() : null);
	}

	private static Annotation get(DependencyPattern pattern, Matcher m, String role, Map<String, Annotation> by_id,
	                              Set<String> consumed)
	{
		if (!pattern.hasRole(role))
			return null;
		final String id = m.group(role);
		if (id == null)
			return null;

		final Annotation a = by_id.get(id);
		if (a == null)
			throw new IllegalStateException("Pattern " + pattern.getName() + " matched unknown element " + id);
		consumed.add(id);
		return a;
	}

	/**
	 * Renders annotations, literals and remaining tokens in text order, e.g.
	 * {plant<0/8>} mit<9/12> {misc<13/18>} {misc<19/25>}
	 * A quoted number is rendered as a quoted literal.
	 */
	static String abstractQuery(AnnotationResult result)
	{
		final Set<String> quoted = result.getTokens().stream()
				.filter(Token::isQuoted)
				.map(Token::getId)
				.collect(toSet());
		List<Pair<Integer, String>> elements = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Annotation a : result.getAnnotations())
		{
			if (seen.add(a.getId()))
				elements.add(Pair.of(a.getBegin(), "{" + a.getType().getShortName() + "<" + a.getId() + ">}"));
		}
		for (Annotation l : result.getLiterals())
		{
			final boolean number = !quoted.contains(l.getId()) && LiteralAnnotationEngine.isNumber(l.getText());
			final String marker = number ? "#" : "\"";
			elements.add(Pair.of(l.getBegin(), marker + "<" + l.getId() + ">"));
		}
		for (Token t : result.getResidualTokens())
		{
			final String word = StringUtils.replaceChars(t.getText().toLowerCase(Locale.ROOT), "{}<>\"# ", "");
			elements.add(Pair.of(t.getBegin(), word + "<" + t.getId() + ">"));
		}

		return elements.stream()
				.sorted(Comparator.comparingInt((Pair<Integer, String> e) -> e.getLeft()))
				.map(Pair::getRight)
				.collect(joining(" "));
	}
}
