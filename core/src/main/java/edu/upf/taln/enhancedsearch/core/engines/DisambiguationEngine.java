package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.structures.*;
import org.apache.commons.collections4.SetUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.toCollection;
import static java.util.stream.Collectors.toList;

/**
 * Reduces overlapping annotations with different types to a single interpretation.
 * A context cue preceding the span (e.g. a locative preposition) selects its type for that occurrence only.
 * Without a cue the type ranked highest in the annotation priority wins, and the annotation is flagged as unsafe.
 * A winner with more than one identifier stays unsafe even when selected by a cue.
 * Groups with a single type are left untouched, so running the engine twice changes nothing.
 */
public class DisambiguationEngine implements AnnotationEngine
{
	private final Options options;
	private final static Logger log = LogManager.getLogger();

	/**
	 * Works on a copy of the options.
	 * @throws IllegalArgumentException if the options are not valid
	 */
	public DisambiguationEngine(Options options)
	{
		this.options = new Options(options);
		this.options.validate();
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(UriLinkingEngine.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final List<Annotation> annotations = result.getAnnotations();
		List<Annotation> disambiguated = new ArrayList<>();
		for (List<Annotation> group : groupOverlapping(annotations))
		{
			final Set<NamedEntityType> types = group.stream()
					.map(Annotation::getType)
					.collect(toCollection(LinkedHashSet::new));
			if (types.size() == 1)
			{
				disambiguated.addAll(group);
				continue;
			}

			final int begin = group.stream().mapToInt(Annotation::getBegin).min().orElseThrow();
			final Optional<NamedEntityType> cue = getContextCue(begin, result, annotations)
					.filter(types::contains);
			final NamedEntityType selected = cue.orElseGet(() -> types.stream()
					.min(Comparator.comparingInt(options.annotation_priority::indexOf))
					.orElseThrow());

			final Set<NamedEntityType> discarded = SetUtils.difference(types, Set.of(selected));
			group.stream()
					.filter(a -> a.getType() == selected)
					.forEach(a ->
					{
						a.setSafe(cue.isPresent() && a.getUris().size() == 1);
						a.addAlternatives(discarded);
						disambiguated.add(a);
					});
			log.debug("Disambiguated " + group.get(0).getText() + " as " + selected +
					(cue.isPresent() ? " by context" : " by priority") + ", discarding " + discarded);
		}

		disambiguated.sort(Comparator.naturalOrder());
		return result.withAnnotations(disambiguated);
	}

	/**
	 * Groups annotations whose spans overlap, directly or through other annotations
	 */
	static List<List<Annotation>> groupOverlapping(List<Annotation> annotations)
	{
		final List<Annotation> sorted = annotations.stream()
				.sorted(Comparator.naturalOrder())
				.collect(toList());

		List<List<Annotation>> groups = new ArrayList<>();
		List<Annotation> current = new ArrayList<>();
		int current_end = -1;
		for (Annotation a : sorted)
		{
			if (!current.isEmpty() && a.getBegin() >= current_end)
			{
				groups.add(current);
				current = new ArrayList<>();
			}
			current.add(a);
			current_end = Math.max(current_end, a.getEnd());
		}
		if (!current.isEmpty())
			groups.add(current);

		return groups;
	}

	/**
	 * Looks at the nearest token before a span. Conjunctions and enumerated items are skipped, so that in
	 * "in Berlin, Rom und Paris" all three locations share the cue. An annotated span is an enumerated item only if a
	 * comma or a conjunction follows it: in "in Berlin Fagus Paris" the cue does not reach Paris.
	 */
	private Optional<NamedEntityType> getContextCue(int begin, AnnotationResult result, List<Annotation> annotations)
	{
		final List<Token> tokens = result.getTokens();
		for (int i = tokens.size() - 1; i >= 0; --i)
		{
			final Token token = tokens.get(i);
			if (token.getEnd() > begin)
				continue;

			final String word = token.getText().toLowerCase(Locale.ROOT);
			if (!token.isQuoted() && options.conjunctions.containsKey(word))
				continue;

			final OptionalInt annotated_end = annotations.stream()
					.filter(a -> a.overlaps(token.getBegin(), token.getEnd()))
					.mapToInt(Annotation::getEnd)
					.max();
			if (annotated_end.isPresent())
			{
				if (isEnumerated(annotated_end.getAsInt(), result))
					continue;
				return Optional.empty();
			}
			if (!token.isQuoted() && isEnumerated(token.getEnd(), result))
				continue;

			return Optional.ofNullable(options.context_cues.get(word));
		}

		return Optional.empty();
	}

	private boolean isEnumerated(int end, AnnotationResult result)
	{
		final String text = result.getText();
		if (end < text.length() && text.charAt(end) == ',')
			return true;

		return result.getTokens().stream()
				.filter(t -> t.getBegin() >= end)
				.findFirst()
				.map(t -> !t.isQuoted() && options.conjunctions.containsKey(t.getText().toLowerCase(Locale.ROOT)))
				.orElse(false);
	}
}
