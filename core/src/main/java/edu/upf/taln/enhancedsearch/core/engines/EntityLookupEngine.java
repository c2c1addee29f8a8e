package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.dictionaries.LabelStore;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.LabelEntry;
import edu.upf.taln.enhancedsearch.core.structures.LabelMatch;
import edu.upf.taln.enhancedsearch.core.structures.Token;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Looks up token spans in the label store, longest spans first.
 * For each span the surface text is tried before the lemmas. Spans never include literal tokens nor cross punctuation.
 */
public class EntityLookupEngine implements AnnotationEngine
{
	private final LabelStore store;
	private final Options options;
	private final static Logger log = LogManager.getLogger();

	public EntityLookupEngine(LabelStore store, Options options)
	{
		this.store = store;
		this.options = new Options(options);
		this.options.validate();
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(Lemmatizer.class, LiteralAnnotationEngine.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final String text = result.getText();
		final Map<String, Optional<LabelEntry>> cache = new HashMap<>();
		List<LabelMatch> candidates = new ArrayList<>();

		for (List<Token> run : getRuns(result))
		{
			for (int i = 0; i < run.size(); ++i)
			{
				for (int j = i + 1; j <= Math.min(run.size(), i + options.max_span_tokens); ++j)
				{
					final List<Token> span = run.subList(i, j);
					final int begin = span.get(0).getBegin();
					final int end = span.get(span.size() - 1).getEnd();
					final String surface = text.substring(begin, end);
					final String raw_key = StringUtils.normalizeSpace(surface).toLowerCase(Locale.ROOT);
					final String lemma_key = span.stream()
							.map(t -> t.getLemma() != null ? t.getLemma() : t.getText())
							.collect(joining(" "))
							.toLowerCase(Locale.ROOT);

					for (String key : new LinkedHashSet<>(List.of(raw_key, lemma_key)))
					{
						if (!isValidKey(key))
							continue;
						final Optional<LabelEntry> entry = cache.computeIfAbsent(key, store::lookup);
						if (entry.isPresent())
						{
							candidates.add(new LabelMatch(begin, end, surface, lemma_key, key, entry.get()));
							break;
						}
					}
				}
			}
		}

		final List<LabelMatch> matches = select(candidates);
		log.debug("Looked up " + cache.size() + " keys, found " + matches.size() + " labels in \"" + text + "\"");
		return result.withLookups(matches);
	}

	/**
	 * Longest spans win, ties go to the span starting earliest. Overlapping spans are discarded.
	 */
	private static List<LabelMatch> select(List<LabelMatch> candidates)
	{
		List<LabelMatch> sorted = new ArrayList<>(candidates);
		sorted.sort(Comparator.comparingInt((LabelMatch m) -> m.getEnd() - m.getBegin()).reversed()
				.thenComparingInt(LabelMatch::getBegin));

		List<LabelMatch> selected = new ArrayList<>();
		for (LabelMatch m : sorted)
		{
			if (selected.stream().noneMatch(s -> s.getBegin() < m.getEnd() && m.getBegin() < s.getEnd()))
				selected.add(m);
		}

		return selected.stream()
				.sorted(Comparator.comparingInt(LabelMatch::getBegin))
				.collect(toList());
	}

	/**
	 * Sequences of consecutive non-literal tokens separated only by whitespace
	 */
	private static List<List<Token>> getRuns(AnnotationResult result)
	{
		final String text = result.getText();
		List<List<Token>> runs = new ArrayList<>();
		List<Token> current = new ArrayList<>();
		Token previous = null;
		for (Token t : result.getTokens())
		{
			final boolean literal = result.isLiteral(t);
			final boolean separated = previous != null && !text.substring(previous.getEnd(), t.getBegin()).isBlank();
			if ((literal || separated) && !current.isEmpty())
			{
				runs.add(current);
				current = new ArrayList<>();
			}
			if (!literal)
				current.add(t);
			previous = t;
		}
		if (!current.isEmpty())
			runs.add(current);

		return runs;
	}

	private boolean isValidKey(String key)
	{
		return key.length() >= options.min_lookup_length &&
				!key.startsWith("(") &&
				!LiteralAnnotationEngine.isNumber(key) &&
				!options.lookup_blacklist.contains(key);
	}
}
