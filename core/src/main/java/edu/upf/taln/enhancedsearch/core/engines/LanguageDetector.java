package edu.upf.taln.enhancedsearch.core.engines;

import com.ibm.icu.util.ULocale;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.counting;
import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;

/**
 * Guesses the language of a query from the function words it contains.
 * Leaves the language unset if no function word is found or two languages score the same.
 */
public class LanguageDetector implements AnnotationEngine
{
	private static final Map<ULocale, Set<String>> DEFAULT_FUNCTION_WORDS = Map.of(
			ULocale.GERMAN, Set.of("der", "die", "das", "den", "dem", "des", "ein", "eine", "einen", "und", "oder",
					"mit", "ohne", "ich", "wo", "wie", "was", "welche", "finde", "suche", "im", "auf", "von", "zu",
					"für", "nicht", "gibt", "es", "bei"),
			ULocale.ENGLISH, Set.of("the", "a", "an", "and", "or", "with", "without", "i", "where", "how", "what",
					"which", "find", "search", "on", "of", "to", "for", "not", "is", "are", "there", "near", "at"));

	private final Map<ULocale, Set<String>> function_words;
	private final static Logger log = LogManager.getLogger();

	public LanguageDetector()
	{
		this(DEFAULT_FUNCTION_WORDS);
	}

	public LanguageDetector(Map<ULocale, Set<String>> function_words)
	{
		this.function_words = Map.copyOf(function_words);
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(Tokenizer.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final Map<ULocale, Long> counts = result.getTokens().stream()
				.map(Token::getText)
				.map(t -> t.toLowerCase(Locale.ROOT))
				.flatMap(t -> function_words.entrySet().stream()
						.filter(e -> e.getValue().contains(t))
						.map(Map.Entry::getKey))
				.collect(groupingBy(l -> l, counting()));

		final long max = counts.values().stream().mapToLong(Long::longValue).max().orElse(0L);
		final List<ULocale> best = counts.entrySet().stream()
				.filter(e -> e.getValue() == max)
				.map(Map.Entry::getKey)
				.collect(toList());

		if (max == 0 || best.size() != 1)
		{
			log.debug("Cannot detect language of \"" + result.getText() + "\"");
			return result;
		}

		log.debug("Detected language " + best.get(0) + " for \"" + result.getText() + "\"");
		return result.withLanguage(best.get(0));
	}
}
