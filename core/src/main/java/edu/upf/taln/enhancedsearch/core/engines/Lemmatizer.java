package edu.upf.taln.enhancedsearch.core.engines;

import com.ibm.icu.util.ULocale;
import edu.upf.taln.enhancedsearch.core.dictionaries.LemmaLookup;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.Token;

import java.util.Set;

import static java.util.stream.Collectors.toList;

/**
 * Sets the lemma of every token. Quoted tokens and numbers are their own lemma.
 */
public class Lemmatizer implements AnnotationEngine
{
	private final LemmaLookup lookup;
	private final ULocale default_language;

	public Lemmatizer(LemmaLookup lookup, ULocale default_language)
	{
		this.lookup = lookup;
		this.default_language = default_language;
	}

	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(Tokenizer.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final ULocale language = result.getLanguage().orElse(default_language);
		return result.withTokens(result.getTokens().stream()
				.map(t -> t.withLemma(lemmatize(t, language)))
				.collect(toList()));
	}

	public String lemmatize(Token token, ULocale language)
	{
		if (token.isQuoted() || SimpleTokenizer.NUMBER.matcher(token.getText()).matches())
			return token.getText();
		return lookup.lookup(token.getText(), language);
	}
}
