package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitespace tokenizer. Quoted substrings are kept together as a single token without the quotes, numbers keep their
 * decimal separator, and punctuation is stripped from the edges of any other token.
 */
public class SimpleTokenizer implements Tokenizer
{
	public static final Pattern NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?");
	private static final String QUOTES = "\"'";
	private static final String LEADING_PUNCTUATION = "!?;,:¿¡";
	private static final String TRAILING_PUNCTUATION = "!?;,:.";

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		return result.withTokens(tokenize(result.getText()));
	}

	public List<Token> tokenize(String text)
	{
		List<Token> tokens = new ArrayList<>();
		final int n = text.length();
		int i = 0;
		while (i < n)
		{
			final char c = text.charAt(i);
			if (Character.isWhitespace(c))
			{
				++i;
				continue;
			}

			if (QUOTES.indexOf(c) >= 0)
			{
				final int close = text.indexOf(c, i + 1);
				final int end = close < 0 ? n : close;
				if (end > i + 1)
					tokens.add(new Token(i + 1, end, text.substring(i + 1, end), true));
				i = close < 0 ? n : close + 1;
				continue;
			}

			final int start = i;
			while (i < n && !Character.isWhitespace(text.charAt(i)))
				++i;

			int begin = start;
			int end = i;
			if (!NUMBER.matcher(text.substring(begin, end)).matches())
			{
				while (begin < end && LEADING_PUNCTUATION.indexOf(text.charAt(begin)) >= 0)
					++begin;
				while (end > begin && TRAILING_PUNCTUATION.indexOf(text.charAt(end - 1)) >= 0)
					--end;
			}

			if (end > begin)
				tokens.add(new Token(begin, end, text.substring(begin, end), false));
		}

		return tokens;
	}
}
