package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.structures.Annotation;
import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;
import edu.upf.taln.enhancedsearch.core.structures.Token;

import java.util.List;
import java.util.Set;

import static java.util.stream.Collectors.toList;

/**
 * Marks quoted tokens and numbers as literal values. Literal tokens are never looked up in the label store.
 */
public class LiteralAnnotationEngine implements AnnotationEngine
{
	@Override
	public Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of(Tokenizer.class);
	}

	@Override
	public AnnotationResult apply(AnnotationResult result)
	{
		final List<Annotation> literals = result.getTokens().stream()
				.filter(LiteralAnnotationEngine::isLiteral)
				.map(Annotation::literal)
				.collect(toList());
		return result.withLiterals(literals);
	}

	public static boolean isLiteral(Token token)
	{
		return token.isQuoted() || isNumber(token.getText());
	}

	public static boolean isNumber(String text)
	{
		return SimpleTokenizer.NUMBER.matcher(text).matches();
	}
}
