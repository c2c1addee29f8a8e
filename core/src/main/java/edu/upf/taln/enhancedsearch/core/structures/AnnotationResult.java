package edu.upf.taln.enhancedsearch.core.structures;

import com.ibm.icu.util.ULocale;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Partial result threaded through the annotation engines.
 * Immutable: every update returns a new result, and annotations are copied so that a later engine never alters the
 * output of an earlier one.
 */
public final class AnnotationResult
{
	private final String text;
	private final ULocale language; // null if not detected
	private final List<Token> tokens;
	private final List<Annotation> literals;
	private final List<LabelMatch> lookups;
	private final List<Annotation> annotations;
	private final List<Statement> statements;

	public AnnotationResult(String text)
	{
		this(text, null, List.of(), List.of(), List.of(), List.of(), List.of());
	}

	private AnnotationResult(String text, ULocale language, List<Token> tokens, List<Annotation> literals,
	                         List<LabelMatch> lookups, List<Annotation> annotations, List<Statement> statements)
	{
		this.text = Objects.requireNonNull(text);
		this.language = language;
		this.tokens = List.copyOf(tokens);
		this.literals = copy(literals);
		this.lookups = List.copyOf(lookups);
		this.annotations = copy(annotations);
		this.statements = List.copyOf(statements);
	}

	public AnnotationResult withLanguage(ULocale language)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public AnnotationResult withTokens(List<Token> tokens)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public AnnotationResult withLiterals(List<Annotation> literals)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public AnnotationResult withLookups(List<LabelMatch> lookups)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public AnnotationResult withAnnotations(List<Annotation> annotations)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public AnnotationResult withStatements(List<Statement> statements)
	{
		return new AnnotationResult(text, language, tokens, literals, lookups, annotations, statements);
	}

	public String getText() { return text; }
	public Optional<ULocale> getLanguage() { return Optional.ofNullable(language); }
	public List<Token> getTokens() { return tokens; }
	public List<LabelMatch> getLookups() { return lookups; }
	public List<Statement> getStatements() { return statements; }

	/**
	 * @return copies of the literal annotations
	 */
	public List<Annotation> getLiterals() { return copy(literals); }

	/**
	 * @return copies of the named entity annotations
	 */
	public List<Annotation> getAnnotations() { return copy(annotations); }

	public boolean isLiteral(Token token)
	{
		return literals.stream().anyMatch(l -> l.covers(token));
	}

	/**
	 * Tokens covered neither by a named entity annotation nor by a literal
	 */
	public List<Token> getResidualTokens()
	{
		return tokens.stream()
				.filter(t -> literals.stream().noneMatch(l -> l.overlaps(t.getBegin(), t.getEnd())))
				.filter(t -> annotations.stream().noneMatch(a -> a.overlaps(t.getBegin(), t.getEnd())))
				.collect(toList());
	}

	private static List<Annotation> copy(List<Annotation> annotations)
	{
		return annotations.stream()
				.map(Annotation::new)
				.collect(toList());
	}

	@Override
	public String toString()
	{
		return "AnnotationResult{" + text + ", language=" + language + ", tokens=" + tokens +
				", literals=" + literals + ", annotations=" + annotations + ", statements=" + statements + "}";
	}
}
