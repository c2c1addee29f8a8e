package edu.upf.taln.enhancedsearch.core.structures;

import org.apache.commons.lang3.tuple.Pair;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A span of the query text. Offsets are half-open and relative to the original query string.
 * Immutable: lemmatization produces a new token.
 */
public final class Token implements Comparable<Token>
{
	private final int begin;
	private final int end;
	private final String text;
	private final String lemma; // null until lemmatized
	private final boolean quoted;

	public Token(int begin, int end, String text, boolean quoted)
	{
		this(begin, end, text, null, quoted);
	}

	public Token(int begin, int end, String text, String lemma, boolean quoted)
	{
		if (begin < 0 || end < begin)
			throw new IllegalArgumentException("Invalid token span " + begin + "-" + end);
		this.begin = begin;
		this.end = end;
		this.text = Objects.requireNonNull(text);
		this.lemma = lemma;
		this.quoted = quoted;
	}

	public Token withLemma(String lemma)
	{
		return new Token(begin, end, text, lemma, quoted);
	}

	public int getBegin() { return begin; }
	public int getEnd() { return end; }
	public Pair<Integer, Integer> getSpan() { return Pair.of(begin, end); }
	public String getText() { return text; }
	public String getLemma() { return lemma; }
	public boolean isQuoted() { return quoted; }
	public String getId() { return begin + "/" + end; }

	public boolean overlaps(int other_begin, int other_end)
	{
		return begin < other_end && other_begin < end;
	}

	@Override
	public int compareTo(@Nonnull Token o)
	{
		int c = Integer.compare(begin, o.begin);
		return c != 0 ? c : Integer.compare(end, o.end);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Token token = (Token) o;
		return begin == token.begin && end == token.end && quoted == token.quoted &&
				text.equals(token.text) && Objects.equals(lemma, token.lemma);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(begin, end, text, lemma, quoted);
	}

	@Override
	public String toString()
	{
		return text + "<" + getId() + ">";
	}
}
