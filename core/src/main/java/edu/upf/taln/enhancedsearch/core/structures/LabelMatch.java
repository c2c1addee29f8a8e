package edu.upf.taln.enhancedsearch.core.structures;

import java.util.Objects;

/**
 * A span of tokens whose text or lemmas were found in the label store
 */
public final class LabelMatch
{
	private final int begin;
	private final int end;
	private final String text;
	private final String lemma;
	private final String key;
	private final LabelEntry entry;

	public LabelMatch(int begin, int end, String text, String lemma, String key, LabelEntry entry)
	{
		this.begin = begin;
		this.end = end;
		this.text = text;
		this.lemma = lemma;
		this.key = key;
		this.entry = Objects.requireNonNull(entry);
	}

	public int getBegin() { return begin; }
	public int getEnd() { return end; }
	public String getText() { return text; }
	public String getLemma() { return lemma; }
	public String getKey() { return key; }
	public LabelEntry getEntry() { return entry; }

	@Override
	public String toString()
	{
		return text + "<" + begin + "/" + end + "> " + entry;
	}
}
