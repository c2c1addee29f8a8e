package edu.upf.taln.enhancedsearch.core.dictionaries;

import com.ibm.icu.util.ULocale;

/**
 * Per-language mapping from word forms to lemmas
 */
public interface LemmaLookup
{
	String lookup(String word, ULocale language);

	/**
	 * Lookup for deployments without lemma dictionaries: every word is its own lowercased lemma
	 */
	static LemmaLookup lowercase()
	{
		return (word, language) -> word.toLowerCase(language.toLocale());
	}
}
