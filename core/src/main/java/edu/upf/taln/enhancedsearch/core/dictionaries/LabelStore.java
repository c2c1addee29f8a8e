package edu.upf.taln.enhancedsearch.core.dictionaries;

import edu.upf.taln.enhancedsearch.core.structures.LabelEntry;

import java.util.Optional;

/**
 * Maps a label to the identifiers it denotes, grouped by type. An empty result means the label is unknown.
 */
public interface LabelStore
{
	Optional<LabelEntry> lookup(String key);
}
