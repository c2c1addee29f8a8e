package edu.upf.taln.enhancedsearch.core.dictionaries;

import java.util.Optional;

/**
 * Raw access to a label database mapping lowercase labels to JSON-encoded entries
 */
public interface KeyValueDatabase
{
	Optional<String> read(String key);

	/**
	 * Keys may not contain the separator used by key-value servers
	 */
	static String sanitize(String key)
	{
		return key.replace(":", "");
	}
}
