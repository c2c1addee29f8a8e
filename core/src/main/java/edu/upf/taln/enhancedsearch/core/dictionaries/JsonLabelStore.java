package edu.upf.taln.enhancedsearch.core.dictionaries;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import edu.upf.taln.enhancedsearch.core.structures.LabelEntry;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.Uri;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Decodes entries of the form {"Plant_Flora": [["http://...", 3], ...], "Location_Place": [...]}.
 * Unknown type names and invalid positions are skipped with a warning.
 */
public class JsonLabelStore implements LabelStore
{
	private final KeyValueDatabase database;
	private final static Logger log = LogManager.getLogger();

	public JsonLabelStore(KeyValueDatabase database)
	{
		this.database = database;
	}

	@Override
	public Optional<LabelEntry> lookup(String key)
	{
		return database.read(key)
				.map(json -> decode(key, json))
				.filter(e -> !e.isEmpty());
	}

	static LabelEntry decode(String key, String json)
	{
		final JsonObject object = JsonParser.parseString(json).getAsJsonObject();
		ListMultimap<NamedEntityType, Pair<String, Integer>> uris = ArrayListMultimap.create();

		for (Map.Entry<String, JsonElement> e : object.entrySet())
		{
			final Optional<NamedEntityType> type = NamedEntityType.fromName(e.getKey());
			if (type.isEmpty())
			{
				log.warn("Ignoring unknown type " + e.getKey() + " in entry for " + key);
				continue;
			}

			for (JsonElement element : e.getValue().getAsJsonArray())
			{
				final JsonArray pair = element.getAsJsonArray();
				final String url = pair.get(0).getAsString();
				final int position = pair.size() > 1 ? pair.get(1).getAsInt() : Uri.OBJECT_POSITION;
				if (!Uri.isValidPosition(position))
				{
					log.warn("Ignoring " + url + " with invalid position " + position + " in entry for " + key);
					continue;
				}
				uris.put(type.get(), Pair.of(url, position));
			}
		}

		return new LabelEntry(uris);
	}
}
