package edu.upf.taln.enhancedsearch.core.dictionaries;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Label database held in memory, loaded from a JSON object whose members are label entries
 */
public class InMemoryKeyValueDatabase implements KeyValueDatabase
{
	private final Map<String, String> data = new HashMap<>();
	private final static Logger log = LogManager.getLogger();

	public InMemoryKeyValueDatabase(Map<String, String> data)
	{
		data.forEach(this::put);
	}

	public static InMemoryKeyValueDatabase load(Path file) throws IOException
	{
		log.info("Loading label database from " + file);
		final String json = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		return parse(json);
	}

	public static InMemoryKeyValueDatabase load(InputStream input) throws IOException
	{
		return parse(new String(input.readAllBytes(), StandardCharsets.UTF_8));
	}

	private static InMemoryKeyValueDatabase parse(String json)
	{
		final JsonObject root = JsonParser.parseString(json).getAsJsonObject();
		Map<String, String> data = new HashMap<>();
		for (Map.Entry<String, JsonElement> e : root.entrySet())
		{
			// entries may be stored either as nested objects or as already encoded strings
			final JsonElement value = e.getValue();
			data.put(e.getKey(), value.isJsonPrimitive() ? value.getAsString() : value.toString());
		}
		log.info("Loaded " + data.size() + " labels");
		return new InMemoryKeyValueDatabase(data);
	}

	public void put(String key, String value)
	{
		data.put(KeyValueDatabase.sanitize(key.toLowerCase(Locale.ROOT)), value);
	}

	public int size() { return data.size(); }

	@Override
	public Optional<String> read(String key)
	{
		return Optional.ofNullable(data.get(KeyValueDatabase.sanitize(key.toLowerCase(Locale.ROOT))));
	}
}
