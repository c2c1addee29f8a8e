package edu.upf.taln.enhancedsearch.common;

import com.ibm.icu.util.ULocale;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import static java.util.stream.Collectors.toList;

public class SearchProperties
{
	private Path labelsFile = null;
	private Path lemmasFolder = null;
	private String sparqlEndpoint = null;
	private List<String> engines = ResourcesFactory.DEFAULT_ENGINES;
	private List<NamedEntityType> priority = null;
	private ULocale defaultLanguage = null;
	private Integer resultLimit = null;

	private final static Logger log = LogManager.getLogger();

	/**
	 * Zero-configuration properties: bundled demo labels, no lemma dictionaries and no knowledge store
	 */
	public SearchProperties() {}

	public SearchProperties(Path file)
	{
		Properties prop = new Properties();
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + file);
			throw new UncheckedIOException(e);
		}

		labelsFile = checkValidFile(prop.getProperty("es.labels.file"));
		lemmasFolder = checkValidFolder(prop.getProperty("es.lemmas.folder"));
		sparqlEndpoint = emptyToNull(prop.getProperty("es.sparql.endpoint"));
		final String engine_names = emptyToNull(prop.getProperty("es.pipeline.engines"));
		if (engine_names != null)
			engines = split(engine_names);
		final String priority_names = emptyToNull(prop.getProperty("es.annotation.priority"));
		if (priority_names != null)
			priority = split(priority_names).stream()
					.map(NamedEntityType::parse)
					.collect(toList());
		final String language = emptyToNull(prop.getProperty("es.language.default"));
		if (language != null)
			defaultLanguage = new ULocale(language);
		final String limit = emptyToNull(prop.getProperty("es.sparql.limit"));
		if (limit != null)
			resultLimit = parsePositive("es.sparql.limit", limit);
	}

	public Path getLabelsFile() { return labelsFile; }
	public Path getLemmasFolder() { return lemmasFolder; }
	public String getSparqlEndpoint() { return sparqlEndpoint; }
	public List<String> getEngines() { return engines; }
	public List<NamedEntityType> getPriority() { return priority; }
	public ULocale getDefaultLanguage() { return defaultLanguage; }
	public Integer getResultLimit() { return resultLimit; }

	private static List<String> split(String value)
	{
		return Arrays.stream(value.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(toList());
	}

	private static String emptyToNull(String value)
	{
		return value == null || value.isBlank() ? null : value.trim();
	}

	private static int parsePositive(String name, String value)
	{
		try
		{
			final int n = Integer.parseInt(value);
			if (n < 1)
				throw new IllegalArgumentException(name + " must be greater than 0: " + value);
			return n;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(name + " is not a number: " + value, e);
		}
	}

	private static Path checkValidFile(String value)
	{
		if (value == null || value.isBlank())
			return null;

		Path path = Paths.get(value.trim());
		if (!Files.exists(path) || !Files.isRegularFile(path))
		{
			throw new IllegalArgumentException(value + " is not a valid file");
		}
		return path;
	}

	private static Path checkValidFolder(String value)
	{
		if (value == null || value.isBlank())
			return null;

		Path path = Paths.get(value.trim());
		if (!Files.exists(path) || !Files.isDirectory(path))
		{
			throw new IllegalArgumentException(value + " is not a valid folder");
		}

		return path;
	}
}
