package edu.upf.taln.enhancedsearch.core.dictionaries;

import com.google.common.base.Stopwatch;
import com.ibm.icu.util.ULocale;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lemma lookup backed by one tab-separated file per language, named after the language code (e.g. de.tsv),
 * with lines of the form form[TAB]lemma. Dictionaries are loaded on first use.
 */
public class DictionaryLemmaLookup implements LemmaLookup
{
	private final Map<String, Path> files = new HashMap<>();
	private final Map<String, Map<String, String>> dictionaries = new ConcurrentHashMap<>();
	private final static Logger log = LogManager.getLogger();

	public DictionaryLemmaLookup(Path folder)
	{
		if (!Files.isDirectory(folder))
			throw new IllegalArgumentException(folder + " is not a valid folder");

		FileUtils.listFiles(folder.toFile(), new String[]{"tsv"}, false).forEach(f ->
				files.put(StringUtils.removeEnd(f.getName(), ".tsv").toLowerCase(Locale.ROOT), f.toPath()));
		log.info("Lemma dictionaries available for " + files.keySet());
	}

	public DictionaryLemmaLookup(Map<ULocale, Path> files)
	{
		files.forEach((l, p) -> this.files.put(l.getLanguage(), p));
	}

	public Set<String> getLanguages() { return Collections.unmodifiableSet(files.keySet()); }

	@Override
	public String lookup(String word, ULocale language)
	{
		final String code = language.getLanguage();
		if (!files.containsKey(code))
			return word.toLowerCase(language.toLocale());

		final Map<String, String> dictionary = dictionaries.computeIfAbsent(code, this::load);
		return dictionary.getOrDefault(word.toLowerCase(language.toLocale()), word);
	}

	private Map<String, String> load(String language)
	{
		Stopwatch timer = Stopwatch.createStarted();
		final Path file = files.get(language);
		try
		{
			Map<String, String> dictionary = new HashMap<>();
			for (String line : Files.readAllLines(file, StandardCharsets.UTF_8))
			{
				if (line.isBlank() || line.startsWith("#"))
					continue;
				final String[] columns = line.split("\t");
				if (columns.length < 2)
					continue;
				dictionary.putIfAbsent(columns[0].trim().toLowerCase(Locale.ROOT), columns[1].trim());
			}
			log.info("Loaded " + dictionary.size() + " lemmas for " + language + " in " + timer.stop());
			return dictionary;
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Cannot read lemma dictionary " + file, e);
		}
	}
}
