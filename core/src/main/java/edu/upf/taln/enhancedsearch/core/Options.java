package edu.upf.taln.enhancedsearch.core;

import com.ibm.icu.util.ULocale;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.RelationshipType;

import java.util.*;

public class Options
{
	public List<NamedEntityType> annotation_priority = new ArrayList<>(NamedEntityType.ANNOTATION_PRIORITY); // total order used to break ties between types, highest first
	public Map<String, NamedEntityType> context_cues = new HashMap<>(Map.of("in", NamedEntityType.LOCATION,
			"im", NamedEntityType.LOCATION, "bei", NamedEntityType.LOCATION, "near", NamedEntityType.LOCATION,
			"at", NamedEntityType.LOCATION)); // words preceding a span which select one of its types
	public Map<String, RelationshipType> conjunctions = new HashMap<>(Map.of("und", RelationshipType.AND,
			"and", RelationshipType.AND, "oder", RelationshipType.OR, "or", RelationshipType.OR)); // words joining two query elements
	public Set<String> attribute_indicators = new HashSet<>(Set.of("mit", "with")); // optional words between a taxon and its properties
	public Set<String> lookup_blacklist = new HashSet<>(Set.of("l.", "(l.)", "r.", "&", "var.", "in")); // never sent to the label store
	public int min_lookup_length = 3; // keys shorter than this are not looked up
	public int max_span_tokens = 6; // longest token span looked up as a single label
	public ULocale default_language = new ULocale("de"); // used by the lemmatizer when no language was detected
	public String query_variable = "taxon"; // name of the variable bound to subjects when resolving statements
	public int result_limit = 1000; // maximum number of identifiers bound per resolved subject

	public Options() {}

	public Options(Options o)
	{
		this.annotation_priority = new ArrayList<>(o.annotation_priority);
		this.context_cues = new HashMap<>(o.context_cues);
		this.conjunctions = new HashMap<>(o.conjunctions);
		this.attribute_indicators = new HashSet<>(o.attribute_indicators);
		this.lookup_blacklist = new HashSet<>(o.lookup_blacklist);
		this.min_lookup_length = o.min_lookup_length;
		this.max_span_tokens = o.max_span_tokens;
		this.default_language = o.default_language;
		this.query_variable = o.query_variable;
		this.result_limit = o.result_limit;
	}

	/**
	 * @throws IllegalArgumentException if any value is unusable
	 */
	public void validate()
	{
		if (annotation_priority.size() != NamedEntityType.values().length ||
				!EnumSet.copyOf(annotation_priority).containsAll(EnumSet.allOf(NamedEntityType.class)))
			throw new IllegalArgumentException("Annotation priority must list every type exactly once: " + annotation_priority);
		if (context_cues.values().stream().anyMatch(Objects::isNull))
			throw new IllegalArgumentException("Context cue without type: " + context_cues);
		if (conjunctions.values().stream().anyMatch(Objects::isNull))
			throw new IllegalArgumentException("Conjunction without relationship: " + conjunctions);
		if (min_lookup_length < 1)
			throw new IllegalArgumentException("Invalid minimum lookup length " + min_lookup_length);
		if (max_span_tokens < 1)
			throw new IllegalArgumentException("Invalid maximum span size " + max_span_tokens);
		if (default_language == null)
			throw new IllegalArgumentException("No default language");
		if (query_variable == null || !query_variable.matches("\\??\\w+"))
			throw new IllegalArgumentException("Invalid query variable " + query_variable);
		if (result_limit < 1)
			throw new IllegalArgumentException("Invalid result limit " + result_limit);
	}

	public String getVariable()
	{
		return query_variable.startsWith("?") ? query_variable : "?" + query_variable;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tannotation_priority = " + annotation_priority +
				"\n\tcontext_cues = " + context_cues +
				"\n\tconjunctions = " + conjunctions +
				"\n\tattribute_indicators = " + attribute_indicators +
				"\n\tlookup_blacklist = " + lookup_blacklist +
				"\n\tmin_lookup_length = " + min_lookup_length +
				"\n\tmax_span_tokens = " + max_span_tokens +
				"\n\tdefault_language = " + default_language +
				"\n\tquery_variable = " + query_variable +
				"\n\tresult_limit = " + result_limit;
	}
}
