package edu.upf.taln.enhancedsearch.core.structures;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of categories assigned to annotated spans.
 * Besides the canonical names, the names used by deployed label databases are accepted when parsing.
 */
public enum NamedEntityType
{
	PLANT("plant", "Plant_Flora"),
	ANIMAL("animal", "Animal_Fauna"),
	TAXON("taxon", "Taxon"),
	LOCATION("location", "Location_Place"),
	MISCELLANEOUS("misc", "Miscellaneous");

	/**
	 * Default total order used to break ties between competing types, highest priority first
	 */
	public static final List<NamedEntityType> ANNOTATION_PRIORITY = List.of(PLANT, ANIMAL, TAXON, LOCATION, MISCELLANEOUS);
	public static final Set<NamedEntityType> TAXON_LIKE = Set.of(PLANT, ANIMAL, TAXON);

	private final String shortName;
	private final String databaseName;

	NamedEntityType(String shortName, String databaseName)
	{
		this.shortName = shortName;
		this.databaseName = databaseName;
	}

	public String getShortName() { return shortName; }
	public String getDatabaseName() { return databaseName; }

	/**
	 * Lenient lookup: enum constant, short and database names are all matched ignoring case.
	 */
	public static Optional<NamedEntityType> fromName(String name)
	{
		if (name == null)
			return Optional.empty();

		final String n = name.trim().toLowerCase(Locale.ROOT);
		for (NamedEntityType type : values())
		{
			if (type.name().toLowerCase(Locale.ROOT).equals(n) ||
					type.shortName.equals(n) ||
					type.databaseName.toLowerCase(Locale.ROOT).equals(n))
				return Optional.of(type);
		}
		return Optional.empty();
	}

	/**
	 * Strict lookup for configuration values
	 * @throws IllegalArgumentException if the name matches no type
	 */
	public static NamedEntityType parse(String name)
	{
		return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown named entity type " + name));
	}
}
