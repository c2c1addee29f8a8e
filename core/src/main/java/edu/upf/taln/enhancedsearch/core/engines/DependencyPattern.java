package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.Options;
import edu.upf.taln.enhancedsearch.core.structures.NamedEntityType;
import edu.upf.taln.enhancedsearch.core.structures.RelationshipType;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.joining;

/**
 * Rule matched against the abstracted form of a query, where named entities read {type<begin/end>}, numbers
 * #<begin/end>, quoted literals "<begin/end> and any other token word<begin/end>.
 * Named groups subject, predicate, object and literal capture the ids of the elements filling each role.
 * Patterns carrying a relationship join their subject and object as a conjunction instead.
 */
public final class DependencyPattern
{
	public static final String SUBJECT = "subject";
	public static final String PREDICATE = "predicate";
	public static final String OBJECT = "object";
	public static final String LITERAL = "literal";
	private static final String ID = "\\d+/\\d+";
	private static final Pattern GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

	private final String name;
	private final Pattern pattern;
	private final Set<String> roles = new HashSet<>();
	private final RelationshipType relationship;

	public DependencyPattern(String name, String regex)
	{
		this(name, regex, null);
	}

	public DependencyPattern(String name, String regex, RelationshipType relationship)
	{
		this.name = name;
		this.relationship = relationship;
		this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		Matcher m = GROUP.matcher(regex);
		while (m.find())
			roles.add(m.group(1));
		if (!roles.contains(SUBJECT))
			throw new IllegalArgumentException("Pattern " + name + " has no subject group");
		if (relationship != null && !roles.contains(OBJECT))
			throw new IllegalArgumentException("Conjunction pattern " + name + " has no object group");
	}

	/**
	 * Default rules, in the order they are tried:
	 * taxon with an attribute value and attribute ("Pflanzen mit roten Blüten"),
	 * taxon with a number and attribute ("Pflanzen mit 3 Kelchblättern"),
	 * taxon with a single compound property ("Pflanzen mit Pfahlwurzel"),
	 * two entities or literals joined by "und" or "and" ("Fagus und Quercus"),
	 * two entities or literals joined by "oder" or "or" ("Fagus oder \"Gerste\"").
	 */
	public static List<DependencyPattern> defaults(Options options)
	{
		final String taxon = entity(NamedEntityType.TAXON_LIKE, SUBJECT);
		final String indicator = options.attribute_indicators.isEmpty() ? "" :
				"(?:(?:" + options.attribute_indicators.stream()
						.sorted()
						.map(Pattern::quote)
						.collect(joining("|")) + ")<" + ID + "> )?";
		final String misc = "\\{" + NamedEntityType.MISCELLANEOUS.getShortName() + "<(?<%s>" + ID + ")>\\}";

		return List.of(
				new DependencyPattern("TaxonProperty",
						taxon + " " + indicator + String.format(misc, OBJECT) + " " + String.format(misc, PREDICATE)),
				new DependencyPattern("TaxonNumericalProperty",
						taxon + " " + indicator + "#<(?<" + LITERAL + ">" + ID + ")> " + String.format(misc, PREDICATE)),
				new DependencyPattern("TaxonCompoundProperty",
						taxon + " " + indicator + String.format(misc, OBJECT)),
				new DependencyPattern("AndConjunction", conjunction(options, RelationshipType.AND), RelationshipType.AND),
				new DependencyPattern("OrConjunction", conjunction(options, RelationshipType.OR), RelationshipType.OR));
	}

	/**
	 * Any entity, number or quoted literal on each side of a conjunction word. Plain words are not query elements.
	 */
	private static String conjunction(Options options, RelationshipType relationship)
	{
		final String words = options.conjunctions.entrySet().stream()
				.filter(e -> e.getValue() == relationship)
				.map(Map.Entry::getKey)
				.sorted()
				.map(Pattern::quote)
				.collect(joining("|"));
		// (?!) never matches, for options without words for this relationship
		final String joiner = words.isEmpty() ? "(?!)" : "(?:" + words + ")<" + ID + ">";
		return element(SUBJECT) + " " + joiner + " " + element(OBJECT);
	}

	private static String element(String group)
	{
		return "(?:\\{[a-z]+|[#\"])<(?<" + group + ">" + ID + ")>\\}?";
	}

	private static String entity(Set<NamedEntityType> types, String group)
	{
		return "\\{(?:" + types.stream()
				.sorted()
				.map(NamedEntityType::getShortName)
				.collect(joining("|")) + ")<(?<" + group + ">" + ID + ")>\\}";
	}

	public String getName() { return name; }
	public Pattern getPattern() { return pattern; }
	public boolean hasRole(String role) { return roles.contains(role); }
	public RelationshipType getRelationship() { return relationship; }

	@Override
	public String toString()
	{
		return name + " " + pattern.pattern();
	}
}
