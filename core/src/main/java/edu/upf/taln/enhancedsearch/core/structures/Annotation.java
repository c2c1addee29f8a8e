package edu.upf.taln.enhancedsearch.core.structures;

import org.apache.commons.lang3.tuple.Pair;

import javax.annotation.Nonnull;
import java.util.*;

/**
 * A span of the query tagged with a type and a set of candidate or resolved identifiers.
 * The uris set changes as disambiguation and resolution run, whereas features are append-only and keep the
 * evidence the annotation was built from.
 */
public final class Annotation implements Comparable<Annotation>
{
	private final int begin;
	private final int end;
	private final String text;
	private final String lemma;
	private final NamedEntityType type;
	private final boolean literal;
	private Set<Uri> uris;
	private final List<Feature> features = new ArrayList<>();
	private final Set<NamedEntityType> alternatives = new LinkedHashSet<>();
	private boolean safe;

	public Annotation(int begin, int end, String text, String lemma, NamedEntityType type, Collection<Uri> uris, boolean safe)
	{
		this(begin, end, text, lemma, type, uris, safe, false);
	}

	private Annotation(int begin, int end, String text, String lemma, NamedEntityType type, Collection<Uri> uris,
	                   boolean safe, boolean literal)
	{
		if (begin < 0 || end <= begin)
			throw new IllegalArgumentException("Invalid annotation span " + begin + "-" + end);
		this.begin = begin;
		this.end = end;
		this.text = Objects.requireNonNull(text);
		this.lemma = lemma;
		this.type = Objects.requireNonNull(type);
		this.uris = new LinkedHashSet<>(uris);
		this.safe = safe;
		this.literal = literal;
	}

	/**
	 * Copy constructor: annotations are copied between engines so that each engine output can be inspected on its own
	 */
	public Annotation(Annotation other)
	{
		this(other.begin, other.end, other.text, other.lemma, other.type, other.uris, other.safe, other.literal);
		this.features.addAll(other.features);
		this.alternatives.addAll(other.alternatives);
	}

	/**
	 * Literal value, such as a quoted string or a number. Literals carry no identifiers.
	 */
	public static Annotation literal(Token token)
	{
		return new Annotation(token.getBegin(), token.getEnd(), token.getText(), token.getText(),
				NamedEntityType.MISCELLANEOUS, List.of(), true, true);
	}

	public int getBegin() { return begin; }
	public int getEnd() { return end; }
	public Pair<Integer, Integer> getSpan() { return Pair.of(begin, end); }
	public String getText() { return text; }
	public String getLemma() { return lemma; }
	public NamedEntityType getType() { return type; }
	public boolean isLiteral() { return literal; }
	public boolean isSafe() { return safe; }
	public String getId() { return begin + "/" + end; }

	public Set<Uri> getUris() { return Collections.unmodifiableSet(uris); }
	public List<Feature> getFeatures() { return Collections.unmodifiableList(features); }
	public Set<NamedEntityType> getAlternatives() { return Collections.unmodifiableSet(alternatives); }

	public void setUris(Collection<Uri> uris)
	{
		this.uris = new LinkedHashSet<>(uris);
	}

	public void setSafe(boolean safe)
	{
		this.safe = safe;
		this.uris = uris.stream()
				.map(u -> u.withSafe(safe))
				.collect(LinkedHashSet::new, Set::add, Set::addAll);
	}

	public void addFeature(Feature feature)
	{
		features.add(Objects.requireNonNull(feature));
	}

	public void addAlternatives(Collection<NamedEntityType> types)
	{
		types.stream()
				.filter(t -> t != type)
				.forEach(alternatives::add);
	}

	public boolean overlaps(int other_begin, int other_end)
	{
		return begin < other_end && other_begin < end;
	}

	public boolean overlaps(Annotation other)
	{
		return overlaps(other.begin, other.end);
	}

	public boolean covers(Token token)
	{
		return begin <= token.getBegin() && token.getEnd() <= end;
	}

	@Override
	public int compareTo(@Nonnull Annotation o)
	{
		int c = Integer.compare(begin, o.begin);
		if (c == 0)
			c = Integer.compare(end, o.end);
		if (c == 0)
			c = type.compareTo(o.type);
		return c;
	}

	@Override
	public String toString()
	{
		return text + "<" + getId() + "> " + type + (safe ? "" : "?") + " " + uris;
	}
}
