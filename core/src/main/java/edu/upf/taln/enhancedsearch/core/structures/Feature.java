package edu.upf.taln.enhancedsearch.core.structures;

import java.util.Objects;
import java.util.Set;

/**
 * A fact extracted about an annotation, e.g. flower part = red color.
 * A null property denotes a bare identity fact.
 */
public final class Feature
{
	private final Set<Uri> property;
	private final Set<Uri> value;
	private final String literal;

	public Feature(Set<Uri> property, Set<Uri> value, String literal)
	{
		this.property = property == null ? null : Set.copyOf(property);
		this.value = value == null ? null : Set.copyOf(value);
		this.literal = literal;
	}

	public static Feature identity(Set<Uri> value)
	{
		return new Feature(null, value, null);
	}

	public Set<Uri> getProperty() { return property; }
	public Set<Uri> getValue() { return value; }
	public String getLiteral() { return literal; }
	public boolean isIdentity() { return property == null; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Feature feature = (Feature) o;
		return Objects.equals(property, feature.property) && Objects.equals(value, feature.value) &&
				Objects.equals(literal, feature.literal);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(property, value, literal);
	}

	@Override
	public String toString()
	{
		return "(" + property + ", " + (literal != null ? "\"" + literal + "\"" : value) + ")";
	}
}
