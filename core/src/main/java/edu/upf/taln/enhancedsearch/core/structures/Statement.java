package edu.upf.taln.enhancedsearch.core.structures;

import java.util.Objects;
import java.util.Set;

/**
 * Triple pattern extracted from a query. The subject position holds a query variable bound on resolution, the
 * subject identifiers constrain it. Statements without predicate, object or literal are identity statements.
 * Conjunction statements relate two query elements with AND/OR; they are never resolved, only used to build document
 * searches. The subject of a conjunction may be a literal, in which case its identifier set is empty.
 */
public final class Statement
{
	public static final String DEFAULT_VARIABLE = "?taxon";

	private final String variable;
	private final String subject_id;
	private final Set<Uri> subject;
	private final Set<Uri> predicate;
	private final Set<Uri> object;
	private final String object_id;
	private final String literal;
	private final RelationshipType relationship; // null unless this is a conjunction

	public Statement(String variable, String subject_id, Set<Uri> subject, Set<Uri> predicate, Set<Uri> object,
	                 String object_id, String literal)
	{
		this(variable, subject_id, subject, predicate, object, object_id, literal, null);
	}

	public Statement(String variable, String subject_id, Set<Uri> subject, Set<Uri> predicate, Set<Uri> object,
	                 String object_id, String literal, RelationshipType relationship)
	{
		if (variable == null || variable.isBlank())
			throw new IllegalArgumentException("Statement requires a subject variable");
		this.variable = variable.startsWith("?") ? variable : "?" + variable;
		this.subject_id = Objects.requireNonNull(subject_id);
		this.subject = Set.copyOf(subject);
		this.predicate = predicate == null ? null : Set.copyOf(predicate);
		this.object = object == null ? null : Set.copyOf(object);
		this.object_id = object_id;
		this.literal = literal;
		this.relationship = relationship;
		if (relationship != null && object_id == null)
			throw new IllegalArgumentException("Conjunction of " + subject_id + " without second element");
	}

	public static Statement identity(String variable, Annotation subject)
	{
		return new Statement(variable, subject.getId(), subject.getUris(), null, null, null, null);
	}

	public String getVariable() { return variable; }
	public String getSubjectId() { return subject_id; }
	public Set<Uri> getSubject() { return subject; }
	public Set<Uri> getPredicate() { return predicate; }
	public Set<Uri> getObject() { return object; }
	public String getObjectId() { return object_id; }
	public String getLiteral() { return literal; }
	public RelationshipType getRelationship() { return relationship; }

	public boolean isConjunction() { return relationship != null; }

	public boolean isIdentity()
	{
		return relationship == null && (predicate == null || predicate.isEmpty()) &&
				(object == null || object.isEmpty()) && literal == null;
	}

	public boolean isFiltering() { return relationship == null && !isIdentity(); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Statement s = (Statement) o;
		return variable.equals(s.variable) && subject_id.equals(s.subject_id) && subject.equals(s.subject) &&
				Objects.equals(predicate, s.predicate) && Objects.equals(object, s.object) &&
				Objects.equals(object_id, s.object_id) && Objects.equals(literal, s.literal) &&
				relationship == s.relationship;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(variable, subject_id, subject, predicate, object, object_id, literal, relationship);
	}

	@Override
	public String toString()
	{
		if (relationship != null)
			return "(" + subject_id + " " + relationship + " " + object_id + ")";
		return "(" + variable + " " + subject + ", " + predicate + ", " +
				(literal != null ? "\"" + literal + "\"" : object) + ")";
	}
}
