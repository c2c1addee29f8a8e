package edu.upf.taln.enhancedsearch.tools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import edu.upf.taln.enhancedsearch.core.structures.*;

import java.util.Collection;

/**
 * JSON rendering of annotated queries
 */
public final class QueryPrinter
{
	private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	public static String print(Query query)
	{
		JsonObject json = new JsonObject();
		json.addProperty("text", query.getText());
		query.getLanguage().ifPresent(l -> json.addProperty("language", l.getLanguage()));

		JsonArray annotations = new JsonArray();
		query.getAnnotations().forEach(a -> annotations.add(toJson(a)));
		json.add("annotations", annotations);

		JsonArray literals = new JsonArray();
		query.getLiterals().forEach(a -> literals.add(toJson(a)));
		json.add("literals", literals);

		JsonArray statements = new JsonArray();
		query.getStatements().forEach(s -> statements.add(toJson(s)));
		json.add("statements", statements);

		return gson.toJson(json);
	}

	private static JsonObject toJson(Annotation a)
	{
		JsonObject json = new JsonObject();
		json.addProperty("id", a.getId());
		json.addProperty("text", a.getText());
		json.addProperty("type", a.getType().name());
		json.addProperty("safe", a.isSafe());
		json.add("uris", toJson(a.getUris()));
		if (!a.getAlternatives().isEmpty())
		{
			JsonArray alternatives = new JsonArray();
			a.getAlternatives().forEach(t -> alternatives.add(t.name()));
			json.add("alternatives", alternatives);
		}
		JsonArray features = new JsonArray();
		a.getFeatures().forEach(f ->
		{
			JsonObject feature = new JsonObject();
			if (f.getProperty() != null)
				feature.add("property", toJson(f.getProperty()));
			if (f.getValue() != null)
				feature.add("value", toJson(f.getValue()));
			if (f.getLiteral() != null)
				feature.addProperty("literal", f.getLiteral());
			features.add(feature);
		});
		json.add("features", features);
		return json;
	}

	private static JsonObject toJson(Statement s)
	{
		JsonObject json = new JsonObject();
		json.addProperty("variable", s.getVariable());
		json.addProperty("subject_id", s.getSubjectId());
		json.add("subject", toJson(s.getSubject()));
		if (s.getPredicate() != null)
			json.add("predicate", toJson(s.getPredicate()));
		if (s.getObject() != null)
			json.add("object", toJson(s.getObject()));
		if (s.getLiteral() != null)
			json.addProperty("literal", s.getLiteral());
		if (s.isConjunction())
		{
			json.addProperty("object_id", s.getObjectId());
			json.addProperty("relationship", s.getRelationship().name());
		}
		return json;
	}

	private static JsonArray toJson(Collection<Uri> uris)
	{
		JsonArray array = new JsonArray();
		uris.forEach(u -> array.add(u.getUrl()));
		return array;
	}
}
