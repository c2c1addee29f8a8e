package edu.upf.taln.enhancedsearch.core.query;

import com.google.common.collect.ListMultimap;
import edu.upf.taln.enhancedsearch.core.structures.Statement;

import java.util.List;

/**
 * Executes triple patterns against a knowledge store.
 * Results map a triple position to the identifiers bound to it, position 1 holding the subject variable.
 */
public interface SemanticEngine
{
	int SUBJECT_POSITION = 1;

	ListMultimap<Integer, String> execute(List<Statement> statements);
}
