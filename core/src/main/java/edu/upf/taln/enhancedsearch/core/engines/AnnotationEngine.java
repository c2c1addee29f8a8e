package edu.upf.taln.enhancedsearch.core.engines;

import edu.upf.taln.enhancedsearch.core.structures.AnnotationResult;

import java.util.Set;

/**
 * Step of the annotation pipeline: takes the partial result built so far and returns an updated one.
 * Engines list the engines whose output they consume, which must run earlier in the pipeline.
 */
public interface AnnotationEngine
{
	AnnotationResult apply(AnnotationResult result);

	default Set<Class<? extends AnnotationEngine>> getPrerequisites()
	{
		return Set.of();
	}

	default String getName()
	{
		return getClass().getSimpleName();
	}
}
