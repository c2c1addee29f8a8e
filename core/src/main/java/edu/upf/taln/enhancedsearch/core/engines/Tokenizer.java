package edu.upf.taln.enhancedsearch.core.engines;

/**
 * Engines producing the token sequence of a query
 */
public interface Tokenizer extends AnnotationEngine {}
