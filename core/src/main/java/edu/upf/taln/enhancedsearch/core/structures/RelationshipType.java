package edu.upf.taln.enhancedsearch.core.structures;

/**
 * Logical relation between two conjoined query elements, e.g. "Fagus und Quercus"
 */
public enum RelationshipType
{
	AND, OR
}
