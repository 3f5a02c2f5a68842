package io.ligolw.types;

/**
 * The broad family of a declared LIGO Light Weight type.
 * Determines how character data is converted into numbers.
 */
public enum StorageKind {
	INTEGER,
	FLOAT,
}
