/**
 * Incremental splitting of delimited character data into typed scalar values.
 */
package io.ligolw.tokenizer;
