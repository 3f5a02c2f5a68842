/**
 * An in-memory tree representation of LIGO Light Weight XML documents.
 * <p>
 * {@link io.ligolw.Documents} loads a document using a {@link io.ligolw.ContentHandler},
 * which creates one {@link io.ligolw.Element} per tag.
 * The element classes here keep their content as text;
 * other modules supply handlers that substitute elements which interpret it.
 */
package io.ligolw;
