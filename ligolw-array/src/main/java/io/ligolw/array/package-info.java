/**
 * Typed, multi-dimensional numeric arrays for LIGO Light Weight documents.
 * <p>
 * {@link io.ligolw.array.ArrayContentHandler} makes the loader produce
 * {@link io.ligolw.array.TypedArray} elements, whose
 * {@link io.ligolw.array.ArrayStream} children parse delimited character data into a
 * {@link io.ligolw.array.NumericArray} and write it back out.
 * <p>
 * Two conventions govern the layout and are easy to get backward:
 * <ul>
 *     <li>
 *         the array's shape is the list of {@code Dim} sizes reversed
 *         (see {@link io.ligolw.array.Shapes}); and
 *     </li>
 *     <li>
 *         values are listed with shape position 0 varying fastest
 *         (see {@link io.ligolw.array.IndexSequencer}).
 *     </li>
 * </ul>
 */
package io.ligolw.array;
