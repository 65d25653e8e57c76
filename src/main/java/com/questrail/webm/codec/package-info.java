/**
 * EBML codec layer.
 * =============================================================================
 *
 * <p>This package holds the <strong>wire-level rules</strong> of EBML, the
 * binary tag-length-value encoding used by WebM and Matroska:</p>
 *
 * <ul>
 *   <li>Variable-length integers for element sizes and identifiers</li>
 *   <li>Scalar payload conversions (integers, floats, UTF-8, dates)</li>
 *   <li>Construction of a generic element tree by {@link EbmlTreeDecoder}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   EbmlByteSource
 *        → EbmlTreeDecoder      (wire rules applied here)
 *            → Node tree        (generic, schema-agnostic)
 *                → views        (schema fields, cardinality)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec knows element <em>kinds</em> from the registry, but nothing
 *       about which fields are mandatory.</li>
 *   <li>Elements declared with the reserved "unknown size" are rejected; the
 *       decoder only accepts fully sized elements.</li>
 * </ul>
 */
package com.questrail.webm.codec;
