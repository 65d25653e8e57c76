/**
 * Typed, read-only views over the generic element tree.
 *
 * <p>One final class per container element of the WebM schema. Views only
 * look at direct children and never copy the tree; a missing mandatory field
 * surfaces as {@link com.questrail.webm.decode.EbmlDecodeException} at the
 * moment the getter is called, not at parse time.</p>
 */
package com.questrail.webm.view;
