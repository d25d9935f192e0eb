/**
 * Data model shared by the mapping, dispatch, sink and enrichment components.
 *
 * <p>
 * Types here are immutable once built, except {@link io.github.yok.forcelink.model.RecordState},
 * which only names the states a record moves through during dispatch.
 * </p>
 */
package io.github.yok.forcelink.model;
