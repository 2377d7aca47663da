/**
 * Exts attach typed, optional data to IR objects without widening their classes.
 * <p>
 * An {@link io.github.eutro.ljdecomp.core.ext.Ext} is a key; an
 * {@link io.github.eutro.ljdecomp.core.ext.ExtContainer} maps keys to values.
 * Analyses such as dominance or liveness store their results as exts, and
 * {@link io.github.eutro.ljdecomp.core.ext.MetadataState} records which of them are still valid.
 */
package io.github.eutro.ljdecomp.core.ext;
