/**
 * Passes over the IR. {@code convert} builds it, {@code meta} computes facts about it
 * as exts, {@code opts} rewrites it.
 */
package io.github.eutro.ljdecomp.core.passes;
