/**
 * Turns a {@link io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph} into a
 * {@link io.github.eutro.ljdecomp.core.tree.StructuredNode} tree.
 */
package io.github.eutro.ljdecomp.core.structure;
