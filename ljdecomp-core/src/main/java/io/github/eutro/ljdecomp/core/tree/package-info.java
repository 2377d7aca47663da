/**
 * The recovered source tree: {@link io.github.eutro.ljdecomp.core.tree.StructuredNode statements}
 * and {@link io.github.eutro.ljdecomp.core.tree.Expr expressions}.
 */
package io.github.eutro.ljdecomp.core.tree;
