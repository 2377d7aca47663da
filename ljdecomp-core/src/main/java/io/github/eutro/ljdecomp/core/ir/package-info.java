/**
 * The register-oriented IR that bytecode is lowered into.
 * <p>
 * A {@link io.github.eutro.ljdecomp.core.ir.Function} is a list of
 * {@link io.github.eutro.ljdecomp.core.ir.BasicBlock}s, each holding
 * {@link io.github.eutro.ljdecomp.core.ir.Effect}s and ending in one
 * {@link io.github.eutro.ljdecomp.core.ir.Control}. Unlike SSA form, register
 * {@link io.github.eutro.ljdecomp.core.ir.Var}s are assigned many times.
 */
package io.github.eutro.ljdecomp.core.ir;
