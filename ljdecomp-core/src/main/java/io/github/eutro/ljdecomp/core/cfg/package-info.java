/**
 * The normalized control-flow graph the structurer consumes.
 */
package io.github.eutro.ljdecomp.core.cfg;
