/**
 * Expression recovery: turning the register statements of a structured tree into
 * Lua expressions, with debug names and local declarations.
 */
package io.github.eutro.ljdecomp.core.recover;
