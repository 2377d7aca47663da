/**
 * Ready-made extensions for the decompiler.
 */
package io.github.eutro.ljdecomp.api.bits;
