package io.github.eutro.ljdecomp.api.events;

import io.github.eutro.ljdecomp.api.Decompiler;

/**
 * An event fired on a {@link Decompiler}.
 */
public interface DecompilerEvent {
}
