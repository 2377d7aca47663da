package io.github.eutro.ljdecomp.api.bits;

/**
 * An extension that can be attached onto something.
 *
 * @param <Onto> What this can be attached onto.
 * @param <Ret>  What is returned on attaching.
 */
public interface Bit<Onto, Ret> {
    Ret addTo(Onto onto);
}
