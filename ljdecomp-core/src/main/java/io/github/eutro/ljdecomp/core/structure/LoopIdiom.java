package io.github.eutro.ljdecomp.core.structure;

/**
 * A loop shape the compiler emits for a specific construct, tried before the generic
 * {@link LoopKind} rules.
 */
public interface LoopIdiom {
    /**
     * @return A name for diagnostics.
     */
    String name();

    /**
     * Structure the loop if it has this idiom's shape.
     * A successful match collapses the loop with {@link LoopScope#collapse}.
     *
     * @param scope The loop.
     * @return Whether the loop matched and was structured.
     */
    boolean apply(LoopScope scope);
}
