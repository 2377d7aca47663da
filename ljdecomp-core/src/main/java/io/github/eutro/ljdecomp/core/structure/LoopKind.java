package io.github.eutro.ljdecomp.core.structure;

/**
 * The shapes a loop without a more specific idiom takes.
 */
public enum LoopKind {
    /**
     * The header tests and leaves the loop: {@code while c do ... end}.
     */
    WHILE,
    /**
     * A block at the end of the loop tests and jumps back: {@code repeat ... until c}.
     */
    REPEAT,
    /**
     * No test controls the loop: {@code while true do ... end}, left only by escapes.
     */
    INFINITE,
}
