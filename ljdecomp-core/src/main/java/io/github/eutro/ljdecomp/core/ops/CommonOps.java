package io.github.eutro.ljdecomp.core.ops;

import io.github.eutro.ljdecomp.core.ir.Insn;

/**
 * Operations with no particular tie to Lua.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to {@code targets[0]}.
     */
    public static final SimpleOpKey BR = new SimpleOpKey("br");
    /**
     * Control: returns its arguments. The last may be {@code MULTRES}.
     */
    public static final SimpleOpKey RETURN = new SimpleOpKey("return");

    /**
     * Effect: returns its arguments, one per assigned var.
     */
    public static final SimpleOpKey IDENTITY = new SimpleOpKey("id");
    /**
     * Effect: returns the constant to every assigned var.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");

    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
