package io.github.eutro.ljdecomp.core.ir;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.Ext;
import io.github.eutro.ljdecomp.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * An operand of the IR. Register vars are shared by every instruction touching the
 * same slot; constant vars are created per use.
 */
public final class Var extends ExtHolder {
    public enum Kind {
        REGISTER,
        CONSTANT,
        /**
         * The values produced by the last instruction with a variable number of results.
         */
        MULTRES,
    }

    public final Kind kind;
    public final String name;
    /**
     * The register slot, or -1 if this is not a register.
     */
    public final int slot;

    Var(Kind kind, String name, int slot) {
        this.kind = kind;
        this.name = name;
        this.slot = slot;
    }

    public boolean isRegister() {
        return kind == Kind.REGISTER;
    }

    @Override
    public String toString() {
        switch (kind) {
            case REGISTER:
                return "r" + slot;
            case CONSTANT:
                return "#" + name;
            default:
                return name;
        }
    }

    // exts
    private Object constantValue = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.CONSTANT_VALUE) {
            return (T) constantValue;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.CONSTANT_VALUE) {
            constantValue = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.CONSTANT_VALUE) {
            constantValue = null;
            return;
        }
        super.removeExt(ext);
    }
}
