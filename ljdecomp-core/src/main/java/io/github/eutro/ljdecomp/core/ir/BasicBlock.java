package io.github.eutro.ljdecomp.core.ir;

import io.github.eutro.ljdecomp.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A straight-line run of instructions {@code [startOffset, endOffset)}, as {@link Effect}s
 * followed by exactly one {@link Control}.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The offset of the first instruction, which also identifies the block.
     */
    public final int startOffset;
    /**
     * The offset just past the last instruction.
     */
    public int endOffset;

    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock(int startOffset) {
        this.startOffset = startOffset;
        this.endOffset = startOffset;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null) this.control.removeExt(CommonExts.OWNING_BLOCK);
        control.attachExt(CommonExts.OWNING_BLOCK, this);
        this.control = control;
    }

    public String toTargetString() {
        return String.format("@%04d", startOffset);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(" [").append(startOffset).append(", ").append(endOffset).append(")\n{\n");
        for (Effect effect : effects) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(control).append("\n}");
        return sb.toString();
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
