package io.github.eutro.ljdecomp.core.ir;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The IR of one bytecode function. Block 0 is the entry; blocks are kept in offset order.
 */
public final class Function extends ExtHolder {
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    };

    /**
     * The function this was built from.
     */
    public final BytecodeFunction source;
    private final Map<Integer, Var> registers = new TreeMap<>();
    private final Var multres = new Var(Var.Kind.MULTRES, "MULTRES", -1);

    public Function(BytecodeFunction source) {
        this.source = source;
    }

    public BasicBlock newBb(int startOffset) {
        BasicBlock bb = new BasicBlock(startOffset);
        blocks.add(bb);
        return bb;
    }

    public @Nullable BasicBlock blockAt(int startOffset) {
        for (BasicBlock block : blocks) {
            if (block.startOffset == startOffset) return block;
        }
        return null;
    }

    /**
     * Get the var of a register slot, the same one on every call.
     *
     * @param slot The slot.
     * @return The var.
     */
    public Var register(int slot) {
        return registers.computeIfAbsent(slot, s -> new Var(Var.Kind.REGISTER, "r" + s, s));
    }

    public Collection<Var> getRegisters() {
        return Collections.unmodifiableCollection(registers.values());
    }

    /**
     * Create a var holding a constant.
     *
     * @param value The constant, never null; nil is {@link io.github.eutro.ljdecomp.core.bc.Primitive#NIL}.
     * @return The var.
     */
    public Var constant(Object value) {
        Var var = new Var(Var.Kind.CONSTANT, String.valueOf(value), -1);
        var.attachExt(CommonExts.CONSTANT_VALUE, Objects.requireNonNull(value));
        return var;
    }

    public Var multres() {
        return multres;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(source).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.append("}").toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
