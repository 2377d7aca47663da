package io.github.eutro.ljdecomp.core.ir;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.DelegatingExtHolder;
import io.github.eutro.ljdecomp.core.ext.Ext;
import io.github.eutro.ljdecomp.core.ext.ExtContainer;
import io.github.eutro.ljdecomp.core.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The terminator of a {@link BasicBlock}: an {@link Insn} and its jump targets.
 * What each target means depends on the operation, see {@link io.github.eutro.ljdecomp.core.ops.LuaOps}.
 */
public final class Control extends DelegatingExtHolder {
    private Insn insn;
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        setInsn(insn);
        this.targets = targets;
    }

    public static Control br(BasicBlock target) {
        return CommonOps.BR.create().insn().jumpsTo(target);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
