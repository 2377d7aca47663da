package io.github.eutro.ljdecomp.core.ops;

import io.github.eutro.ljdecomp.core.ext.DelegatingExtHolder;
import io.github.eutro.ljdecomp.core.ext.ExtContainer;
import io.github.eutro.ljdecomp.core.ir.Insn;
import io.github.eutro.ljdecomp.core.ir.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediate argument.
 */
public class Op extends DelegatingExtHolder {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
