package io.github.eutro.ljdecomp.core.ir;

import io.github.eutro.ljdecomp.core.ext.LuaExts;

import java.util.List;

/**
 * Appends instructions to the end of a block, stamping each with the
 * offset of the bytecode instruction it came from.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock bb;
    private int pc;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Set the offset stamped on instructions inserted from now on.
     *
     * @param pc The instruction offset.
     */
    public void at(int pc) {
        this.pc = pc;
    }

    public void insert(Effect effect) {
        effect.attachExt(LuaExts.PC, pc);
        bb.addEffect(effect);
    }

    public void insert(Insn insn, Var... vars) {
        insert(insn.assignTo(vars));
    }

    public void insert(Insn insn, List<Var> vars) {
        insert(insn.assignTo(vars));
    }

    public void insertCtrl(Control ctrl) {
        ctrl.attachExt(LuaExts.PC, pc);
        bb.setControl(ctrl);
    }
}
