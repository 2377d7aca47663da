package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.DebugInfo;
import io.github.eutro.ljdecomp.core.bc.VariableInfo;
import io.github.eutro.ljdecomp.core.tree.Expr;
import org.jetbrains.annotations.Nullable;

/**
 * Maps register slots to the local variables of the debug info.
 * <p>
 * A variable's range starts after the instructions that compute its initial value,
 * so writes shortly before the start (after the previous variable boundary) belong to it too.
 */
public final class SlotNames {
    private final BytecodeFunction source;
    private final @Nullable DebugInfo debug;

    public SlotNames(BytecodeFunction source) {
        this.source = source;
        this.debug = source.debugInfo;
    }

    /**
     * @return Whether the function was dumped with debug info, even if it declares no variables.
     */
    public boolean hasDebugInfo() {
        return debug != null;
    }

    /**
     * @param slot The slot.
     * @param pc   The instruction offset.
     * @return The named variable live in the slot at that offset, or null. Compiler-internal variables are ignored.
     */
    public @Nullable VariableInfo variableAt(int slot, int pc) {
        if (debug == null) return null;
        VariableInfo variable = debug.variableAt(slot, pc);
        return variable != null && variable.kind == VariableInfo.Kind.NAMED ? variable : null;
    }

    /**
     * @param reg A register read or write.
     * @return Whether it touches a variable that is live at that point, so it is not a temporary.
     */
    public boolean isNamed(Expr.Register reg) {
        return variableAt(reg.slot, reg.pc) != null;
    }

    /**
     * @param reg A register write.
     * @return The variable whose initial value the write computes, or null.
     */
    public @Nullable VariableInfo initializedBy(Expr.Register reg) {
        if (debug == null || variableAt(reg.slot, reg.pc) != null) return null;
        VariableInfo next = null;
        for (VariableInfo variable : debug.variables) {
            if (variable.kind != VariableInfo.Kind.NAMED || variable.slot != reg.slot || variable.startPc <= reg.pc) {
                continue;
            }
            if (next == null || variable.startPc < next.startPc) next = variable;
        }
        if (next == null || windowStart(next) > reg.pc) return null;
        return next;
    }

    private int windowStart(VariableInfo variable) {
        int start = 0;
        for (VariableInfo other : debug.variables) {
            if (other.startPc < variable.startPc) start = Math.max(start, other.startPc);
            if (other.endPc < variable.startPc) start = Math.max(start, other.endPc);
        }
        return start;
    }

    /**
     * @param reg A register read or write.
     * @return The variable it belongs to, or null.
     */
    public @Nullable VariableInfo resolve(Expr.Register reg) {
        VariableInfo variable = variableAt(reg.slot, reg.pc);
        return variable != null ? variable : initializedBy(reg);
    }

    public boolean isParameter(int slot) {
        return slot < source.numParams;
    }

    public static String syntheticName(int slot) {
        return "slot" + slot;
    }
}
