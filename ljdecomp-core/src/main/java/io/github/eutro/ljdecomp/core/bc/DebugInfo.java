package io.github.eutro.ljdecomp.core.bc;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line, upvalue name and variable information of a function, absent from stripped dumps.
 */
public final class DebugInfo {
    public final int firstLine;
    public final int numLines;
    private final int[] lines;
    public final List<String> upvalueNames;
    public final List<VariableInfo> variables;

    public DebugInfo(int firstLine, int numLines, int[] lines, List<String> upvalueNames, List<VariableInfo> variables) {
        this.firstLine = firstLine;
        this.numLines = numLines;
        this.lines = lines.clone();
        this.upvalueNames = Collections.unmodifiableList(new ArrayList<>(upvalueNames));
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
    }

    /**
     * Get the source line of an instruction.
     *
     * @param pc The instruction offset.
     * @return The line, or -1 if unknown.
     */
    public int lineOf(int pc) {
        return pc >= 0 && pc < lines.length ? lines[pc] : -1;
    }

    /**
     * Find the variable held in a slot at an instruction.
     *
     * @param slot The register.
     * @param pc   The instruction offset.
     * @return The innermost such variable, or null.
     */
    public @Nullable VariableInfo variableAt(int slot, int pc) {
        VariableInfo found = null;
        for (VariableInfo variable : variables) {
            if (variable.slot == slot && variable.isLiveAt(pc)) {
                found = variable;
            }
        }
        return found;
    }
}
