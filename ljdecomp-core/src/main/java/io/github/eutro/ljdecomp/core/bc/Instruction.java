package io.github.eutro.ljdecomp.core.bc;

/**
 * A decoded instruction. Which of {@link #b}, {@link #c} and {@link #d} are
 * meaningful is given by {@link Opcode#hasD()}.
 */
public final class Instruction {
    public final int pc;
    public final Opcode opcode;
    public final int a, b, c, d;

    public Instruction(int pc, Opcode opcode, int a, int b, int c, int d) {
        this.pc = pc;
        this.opcode = opcode;
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    /**
     * The target of a {@link OperandMode#JUMP} operand, as an instruction offset.
     *
     * @return The jump target.
     */
    public int jumpTarget() {
        return pc + 1 + d - 0x8000;
    }

    /**
     * The D operand read as a signed 16 bit literal.
     *
     * @return The literal.
     */
    public int lits() {
        return (short) d;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%04d %-6s", pc, opcode));
        if (opcode.aMode != OperandMode.NONE) sb.append(' ').append(a);
        if (opcode.hasD()) {
            if (opcode.cdMode == OperandMode.JUMP) {
                sb.append(" => ").append(String.format("%04d", jumpTarget()));
            } else if (opcode.cdMode == OperandMode.LITS) {
                sb.append(' ').append(lits());
            } else if (opcode.cdMode != OperandMode.NONE) {
                sb.append(' ').append(d);
            }
        } else {
            sb.append(' ').append(b).append(' ').append(c);
        }
        return sb.toString();
    }
}
