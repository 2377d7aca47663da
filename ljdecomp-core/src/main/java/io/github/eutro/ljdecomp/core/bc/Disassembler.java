package io.github.eutro.ljdecomp.core.bc;

import io.github.eutro.ljdecomp.core.diag.DecompilationException;

/**
 * Renders instruction listings, for logs and test failure messages.
 */
public final class Disassembler {
    private Disassembler() {
    }

    /**
     * List a function's instructions, with the constants they refer to and their source lines.
     *
     * @param fn The function.
     * @return The listing, one instruction per line.
     */
    public static String disassemble(BytecodeFunction fn) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- ").append(fn)
                .append(": ").append(fn.numParams).append(" params, ")
                .append(fn.frameSize).append(" slots")
                .append(fn.isVararg() ? ", vararg" : "")
                .append('\n');
        DecompilationException failure = fn.getDecodeFailure();
        if (failure != null) {
            return sb.append("-- undecodable: ").append(failure.getMessage()).append('\n').toString();
        }
        for (Instruction insn : fn.getInstructions()) {
            sb.append(insn);
            String comment = comment(fn, insn);
            int line = fn.debugInfo == null ? -1 : fn.debugInfo.lineOf(insn.pc);
            if (comment != null || line >= 0) {
                sb.append("\t;");
                if (line >= 0) sb.append(" line ").append(line);
                if (comment != null) sb.append(' ').append(comment);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String comment(BytecodeFunction fn, Instruction insn) {
        Opcode op = insn.opcode;
        int operand = op.hasD() ? insn.d : insn.c;
        switch (op.cdMode) {
            case STR:
                return quote(fn.gcConstant(operand));
            case NUM:
                return String.valueOf(fn.numConstant(operand));
            case FUNC:
            case TAB:
            case CDATA:
                return String.valueOf(fn.gcConstant(operand));
            case UV:
                return fn.upvalueName(operand);
            default:
                break;
        }
        if (op.aMode == OperandMode.UV) return fn.upvalueName(insn.a);
        return null;
    }

    private static String quote(Object value) {
        return value instanceof String ? '"' + ((String) value).replace("\n", "\\n") + '"' : String.valueOf(value);
    }

    public static String disassemble(BytecodeDump dump) {
        StringBuilder sb = new StringBuilder();
        for (BytecodeFunction fn : dump.functions) {
            sb.append(disassemble(fn));
        }
        return sb.toString();
    }
}
