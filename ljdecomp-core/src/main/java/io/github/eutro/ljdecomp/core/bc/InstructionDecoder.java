package io.github.eutro.ljdecomp.core.bc;

import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import io.github.eutro.ljdecomp.core.diag.UnsupportedOpcodeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the instruction words of one function and checks every operand against its mode.
 */
final class InstructionDecoder {
    private final BytecodeFunction function;
    private final FormatVersion version;

    InstructionDecoder(BytecodeFunction function, FormatVersion version) {
        this.function = function;
        this.version = version;
    }

    List<Instruction> decode(int[] code) {
        InsnLayout layout = version.layout;
        List<Instruction> out = new ArrayList<>(code.length);
        for (int pc = 0; pc < code.length; pc++) {
            int word = code[pc];
            int number = layout.op(word);
            Opcode opcode = version.opcode(number);
            if (opcode == null) {
                throw new UnsupportedOpcodeException(number, pc, "not defined by " + version);
            }
            Instruction insn = new Instruction(pc, opcode,
                    layout.a(word), layout.b(word), layout.c(word), layout.d(word));
            check(insn, opcode.aMode, insn.a, code.length);
            if (opcode.hasD()) {
                check(insn, opcode.cdMode, insn.d, code.length);
            } else {
                check(insn, opcode.bMode, insn.b, code.length);
                check(insn, opcode.cdMode, insn.c, code.length);
            }
            out.add(insn);
        }
        return out;
    }

    private void check(Instruction insn, OperandMode mode, int value, int codeLength) {
        switch (mode) {
            case DST:
            case VAR:
            case BASE:
                if (value >= function.frameSize) {
                    throw bad(insn, "register " + value + " below frame size " + function.frameSize);
                }
                break;
            case RBASE:
                if (value > function.frameSize) {
                    throw bad(insn, "register " + value + " at most frame size " + function.frameSize);
                }
                break;
            case UV:
                if (value >= function.upvalues.size()) {
                    throw bad(insn, "upvalue " + value + " below " + function.upvalues.size());
                }
                break;
            case NUM:
                if (value >= function.numConstants.size()) {
                    throw bad(insn, "numeric constant " + value + " below " + function.numConstants.size());
                }
                break;
            case STR:
                checkGc(insn, value, String.class);
                break;
            case TAB:
                checkGc(insn, value, TableConstant.class);
                break;
            case FUNC:
                checkGc(insn, value, BytecodeFunction.class);
                break;
            case CDATA:
                checkGc(insn, value, CDataConstant.class);
                break;
            case PRI:
                if (value > 2) throw bad(insn, "primitive constant at most 2, got " + value);
                break;
            case JUMP:
                int target = insn.jumpTarget();
                if (target < 0 || target >= codeLength) {
                    throw bad(insn, "jump target inside the function, got " + target);
                }
                break;
            default:
                break;
        }
    }

    private void checkGc(Instruction insn, int value, Class<?> type) {
        if (value >= function.gcConstantCount()) {
            throw bad(insn, "constant " + value + " below " + function.gcConstantCount());
        }
        Object constant = function.gcConstant(value);
        if (!type.isInstance(constant)) {
            throw bad(insn, type.getSimpleName() + " constant at " + value
                    + ", got " + constant.getClass().getSimpleName());
        }
    }

    private MalformedBytecodeException bad(Instruction insn, String expectation) {
        return MalformedBytecodeException.atInstruction(insn.pc, insn.opcode + " operand " + expectation);
    }
}
