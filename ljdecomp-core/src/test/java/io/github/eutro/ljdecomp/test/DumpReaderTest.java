package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.*;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;

public class DumpReaderTest {
    private static DumpBuilder.Proto returnOne(DumpBuilder builder) {
        return builder.proto(0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2);
    }

    private static byte[] returnOneDump(FormatVersion version) {
        DumpBuilder builder = new DumpBuilder(version);
        return builder.build(returnOne(builder));
    }

    private static MalformedBytecodeException readFails(ByteBuffer buffer, FormatVersion version) {
        return assertThrows(MalformedBytecodeException.class, () -> new DumpReader(version).run(buffer));
    }

    @Test
    void testMinimalDump() {
        BytecodeDump dump = new DumpReader(FormatVersion.LUAJIT_2_1)
                .run(ByteBuffer.wrap(returnOneDump(FormatVersion.LUAJIT_2_1)));
        assertEquals("=test", dump.chunkName);
        assertEquals(1, dump.functions.size());
        BytecodeFunction root = dump.getRoot();
        assertEquals(0, root.index);
        assertNull(root.getDecodeFailure());
        List<Instruction> insns = root.getInstructions();
        assertEquals(2, insns.size());
        assertEquals(Opcode.KSHORT, insns.get(0).opcode);
        assertEquals(1, insns.get(0).lits());
        assertEquals(Opcode.RET1, insns.get(1).opcode);
    }

    @Test
    void testBadMagic() {
        byte[] dump = returnOneDump(FormatVersion.LUAJIT_2_1);
        dump[0] = 0x1c;
        assertEquals(0, readFails(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_1).getOffset());
        dump[0] = 0x1b;
        dump[2] = 'K';
        MalformedBytecodeException e = readFails(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_1);
        assertEquals(2, e.getOffset());
        assertFalse(e.isInstructionOffset());
        assertTrue(e.getMessage().contains("at byte 2"), e.getMessage());
    }

    @Test
    void testHugeStringLength() {
        byte[] dump = {
                0x1b, 'L', 'J', 2,
                DumpFlags.STRIP,
                16,
                0, 0, 1, 0,
                1, 0, 1,
                0, 0, 0, 0,
                (byte) 0x85, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x08,
                0,
        };
        MalformedBytecodeException e = readFails(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_1);
        assertEquals(17, e.getOffset());
        assertFalse(e.isInstructionOffset());
    }

    @Test
    void testVersionMismatch() {
        byte[] dump = returnOneDump(FormatVersion.LUAJIT_2_1);
        MalformedBytecodeException e = readFails(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_0);
        assertEquals(3, e.getOffset());
        assertEquals(DiagnosticKind.MALFORMED_BYTECODE, e.getKind());
    }

    @Test
    void testUnknownFlags() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_0).flags(DumpFlags.FR2);
        byte[] dump = builder.build(returnOne(builder));
        assertEquals(4, readFails(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_0).getOffset());
    }

    @Test
    void testTruncated() {
        byte[] dump = returnOneDump(FormatVersion.LUAJIT_2_1);
        for (int drop = 1; drop < dump.length; drop++) {
            readFails(Utils.truncated(dump, drop), FormatVersion.LUAJIT_2_1);
        }
    }

    @Test
    void testTrailingBytes() {
        byte[] dump = returnOneDump(FormatVersion.LUAJIT_2_1);
        byte[] padded = Arrays.copyOf(dump, dump.length + 1);
        MalformedBytecodeException e = readFails(ByteBuffer.wrap(padded), FormatVersion.LUAJIT_2_1);
        assertEquals(dump.length, e.getOffset());
    }

    @Test
    void testContextVersionChecked() {
        ByteBuffer buffer = ByteBuffer.wrap(returnOneDump(FormatVersion.LUAJIT_2_1));
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_0);
        assertThrows(IllegalArgumentException.class, () -> DumpReader.read(buffer, FormatVersion.LUAJIT_2_1, ctx));
    }

    @Test
    void testOpcodeNumbering() {
        assertEquals(FormatVersion.LUAJIT_2_0.number(Opcode.MOV) + 2, FormatVersion.LUAJIT_2_1.number(Opcode.MOV));
        assertEquals(FormatVersion.LUAJIT_2_0.number(Opcode.ISF), FormatVersion.LUAJIT_2_1.number(Opcode.ISF));
        assertThrows(IllegalArgumentException.class, () -> FormatVersion.LUAJIT_2_0.number(Opcode.ISTYPE));
        assertThrows(IllegalArgumentException.class, () -> FormatVersion.LUAJIT_2_0.number(Opcode.TSETR));
        assertEquals(Opcode.ISTYPE, FormatVersion.LUAJIT_2_1.opcode(FormatVersion.LUAJIT_2_1.number(Opcode.ISTYPE)));
        assertNull(FormatVersion.LUAJIT_2_0.opcode(FormatVersion.LUAJIT_2_1.number(Opcode.FUNCCW)));
        assertSame(FormatVersion.LUAJIT_2_0, FormatVersion.forDumpVersion(1));
        assertNull(FormatVersion.forDumpVersion(3));
    }

    @Test
    void testSameProgramBothVersions() {
        for (FormatVersion version : FormatVersion.values()) {
            DumpBuilder builder = new DumpBuilder(version);
            DumpBuilder.Proto proto = builder.proto(1, 3);
            int k = proto.str("x");
            proto.ad(Opcode.MOV, 1, 0)
                    .ad(Opcode.GGET, 2, k)
                    .abc(Opcode.ADDVV, 1, 1, 2)
                    .ad(Opcode.RET1, 1, 2);
            BytecodeFunction fn = new DumpReader(version).run(builder.buffer(proto)).getRoot();
            assertNull(fn.getDecodeFailure(), version.toString());
            List<Instruction> insns = fn.getInstructions();
            assertEquals(Opcode.MOV, insns.get(0).opcode);
            assertEquals(Opcode.GGET, insns.get(1).opcode);
            assertEquals(Opcode.ADDVV, insns.get(2).opcode);
            assertEquals(1, insns.get(2).b);
            assertEquals(2, insns.get(2).c);
            assertEquals("x", fn.gcConstant(insns.get(1).d));
        }
    }

    @Test
    void testBigEndian() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).bigEndian();
        BytecodeFunction fn = new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(returnOne(builder))).getRoot();
        assertEquals(Opcode.KSHORT, fn.getInstructions().get(0).opcode);
        assertEquals(1, fn.getInstructions().get(0).lits());
    }

    @Test
    void testFunctionLevelFailureKeepsDump() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(0, 1)
                .ad(Opcode.MOV, 1, 0)
                .ad(Opcode.RET0, 0, 1);
        BytecodeFunction fn = new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(proto)).getRoot();
        assertNotNull(fn.getDecodeFailure());
        assertTrue(fn.getDecodeFailure() instanceof MalformedBytecodeException);
        MalformedBytecodeException failure = (MalformedBytecodeException) fn.getDecodeFailure();
        assertEquals(0, failure.getOffset());
        assertTrue(failure.isInstructionOffset());
        assertTrue(failure.getMessage().contains("at pc 0"), failure.getMessage());
        assertThrows(MalformedBytecodeException.class, fn::getInstructions);
    }

    @Test
    void testUndefinedOpcode() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_0);
        DumpBuilder.Proto proto = builder.proto(0, 1)
                .raw(FormatVersion.LUAJIT_2_0.layout.encodeAD(0xf0, 0, 0))
                .ad(Opcode.RET0, 0, 1);
        BytecodeFunction fn = new DumpReader(FormatVersion.LUAJIT_2_0).run(builder.buffer(proto)).getRoot();
        assertNotNull(fn.getDecodeFailure());
        assertEquals(DiagnosticKind.UNSUPPORTED_OPCODE, fn.getDecodeFailure().getKind());
    }

    @Test
    void testChildrenAndConstants() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto first = returnOne(builder);
        DumpBuilder.Proto second = builder.proto(0, 1).ad(Opcode.RET0, 0, 1);
        DumpBuilder.Proto root = builder.proto(0, 2);
        int firstK = root.child(first);
        int secondK = root.child(second);
        Map<Object, Object> hash = new LinkedHashMap<>();
        hash.put("k", Primitive.TRUE);
        int tableK = root.table(Arrays.asList(Primitive.NIL, 10, 2.5), hash);
        int intK = root.num(-7);
        int doubleK = root.num(0.5);
        root.ad(Opcode.FNEW, 0, firstK)
                .ad(Opcode.FNEW, 1, secondK)
                .ad(Opcode.TDUP, 0, tableK)
                .ad(Opcode.KNUM, 0, intK)
                .ad(Opcode.KNUM, 1, doubleK)
                .ad(Opcode.RET0, 0, 1);

        BytecodeDump dump = new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(root));
        assertEquals(3, dump.functions.size());
        BytecodeFunction rootFn = dump.getRoot();
        assertSame(dump.functions.get(1), rootFn.gcConstant(firstK));
        assertSame(dump.functions.get(2), rootFn.gcConstant(secondK));
        assertEquals(Arrays.asList(dump.functions.get(1), dump.functions.get(2)), rootFn.children);
        assertEquals(2, dump.functions.get(1).size());
        assertEquals(1, dump.functions.get(2).size());

        TableConstant table = (TableConstant) rootFn.gcConstant(tableK);
        assertEquals(Arrays.asList(Primitive.NIL, 10, 2.5), table.array);
        assertEquals(Collections.singletonMap("k", Primitive.TRUE), table.hash);
        assertEquals(-7, rootFn.numConstant(intK));
        assertEquals(0.5, rootFn.numConstant(doubleK));
    }

    @Test
    void testDebugInfo() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(1, 3)
                .upvalue(0x8000, "up")
                .ad(Opcode.KSHORT, 1, 5)
                .ad(Opcode.KSHORT, 2, 6)
                .ad(Opcode.RET0, 0, 1)
                .local("param", 0, 3)
                .local("x", 1, 3)
                .local("y", 2, 3);
        BytecodeFunction fn = new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(proto)).getRoot();
        DebugInfo debug = fn.debugInfo;
        assertNotNull(debug);
        assertEquals(1, debug.lineOf(0));
        assertEquals(3, debug.lineOf(2));
        assertEquals("up", fn.upvalueName(0));
        assertEquals(3, debug.variables.size());
        VariableInfo x = debug.variables.get(1);
        assertEquals("x", x.name);
        assertEquals(1, x.startPc);
        assertEquals(3, x.endPc);
        assertEquals(1, x.slot);
        assertEquals(2, debug.variables.get(2).slot);
        assertSame(x, debug.variableAt(1, 2));
        assertNull(debug.variableAt(1, 0));
    }

    @Test
    void testStrippedHasNoDebugInfo() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DumpBuilder.Proto proto = returnOne(builder).local("x", 1, 2);
        BytecodeDump dump = new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(proto));
        assertTrue(dump.isStripped());
        assertNull(dump.chunkName);
        assertNull(dump.getRoot().debugInfo);
    }

    @Test
    void testDisassemble() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(0, 1);
        int name = proto.str("print");
        proto.ad(Opcode.GGET, 0, name)
                .ad(Opcode.RET1, 0, 2)
                .withDebugInfo();
        String listing = Disassembler.disassemble(new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(proto)));
        String[] lines = listing.split("\n");
        assertEquals(3, lines.length, listing);
        assertTrue(lines[0].startsWith("-- "), listing);
        assertTrue(lines[1].contains("\"print\""), listing);
        assertTrue(lines[1].contains("line 1"), listing);
        assertTrue(lines[2].contains("line 2"), listing);
    }

    @Test
    void testDisassembleUndecodable() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DumpBuilder.Proto proto = builder.proto(0, 1)
                .ad(Opcode.MOV, 1, 0)
                .ad(Opcode.RET0, 0, 1);
        String listing = Disassembler.disassemble(new DumpReader(FormatVersion.LUAJIT_2_1).run(builder.buffer(proto)).getRoot());
        assertTrue(listing.contains("-- undecodable: "), listing);
    }
}
