package io.github.eutro.ljdecomp.core.bc;

import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import io.github.eutro.ljdecomp.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.*;

/**
 * Reads a LuaJIT bytecode dump of a given {@link FormatVersion}.
 * <p>
 * Structural problems throw {@link MalformedBytecodeException} and no functions are returned.
 * Problems with the instructions of a single function are recorded on that function instead,
 * see {@link BytecodeFunction#getDecodeFailure()}.
 */
public class DumpReader implements IRPass<ByteBuffer, BytecodeDump> {
    private static final Logger LOG = LoggerFactory.getLogger(DumpReader.class);

    static final int[] MAGIC = {0x1b, 'L', 'J'};

    private static final int KGC_CHILD = 0, KGC_TAB = 1, KGC_I64 = 2, KGC_U64 = 3, KGC_COMPLEX = 4, KGC_STR = 5;
    private static final int KTAB_NIL = 0, KTAB_FALSE = 1, KTAB_TRUE = 2, KTAB_INT = 3, KTAB_NUM = 4, KTAB_STR = 5;
    private static final int VARNAME_END = 0, VARNAME_MAX = 7;

    private final FormatVersion version;

    public DumpReader(FormatVersion version) {
        this.version = version;
    }

    /**
     * Read a dump for a decompilation run.
     *
     * @param buffer  The dump.
     * @param version The format to read it as.
     * @param ctx     The run's context, which must be for the same version.
     * @return The dump.
     * @throws MalformedBytecodeException If the dump is structurally broken.
     */
    public static BytecodeDump read(ByteBuffer buffer, FormatVersion version, DecompileContext ctx) {
        if (ctx.version != version) {
            throw new IllegalArgumentException("context is for " + ctx.version + ", not " + version);
        }
        BytecodeDump dump = new DumpReader(version).run(buffer);
        if (LOG.isTraceEnabled()) LOG.trace("disassembly:\n{}", Disassembler.disassemble(dump));
        return dump;
    }

    @Override
    public BytecodeDump run(ByteBuffer buffer) {
        ByteReader in = new ByteReader(buffer);
        for (int i = 0; i < MAGIC.length; i++) {
            long at = in.offset();
            if (in.u8() != MAGIC[i]) {
                throw new MalformedBytecodeException(at, "the magic header ESC 'L' 'J'");
            }
        }
        long versionAt = in.offset();
        int dumpVersion = in.u8();
        if (dumpVersion != version.dumpVersion) {
            throw new MalformedBytecodeException(versionAt, "dump version " + version.dumpVersion
                    + " for " + version + ", got " + dumpVersion);
        }
        long flagsAt = in.offset();
        int flags = (int) in.uleb128();
        if ((flags & ~version.knownFlags) != 0) {
            throw new MalformedBytecodeException(flagsAt, "only flags 0x" + Integer.toHexString(version.knownFlags)
                    + ", got 0x" + Integer.toHexString(flags));
        }
        in.setBigEndian((flags & DumpFlags.BE) != 0);
        boolean stripped = (flags & DumpFlags.STRIP) != 0;
        String chunkName = null;
        if (!stripped) {
            long at = in.offset();
            chunkName = in.string(in.count("chunk name length"), at);
        }

        Deque<Proto> stack = new ArrayDeque<>();
        while (true) {
            int length = in.count("prototype length");
            if (length == 0) break;
            long start = in.offset();
            Proto proto = readProto(in, stack, stripped, (flags & DumpFlags.FR2) != 0);
            long read = in.offset() - start;
            if (read != length) {
                throw new MalformedBytecodeException(start, "a prototype of " + length + " bytes, read " + read);
            }
            stack.push(proto);
        }
        if (stack.size() != 1) {
            throw new MalformedBytecodeException(in.offset(), "exactly one root prototype, got " + stack.size());
        }
        if (in.hasRemaining()) {
            throw new MalformedBytecodeException(in.offset(), "end of input after the end-of-dump marker");
        }

        Proto root = stack.pop();
        List<Proto> order = new ArrayList<>();
        number(root, order);
        List<BytecodeFunction> functions = new ArrayList<>(Collections.nCopies(order.size(), null));
        build(root, functions);
        LOG.debug("read {} prototypes from {} dump {}", functions.size(), version, chunkName);
        return new BytecodeDump(version, flags, chunkName, functions);
    }

    private static void number(Proto proto, List<Proto> order) {
        proto.index = order.size();
        order.add(proto);
        for (Proto child : proto.children) {
            number(child, order);
        }
    }

    private BytecodeFunction build(Proto proto, List<BytecodeFunction> out) {
        Map<Proto, BytecodeFunction> built = new HashMap<>();
        List<BytecodeFunction> children = new ArrayList<>();
        for (Proto child : proto.children) {
            BytecodeFunction fn = build(child, out);
            built.put(child, fn);
            children.add(fn);
        }
        List<Object> gc = new ArrayList<>(proto.gcConstants.size());
        for (Object k : proto.gcConstants) {
            gc.add(k instanceof Proto ? built.get(k) : k);
        }
        List<UpvalueRef> upvalues = new ArrayList<>();
        for (int raw : proto.upvalues) {
            upvalues.add(new UpvalueRef(raw));
        }
        BytecodeFunction fn = new BytecodeFunction(
                proto.index, proto.offset,
                proto.flags, proto.numParams, proto.frameSize, proto.twoSlotFrames,
                upvalues, gc, proto.numConstants, proto.code,
                proto.debugInfo, children, version);
        if (fn.getDecodeFailure() != null) {
            LOG.debug("{} failed to decode: {}", fn, fn.getDecodeFailure().getMessage());
        }
        out.set(proto.index, fn);
        return fn;
    }

    private static final class Proto {
        long offset;
        int index;
        int flags, numParams, frameSize;
        boolean twoSlotFrames;
        int[] code;
        int[] upvalues;
        final List<Object> gcConstants = new ArrayList<>();
        final List<Object> numConstants = new ArrayList<>();
        final List<Proto> children = new ArrayList<>();
        @Nullable DebugInfo debugInfo;
    }

    private Proto readProto(ByteReader in, Deque<Proto> stack, boolean stripped, boolean fr2) {
        Proto p = new Proto();
        p.offset = in.offset();
        p.twoSlotFrames = fr2;
        p.flags = in.u8();
        p.numParams = in.u8();
        p.frameSize = in.u8();
        int numUpvalues = in.u8();
        int numGc = in.count("GC constant count");
        int numNum = in.count("numeric constant count");
        int numCode = in.count("instruction count");
        int debugSize = 0, firstLine = 0, numLines = 0;
        if (!stripped) {
            debugSize = in.count("debug info size");
            if (debugSize != 0) {
                firstLine = (int) in.uleb128();
                numLines = (int) in.uleb128();
            }
        }

        p.code = new int[numCode];
        for (int i = 0; i < numCode; i++) {
            p.code[i] = in.u32();
        }
        p.upvalues = new int[numUpvalues];
        for (int i = 0; i < numUpvalues; i++) {
            p.upvalues[i] = in.u16();
        }

        List<Proto> poppedChildren = new ArrayList<>();
        for (int i = 0; i < numGc; i++) {
            long at = in.offset();
            long tag = in.uleb128();
            if (tag >= KGC_STR) {
                p.gcConstants.add(in.string(tag - KGC_STR, at));
            } else if (tag == KGC_CHILD) {
                if (stack.isEmpty()) {
                    throw new MalformedBytecodeException(at, "a previously read prototype for a child constant");
                }
                Proto child = stack.pop();
                poppedChildren.add(child);
                p.gcConstants.add(child);
            } else if (tag == KGC_TAB) {
                p.gcConstants.add(readTable(in));
            } else if (tag == KGC_I64 || tag == KGC_U64) {
                long lo = in.uleb128(), hi = in.uleb128();
                p.gcConstants.add(CDataConstant.integer(tag == KGC_U64, (hi << 32) | lo));
            } else if (tag == KGC_COMPLEX) {
                double re = readDouble(in), im = readDouble(in);
                p.gcConstants.add(CDataConstant.complex(re, im));
            } else {
                throw new MalformedBytecodeException(at, "a GC constant tag, got " + tag);
            }
        }
        // the child with the lowest operand is read last
        Collections.reverse(poppedChildren);
        p.children.addAll(poppedChildren);

        for (int i = 0; i < numNum; i++) {
            long[] tagged = in.uleb128_33();
            if (tagged[0] != 0) {
                long hi = in.uleb128();
                p.numConstants.add(Double.longBitsToDouble((hi << 32) | tagged[1]));
            } else {
                p.numConstants.add((int) tagged[1]);
            }
        }

        if (debugSize != 0) {
            long start = in.offset();
            p.debugInfo = readDebugInfo(in, numCode, numUpvalues, firstLine, numLines);
            long read = in.offset() - start;
            if (read != debugSize) {
                throw new MalformedBytecodeException(start, debugSize + " bytes of debug info, read " + read);
            }
        }
        return p;
    }

    private static double readDouble(ByteReader in) {
        long lo = in.uleb128(), hi = in.uleb128();
        return Double.longBitsToDouble((hi << 32) | lo);
    }

    private static TableConstant readTable(ByteReader in) {
        int arraySize = in.count("table array size");
        int hashSize = in.count("table hash size");
        List<Object> array = new ArrayList<>(arraySize);
        for (int i = 0; i < arraySize; i++) {
            array.add(readTableValue(in));
        }
        Map<Object, Object> hash = new LinkedHashMap<>();
        for (int i = 0; i < hashSize; i++) {
            Object key = readTableValue(in);
            hash.put(key, readTableValue(in));
        }
        return new TableConstant(array, hash);
    }

    private static Object readTableValue(ByteReader in) {
        long at = in.offset();
        long tag = in.uleb128();
        if (tag >= KTAB_STR) return in.string(tag - KTAB_STR, at);
        switch ((int) tag) {
            case KTAB_NIL:
                return Primitive.NIL;
            case KTAB_FALSE:
                return Primitive.FALSE;
            case KTAB_TRUE:
                return Primitive.TRUE;
            case KTAB_INT:
                return (int) in.uleb128();
            case KTAB_NUM:
                return readDouble(in);
            default:
                throw new MalformedBytecodeException(at, "a table constant tag, got " + tag);
        }
    }

    private static DebugInfo readDebugInfo(ByteReader in, int numCode, int numUpvalues, int firstLine, int numLines) {
        int[] lines = new int[numCode];
        for (int i = 0; i < numCode; i++) {
            int delta;
            if (numLines < 256) {
                delta = in.u8();
            } else if (numLines < 65536) {
                delta = in.u16();
            } else {
                delta = in.u32();
            }
            lines[i] = firstLine + delta;
        }
        List<String> upvalueNames = new ArrayList<>(numUpvalues);
        for (int i = 0; i < numUpvalues; i++) {
            upvalueNames.add(in.cstring(-1));
        }

        List<VariableInfo> variables = new ArrayList<>();
        int lastStart = 0;
        while (true) {
            int tag = in.u8();
            if (tag == VARNAME_END) break;
            VariableInfo.Kind kind;
            String name;
            if (tag >= VARNAME_MAX) {
                kind = VariableInfo.Kind.NAMED;
                name = in.cstring(tag);
            } else {
                kind = VariableInfo.Kind.values()[tag];
                name = kind.internalName;
            }
            int start = lastStart + (int) in.uleb128();
            int end = start + (int) in.uleb128();
            lastStart = start;
            // debug pcs count the function header instruction, which is not dumped
            int startPc = Math.max(0, start - 1), endPc = Math.max(0, end - 1);
            int slot = 0;
            for (VariableInfo earlier : variables) {
                if (earlier.startPc <= startPc && earlier.endPc > startPc) slot++;
            }
            variables.add(new VariableInfo(kind, name, startPc, endPc, slot));
        }
        return new DebugInfo(firstLine, numLines, lines, upvalueNames, variables);
    }
}
