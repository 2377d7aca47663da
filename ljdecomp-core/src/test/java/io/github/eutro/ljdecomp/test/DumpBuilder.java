package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.DumpFlags;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.bc.Opcode;
import io.github.eutro.ljdecomp.core.bc.Primitive;
import io.github.eutro.ljdecomp.core.bc.VariableInfo;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes bytecode dumps for tests, in the layout LuaJIT's {@code string.dump} produces.
 */
public class DumpBuilder {
    private final FormatVersion version;
    private int flags;
    private String chunkName = "=test";

    public DumpBuilder(FormatVersion version) {
        this.version = version;
    }

    public DumpBuilder stripped() {
        flags |= DumpFlags.STRIP;
        return this;
    }

    public DumpBuilder bigEndian() {
        flags |= DumpFlags.BE;
        return this;
    }

    public DumpBuilder flags(int flags) {
        this.flags |= flags;
        return this;
    }

    public DumpBuilder chunkName(String chunkName) {
        this.chunkName = chunkName;
        return this;
    }

    public Proto proto(int numParams, int frameSize) {
        return new Proto(numParams, frameSize);
    }

    public byte[] build(Proto root) {
        Out out = new Out((flags & DumpFlags.BE) != 0);
        out.u8(0x1b);
        out.u8('L');
        out.u8('J');
        out.u8(version.dumpVersion);
        out.uleb(flags);
        if ((flags & DumpFlags.STRIP) == 0) {
            byte[] name = chunkName.getBytes(StandardCharsets.UTF_8);
            out.uleb(name.length);
            out.bytes(name);
        }
        writeTree(out, root);
        out.u8(0);
        return out.toByteArray();
    }

    public ByteBuffer buffer(Proto root) {
        return ByteBuffer.wrap(build(root));
    }

    private void writeTree(Out out, Proto proto) {
        // children pop off the reader's stack in reverse, so the lowest operand goes first
        for (Object constant : proto.gc) {
            if (constant instanceof Proto) writeTree(out, (Proto) constant);
        }
        byte[] body = proto.body();
        out.uleb(body.length);
        out.bytes(body);
    }

    /**
     * One prototype. Operands handed out for constants are the ones instructions use.
     */
    public class Proto {
        private final int numParams, frameSize;
        private int protoFlags;
        private final List<Integer> code = new ArrayList<>();
        private final List<Integer> lines = new ArrayList<>();
        private final List<Integer> upvalues = new ArrayList<>();
        private final List<String> upvalueNames = new ArrayList<>();
        private final List<Object> gc = new ArrayList<>();
        private final List<Object> num = new ArrayList<>();
        private final List<Var> vars = new ArrayList<>();
        private boolean debug;

        Proto(int numParams, int frameSize) {
            this.numParams = numParams;
            this.frameSize = frameSize;
        }

        public Proto vararg() {
            protoFlags |= DumpFlags.PROTO_VARARG;
            return this;
        }

        public int pc() {
            return code.size();
        }

        public Proto abc(Opcode op, int a, int b, int c) {
            code.add(version.layout.encodeABC(version.number(op), a, b, c));
            lines.add(code.size());
            return this;
        }

        public Proto ad(Opcode op, int a, int d) {
            code.add(version.layout.encodeAD(version.number(op), a, d & 0xffff));
            lines.add(code.size());
            return this;
        }

        /**
         * Emit an instruction with a jump operand.
         *
         * @param target The instruction offset to jump to.
         */
        public Proto jump(Opcode op, int a, int target) {
            return ad(op, a, target - (pc() + 1) + 0x8000);
        }

        public Proto raw(int word) {
            code.add(word);
            lines.add(code.size());
            return this;
        }

        public int str(String s) {
            return gcOperand(s);
        }

        public int child(Proto proto) {
            protoFlags |= DumpFlags.PROTO_CHILD;
            return gcOperand(proto);
        }

        /**
         * @param array The array part, from index 0.
         * @param hash  The hash part; keys and values are strings, integers, doubles or {@link Primitive}s.
         */
        public int table(List<Object> array, Map<Object, Object> hash) {
            return gcOperand(new Table(array, new LinkedHashMap<>(hash)));
        }

        private int gcOperand(Object constant) {
            gc.add(constant);
            return gc.size() - 1;
        }

        public int num(int value) {
            num.add(value);
            return num.size() - 1;
        }

        public int num(double value) {
            num.add(value);
            return num.size() - 1;
        }

        public Proto upvalue(int raw, String name) {
            upvalues.add(raw);
            upvalueNames.add(name);
            return this;
        }

        /**
         * Record a named local live over {@code [startPc, endPc)}. Locals must be
         * declared in the order they come into scope.
         */
        public Proto local(String name, int startPc, int endPc) {
            debug = true;
            vars.add(new Var(name.charAt(0), name, startPc, endPc));
            return this;
        }

        public Proto internal(VariableInfo.Kind kind, int startPc, int endPc) {
            debug = true;
            vars.add(new Var(kind.ordinal(), null, startPc, endPc));
            return this;
        }

        /**
         * Write line numbers and upvalue names even without any locals.
         */
        public Proto withDebugInfo() {
            debug = true;
            return this;
        }

        byte[] body() {
            boolean be = (flags & DumpFlags.BE) != 0;
            boolean strip = (flags & DumpFlags.STRIP) != 0;
            byte[] debugInfo = strip || !debug ? new byte[0] : debugInfo(be);

            Out out = new Out(be);
            out.u8(protoFlags);
            out.u8(numParams);
            out.u8(frameSize);
            out.u8(upvalues.size());
            out.uleb(gc.size());
            out.uleb(num.size());
            out.uleb(code.size());
            if (!strip) {
                out.uleb(debugInfo.length);
                if (debugInfo.length != 0) {
                    out.uleb(1);
                    out.uleb(code.size());
                }
            }
            for (int word : code) out.u32(word);
            for (int uv : upvalues) out.u16(uv);
            for (int i = gc.size() - 1; i >= 0; i--) {
                writeGc(out, gc.get(i));
            }
            for (Object k : num) {
                if (k instanceof Integer) {
                    out.uleb((((long) (Integer) k) & 0xffffffffL) << 1);
                } else {
                    long bits = Double.doubleToRawLongBits((Double) k);
                    out.uleb(((bits & 0xffffffffL) << 1) | 1);
                    out.uleb(bits >>> 32);
                }
            }
            out.bytes(debugInfo);
            return out.toByteArray();
        }

        private void writeGc(Out out, Object constant) {
            if (constant instanceof Proto) {
                out.uleb(0);
            } else if (constant instanceof Table) {
                Table table = (Table) constant;
                out.uleb(1);
                out.uleb(table.array.size());
                out.uleb(table.hash.size());
                for (Object value : table.array) writeTableValue(out, value);
                for (Map.Entry<Object, Object> entry : table.hash.entrySet()) {
                    writeTableValue(out, entry.getKey());
                    writeTableValue(out, entry.getValue());
                }
            } else {
                byte[] bytes = ((String) constant).getBytes(StandardCharsets.UTF_8);
                out.uleb(5 + bytes.length);
                out.bytes(bytes);
            }
        }

        private void writeTableValue(Out out, Object value) {
            if (value == Primitive.NIL) {
                out.uleb(0);
            } else if (value == Primitive.FALSE) {
                out.uleb(1);
            } else if (value == Primitive.TRUE) {
                out.uleb(2);
            } else if (value instanceof Integer) {
                out.uleb(3);
                out.uleb(((Integer) value) & 0xffffffffL);
            } else if (value instanceof Double) {
                long bits = Double.doubleToRawLongBits((Double) value);
                out.uleb(4);
                out.uleb(bits & 0xffffffffL);
                out.uleb(bits >>> 32);
            } else {
                byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
                out.uleb(5 + bytes.length);
                out.bytes(bytes);
            }
        }

        private byte[] debugInfo(boolean be) {
            Out out = new Out(be);
            // line deltas from line 1, one byte each as there are fewer than 256 lines
            for (int line : lines) out.u8(line - 1);
            for (String name : upvalueNames) out.cstring(name);
            int lastStart = 0;
            for (Var var : vars) {
                if (var.name != null) {
                    out.cstring(var.name);
                } else {
                    out.u8(var.tag);
                }
                // dumped offsets count the header instruction
                int start = var.startPc + 1, end = var.endPc + 1;
                out.uleb(start - lastStart);
                out.uleb(end - start);
                lastStart = start;
            }
            out.u8(0);
            return out.toByteArray();
        }
    }

    private static final class Var {
        final int tag;
        final String name;
        final int startPc, endPc;

        Var(int tag, String name, int startPc, int endPc) {
            this.tag = tag;
            this.name = name;
            this.startPc = startPc;
            this.endPc = endPc;
        }
    }

    private static final class Table {
        final List<Object> array;
        final Map<Object, Object> hash;

        Table(List<Object> array, Map<Object, Object> hash) {
            this.array = array;
            this.hash = hash;
        }
    }

    private static final class Out {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final boolean bigEndian;

        Out(boolean bigEndian) {
            this.bigEndian = bigEndian;
        }

        void u8(int b) {
            out.write(b);
        }

        void u16(int v) {
            if (bigEndian) {
                u8(v >>> 8);
                u8(v);
            } else {
                u8(v);
                u8(v >>> 8);
            }
        }

        void u32(int v) {
            if (bigEndian) {
                u8(v >>> 24);
                u8(v >>> 16);
                u8(v >>> 8);
                u8(v);
            } else {
                u8(v);
                u8(v >>> 8);
                u8(v >>> 16);
                u8(v >>> 24);
            }
        }

        void uleb(long v) {
            do {
                int b = (int) (v & 0x7f);
                v >>>= 7;
                if (v != 0) b |= 0x80;
                u8(b);
            } while (v != 0);
        }

        void bytes(byte[] bytes) {
            out.write(bytes, 0, bytes.length);
        }

        void cstring(String s) {
            bytes(s.getBytes(StandardCharsets.UTF_8));
            u8(0);
        }

        byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
