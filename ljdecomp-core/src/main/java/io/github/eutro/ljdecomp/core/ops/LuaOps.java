package io.github.eutro.ljdecomp.core.ops;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.TableConstant;
import io.github.eutro.ljdecomp.core.tree.BinOp;
import io.github.eutro.ljdecomp.core.tree.UnOp;

/**
 * Lua operations. Unless noted, an effect's operands and results are in the order given.
 */
public class LuaOps {
    // effects

    /**
     * {@code a op b}.
     */
    public static final UnaryOpKey<BinOp> ARITH = new UnaryOpKey<>("arith");
    /**
     * {@code op a}.
     */
    public static final UnaryOpKey<UnOp> UNARY = new UnaryOpKey<>("unary");
    /**
     * Concatenation of all operands.
     */
    public static final SimpleOpKey CONCAT = new SimpleOpKey("concat");
    /**
     * Reads the upvalue with the given index.
     */
    public static final UnaryOpKey<Integer> UGET = new UnaryOpKey<>("uget");
    /**
     * Writes its single operand to the upvalue with the given index. No results.
     */
    public static final UnaryOpKey<Integer> USET = new UnaryOpKey<>("uset");
    /**
     * Reads the named global.
     */
    public static final UnaryOpKey<String> GGET = new UnaryOpKey<>("gget");
    /**
     * Writes its single operand to the named global. No results.
     */
    public static final UnaryOpKey<String> GSET = new UnaryOpKey<>("gset");
    /**
     * {@code table[key]}.
     */
    public static final SimpleOpKey INDEX = new SimpleOpKey("index");
    /**
     * {@code table[key] = value}. No results.
     */
    public static final SimpleOpKey NEWINDEX = new SimpleOpKey("newindex");
    /**
     * A new table, filled from the template.
     */
    public static final UnaryOpKey<TableConstant> NEW_TABLE = new UnaryOpKey<>("newtable");
    /**
     * A closure of the child prototype.
     */
    public static final UnaryOpKey<BytecodeFunction> CLOSURE = new UnaryOpKey<>("closure");
    /**
     * {@code fn(args...)}. Assigns as many results as it has vars, or {@code MULTRES}.
     */
    public static final SimpleOpKey CALL = new SimpleOpKey("call");
    /**
     * {@code ...}. Assigns as many values as it has vars, or {@code MULTRES}.
     */
    public static final SimpleOpKey VARARG = new SimpleOpKey("vararg");
    /**
     * Stores {@code MULTRES} into the first operand, starting at the given array index. No results.
     */
    public static final UnaryOpKey<Integer> SET_LIST = new UnaryOpKey<>("setlist");

    // controls

    /**
     * Branches to {@code targets[0]} if the condition holds of the operands, else to {@code targets[1]}.
     */
    public static final UnaryOpKey<Cond> COND = new UnaryOpKey<>("cond");
    /**
     * Numeric for loop entry with the loop registers at the given base:
     * {@code targets[0]} is the body, {@code targets[1]} the exit.
     */
    public static final UnaryOpKey<Integer> FOR_PREP = new UnaryOpKey<>("forprep");
    /**
     * Numeric for loop step: {@code targets[0]} is the body, {@code targets[1]} the exit.
     */
    public static final UnaryOpKey<Integer> FOR_LOOP = new UnaryOpKey<>("forloop");
    /**
     * Generic for loop step after the iterator call, with the loop variables at the given base:
     * {@code targets[0]} is the body, {@code targets[1]} the exit.
     */
    public static final UnaryOpKey<Integer> ITER_LOOP = new UnaryOpKey<>("iterloop");
}
