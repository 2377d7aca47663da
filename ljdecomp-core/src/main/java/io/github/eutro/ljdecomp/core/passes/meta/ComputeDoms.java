package io.github.eutro.ljdecomp.core.passes.meta;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.Ext;
import io.github.eutro.ljdecomp.core.ext.MetadataState;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Control;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.InPlaceIRPass;
import io.github.eutro.ljdecomp.core.util.GraphWalker;

import java.util.*;

/**
 * Computes {@link CommonExts#IDOM}, {@link CommonExts#DOM_CHILDREN} and the dominator tree
 * numbering {@link CommonExts#DOM_ENTER}/{@link CommonExts#DOM_EXIT} for each block.
 * <p>
 * Every block must be reachable from the entry; blocks keep their order.
 */
/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/
public class ComputeDoms implements InPlaceIRPass<Function> {
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    /**
     * Check whether one block dominates another, using the numbering computed by this pass.
     *
     * @param a The possible dominator.
     * @param b The block.
     * @return Whether every path from the entry to {@code b} passes through {@code a}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        return a.getExtOrThrow(CommonExts.DOM_ENTER) <= b.getExtOrThrow(CommonExts.DOM_ENTER)
                && b.getExtOrThrow(CommonExts.DOM_EXIT) <= a.getExtOrThrow(CommonExts.DOM_EXIT);
    }

    @Override
    public void runInPlace(Function func) {
        Ext<Integer> indexExt = Ext.create(Integer.class, "DOM_INDEX");
        int size = func.blocks.size();
        for (int i = 0; i < size; i++) {
            func.blocks.get(i).attachExt(indexExt, i + 1);
        }

        // vertices are numbered 1..n by block position, 0 is the null vertex
        class Runner {
            int n = 0;
            final int[][] succ = new int[size + 1][];
            final int[] dom = new int[size + 1];
            final int[] parent = new int[size + 1];
            final int[] ancestor = new int[size + 1];
            final int[] child = new int[size + 1];
            final int[] vertex = new int[size + 1];
            final int[] label = new int[size + 1];
            final int[] semi = new int[size + 1];
            final int[] weight = new int[size + 1];
            final List<List<Integer>> pred = new ArrayList<>();
            final List<Set<Integer>> bucket = new ArrayList<>();

            void dfs(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                weight[v] = 1;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred.get(w).add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) return label[v];
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]] ? label[v] : label[ancestor[v]];
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (weight[s] + weight[child[child[s]]] >= 2 * weight[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        weight[child[s]] = weight[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                weight[v] += weight[w];
                if (weight[v] < 2 * weight[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            void run() {
                pred.add(null);
                bucket.add(null);
                for (int v = 1; v <= size; v++) {
                    Control ctrl = func.blocks.get(v - 1).getControl();
                    succ[v] = new int[ctrl.targets.size()];
                    for (int j = 0; j < succ[v].length; j++) {
                        succ[v][j] = ctrl.targets.get(j).getExtOrThrow(indexExt);
                    }
                    pred.add(new ArrayList<>());
                    bucket.add(new LinkedHashSet<>());
                }
                dfs(1);
                for (int i = n; i >= 2; i--) {
                    int w = vertex[i];
                    for (int v : pred.get(w)) {
                        int u = eval(v);
                        if (semi[u] < semi[w]) semi[w] = semi[u];
                    }
                    bucket.get(vertex[semi[w]]).add(w);
                    link(parent[w], w);
                    for (int v : bucket.get(parent[w])) {
                        int u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket.get(parent[w]).clear();
                }
                for (int i = 2; i <= n; i++) {
                    int w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) dom[w] = dom[dom[w]];
                }
                dom[1] = 0;
            }
        }
        Runner runner = new Runner();
        runner.run();
        if (runner.n != size) {
            throw new IllegalStateException((size - runner.n) + " blocks are unreachable");
        }

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.DOM_CHILDREN, new ArrayList<>());
        }
        for (int v = 2; v <= size; v++) {
            BasicBlock block = func.blocks.get(v - 1);
            BasicBlock idom = func.blocks.get(runner.dom[v] - 1);
            block.attachExt(CommonExts.IDOM, idom);
            idom.getExtOrThrow(CommonExts.DOM_CHILDREN).add(block);
        }
        func.blocks.get(0).removeExt(CommonExts.IDOM);
        for (BasicBlock block : func.blocks) {
            block.removeExt(indexExt);
        }

        int counter = 0;
        Deque<BasicBlock> stack = new ArrayDeque<>();
        GraphWalker<BasicBlock> walker = GraphWalker.domTreeWalker(func);
        for (BasicBlock block : walker.preOrder()) {
            while (!stack.isEmpty() && stack.peek() != block.getNullable(CommonExts.IDOM)) {
                stack.pop().attachExt(CommonExts.DOM_EXIT, counter);
            }
            block.attachExt(CommonExts.DOM_ENTER, counter++);
            stack.push(block);
        }
        while (!stack.isEmpty()) {
            stack.pop().attachExt(CommonExts.DOM_EXIT, counter);
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.DOMS);
    }
}
