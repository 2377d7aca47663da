package io.github.eutro.ljdecomp.core.util;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Function;

import java.util.*;

/**
 * Depth-first traversals of a graph given by a root and a successor function.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    final T root;
    final F<T, ? extends Iterable<T>> getChildren;

    public GraphWalker(T root, F<T, ? extends Iterable<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Walk the control flow graph of a function from its entry block.
     *
     * @param func The function.
     * @return The walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.blocks.get(0), b -> b.getControl().targets);
    }

    /**
     * Walk the dominator tree of a function, which must have been computed.
     *
     * @param func The function.
     * @return The walker.
     */
    public static GraphWalker<BasicBlock> domTreeWalker(Function func) {
        return new GraphWalker<>(func.blocks.get(0), b -> b.getExtOrThrow(CommonExts.DOM_CHILDREN));
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.push(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.pop();
            List<T> children = new ArrayList<>();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) children.add(child);
            }
            // push in reverse so the first child is visited first
            for (ListIterator<T> li = children.listIterator(children.size()); li.hasPrevious(); ) {
                stack.push(li.previous());
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<Iterator<? extends T>> iterators = new ArrayDeque<>();
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            enter(root);
        }

        private void enter(T node) {
            seen.add(node);
            nodes.push(node);
            iterators.push(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            while (true) {
                Iterator<? extends T> top = iterators.peek();
                assert top != null;
                if (top.hasNext()) {
                    T child = top.next();
                    if (!seen.contains(child)) enter(child);
                } else {
                    iterators.pop();
                    return nodes.pop();
                }
            }
        }
    }
}
