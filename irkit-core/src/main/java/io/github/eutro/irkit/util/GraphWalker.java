package io.github.eutro.irkit.util;

import io.github.eutro.irkit.ir.Block;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Region;

import java.util.*;

/**
 * Walks a graph depth-first, in pre- or post-order.
 * <p>
 * Each node is visited once, even if it is reachable along several paths.
 * Children are computed when their parent is visited, so mutations of parts
 * of the graph not yet reached are observed by the walk.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a walker over an operation and the operations nested in its regions,
     * visiting nested operations in program order.
     *
     * @param root The root operation.
     * @return The graph walker.
     */
    public static GraphWalker<Operation> opWalker(Operation root) {
        return new GraphWalker<>(root, op -> reversedIterable(nestedOps(op)));
    }

    private static List<Operation> nestedOps(Operation op) {
        if (op.getRegions().isEmpty()) return Collections.emptyList();
        List<Operation> ops = new ArrayList<>();
        for (Region region : op.getRegions()) {
            for (Block block : region.getBlocks()) {
                ops.addAll(block.getOps());
            }
        }
        return ops;
    }

    private static <T> Iterable<T> reversedIterable(List<T> ts) {
        return () -> {
            ListIterator<T> li = ts.listIterator(ts.size());
            return new Iterator<T>() {
                @Override
                public boolean hasNext() {
                    return li.hasPrevious();
                }

                @Override
                public T next() {
                    return li.previous();
                }
            };
        };
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
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
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Object sentinel = new Object();
        private final Deque<Object> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @SuppressWarnings("unchecked")
        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Object last = stack.getLast();
                if (last == sentinel) {
                    stack.removeLast();
                    return (T) stack.removeLast();
                }
                stack.addLast(sentinel);
                for (T next : getChildren.apply((T) last)) {
                    if (seen.add(next)) {
                        stack.addLast(next);
                    }
                }
            }
        }
    }
}
