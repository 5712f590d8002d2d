package io.github.byzatic.jobs.actions;

import com.google.common.collect.ImmutableList;
import io.github.byzatic.jobs.model.Action;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Chain of actions flattened into nodes addressed by index, in depth-first order.
 * Node {@code i} owns the range {@code [i, i + subtreeSize(i))}.
 */
public final class ActionTree {
    private final ImmutableList<Action> actions;
    private final int[][] children;
    private final String[] branches;
    private final int[] subtreeSizes;
    private final int[] roots;

    private ActionTree(List<Action> actions, int[][] children, String[] branches, int[] subtreeSizes, int[] roots) {
        this.actions = ImmutableList.copyOf(actions);
        this.children = children;
        this.branches = branches;
        this.subtreeSizes = subtreeSizes;
        this.roots = roots;
    }

    public static @NotNull ActionTree compile(@NotNull List<Action> rootActions) {
        List<Action> actions = new ArrayList<>();
        List<String> branches = new ArrayList<>();
        List<Integer> parents = new ArrayList<>();

        Deque<Frame> stack = new ArrayDeque<>();
        for (int i = rootActions.size() - 1; i >= 0; i--) stack.push(new Frame(rootActions.get(i), Integer.toString(i), -1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            int index = actions.size();
            actions.add(frame.action);
            branches.add(frame.branch);
            parents.add(frame.parent);
            List<Action> chained = frame.action.getChainedActions();
            for (int c = chained.size() - 1; c >= 0; c--) stack.push(new Frame(chained.get(c), frame.branch + "." + c, index));
        }

        int size = actions.size();
        int[] subtree = new int[size];
        List<List<Integer>> kids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) kids.add(new ArrayList<>());
        List<Integer> rootIndexes = new ArrayList<>();
        for (int i = size - 1; i >= 0; i--) {
            subtree[i] += 1;
            int parent = parents.get(i);
            if (parent >= 0) {
                subtree[parent] += subtree[i];
                kids.get(parent).add(0, i);
            } else {
                rootIndexes.add(0, i);
            }
        }
        int[][] children = new int[size][];
        for (int i = 0; i < size; i++) children[i] = kids.get(i).stream().mapToInt(Integer::intValue).toArray();
        return new ActionTree(actions, children, branches.toArray(new String[0]), subtree,
                rootIndexes.stream().mapToInt(Integer::intValue).toArray());
    }

    public int size() {
        return actions.size();
    }

    public @NotNull Action action(int index) {
        return actions.get(index);
    }

    public int[] children(int index) {
        return children[index].clone();
    }

    public int[] roots() {
        return roots.clone();
    }

    /**
     * Dotted path of child positions from the roots, {@code 0.1} is the second child of the first root.
     */
    public @NotNull String branch(int index) {
        return branches[index];
    }

    /**
     * The node itself plus all its descendants.
     */
    public int subtreeSize(int index) {
        return subtreeSizes[index];
    }

    private static final class Frame {
        final Action action;
        final String branch;
        final int parent;

        Frame(Action action, String branch, int parent) {
            this.action = action;
            this.branch = branch;
            this.parent = parent;
        }
    }
}
