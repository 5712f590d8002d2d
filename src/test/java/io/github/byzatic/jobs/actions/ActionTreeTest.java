package io.github.byzatic.jobs.actions;

import io.github.byzatic.jobs.model.Action;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionTreeTest {

    @Test
    void flattensDepthFirst() {
        Action tree = Action.newBuilder("a")
                .chain(Action.newBuilder("b").chain(Action.newBuilder("d").build()).build(),
                        Action.newBuilder("c").build())
                .build();
        ActionTree compiled = ActionTree.compile(List.of(tree, Action.newBuilder("e").build()));

        assertEquals(5, compiled.size());
        assertEquals("a", compiled.action(0).getId());
        assertEquals("b", compiled.action(1).getId());
        assertEquals("d", compiled.action(2).getId());
        assertEquals("c", compiled.action(3).getId());
        assertEquals("e", compiled.action(4).getId());

        assertArrayEquals(new int[]{0, 4}, compiled.roots());
        assertArrayEquals(new int[]{1, 3}, compiled.children(0));
        assertArrayEquals(new int[]{2}, compiled.children(1));
        assertArrayEquals(new int[0], compiled.children(4));

        assertEquals(4, compiled.subtreeSize(0));
        assertEquals(2, compiled.subtreeSize(1));
        assertEquals(1, compiled.subtreeSize(4));

        assertEquals("0", compiled.branch(0));
        assertEquals("0.0.0", compiled.branch(2));
        assertEquals("0.1", compiled.branch(3));
        assertEquals("1", compiled.branch(4));
    }

    @Test
    void emptyChain() {
        ActionTree compiled = ActionTree.compile(List.of());
        assertEquals(0, compiled.size());
        assertEquals(0, compiled.roots().length);
    }

    @Test
    void progressFollowsPlan() {
        ActionTree compiled = ActionTree.compile(List.of(Action.newBuilder("a")
                .chain(Action.newBuilder("b").build(), Action.newBuilder("c").build()).build()));
        ProgressTracker progress = new ProgressTracker(compiled);
        assertEquals(3, progress.planned());
        progress.extraInvocation(0);
        assertEquals(6, progress.planned());
        progress.completed();
        progress.halted(0);
        assertEquals(4, progress.planned());
        assertEquals(0.25f, progress.ratio(), 1e-6);
    }
}
