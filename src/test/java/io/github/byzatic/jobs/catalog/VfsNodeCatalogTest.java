package io.github.byzatic.jobs.catalog;

import io.github.byzatic.jobs.model.Node;
import org.junit.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class VfsNodeCatalogTest {

    private static Path root;
    private static VfsNodeCatalog catalog;

    @BeforeClass
    public static void setupClass() throws Exception {
        root = Files.createTempDirectory("catalog_test");
        Files.createDirectories(root.resolve("b/inner"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/one.txt"), "1");
        Files.writeString(root.resolve("b/inner/deep.txt"), "deep");
        Files.writeString(root.resolve("c.txt"), "hello");
        catalog = new VfsNodeCatalog.Builder().rootPath(root).build();
    }

    @AfterClass
    public static void cleanupClass() throws IOException {
        if (root != null) {
            Files.walk(root)
                    .sorted(Comparator.reverseOrder())
                    .forEach(path -> path.toFile().delete());
        }
    }

    private static List<String> paths(List<Node> nodes) {
        return nodes.stream().map(Node::getPath).collect(Collectors.toList());
    }

    @Test
    public void testWalkIsDepthFirstInNameOrder() throws Exception {
        assertEquals(Arrays.asList("a", "a/one.txt", "b", "b/inner", "b/inner/deep.txt", "c.txt"),
                paths(catalog.page(0, 100)));
    }

    @Test
    public void testPagesAreStable() throws Exception {
        List<String> all = paths(catalog.page(0, 100));
        List<String> paged = new ArrayList<>();
        paged.addAll(paths(catalog.page(0, 4)));
        paged.addAll(paths(catalog.page(4, 4)));
        assertEquals(all, paged);
        assertTrue(catalog.page(10, 4).isEmpty());
    }

    @Test
    public void testNodeAttributes() throws Exception {
        Node file = catalog.lookup("/c.txt").orElseThrow(AssertionError::new);
        assertEquals("c.txt", file.getPath());
        assertEquals(Node.Type.LEAF, file.getType());
        assertEquals(5, file.getSize());
        assertTrue(file.getMtime() > 0);

        Node dir = catalog.lookup("b/inner").orElseThrow(AssertionError::new);
        assertEquals(Node.Type.COLLECTION, dir.getType());
        assertEquals(catalog.lookup("b/inner").get().getUuid(), dir.getUuid());
        assertNotEquals(file.getUuid(), dir.getUuid());
    }

    @Test
    public void testMissingPath() throws Exception {
        assertFalse(catalog.lookup("nope/none.txt").isPresent());
    }

    @Test
    public void testUnreadableEntryKeepsItsPagePosition() throws Exception {
        Path dir = Files.createTempDirectory("catalog_broken");
        try {
            Files.writeString(dir.resolve("a.txt"), "a");
            try {
                Files.createSymbolicLink(dir.resolve("b.lnk"), dir.resolve("gone"));
            } catch (UnsupportedOperationException | IOException e) {
                Assume.assumeNoException(e);
            }
            Files.writeString(dir.resolve("c.txt"), "c");
            VfsNodeCatalog broken = new VfsNodeCatalog.Builder().rootPath(dir).build();

            List<String> paged = new ArrayList<>();
            PagedIterator<Node> it = new PagedIterator<>(broken, 1);
            while (it.hasNext()) paged.add(it.next().getPath());

            assertEquals(Arrays.asList("a.txt", "b.lnk", "c.txt"), paged);
            assertEquals(Node.Type.UNKNOWN, broken.page(1, 1).get(0).getType());
        } finally {
            Files.walk(dir)
                    .sorted(Comparator.reverseOrder())
                    .forEach(path -> path.toFile().delete());
        }
    }
}
