package io.github.byzatic.jobs.catalog;

import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.util.UuidProvider;
import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;
import org.apache.commons.vfs2.FileSystemManager;
import org.apache.commons.vfs2.FileType;
import org.apache.commons.vfs2.VFS;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node catalog backed by an Apache Commons VFS tree ({@code file://}, {@code ram://}, {@code sftp://}...).
 * Notes:
 * - Paths are relative to the root, without leading slash, '/'-separated.
 * - Folders and files are both nodes; the root itself is not.
 * - Siblings are visited in name order so that two walks of an unchanged tree are identical.
 * - Node UUIDs are derived from the relative path.
 * - An entry whose attributes can't be read is listed with its path only, so offsets stay aligned.
 */
@Beta
@ThreadSafe
public final class VfsNodeCatalog implements EntityCatalog<Node> {
    private final static Logger logger = LoggerFactory.getLogger(VfsNodeCatalog.class);

    private static final FileObject[] EMPTY = new FileObject[0];

    private final FileObject rootDir;

    private VfsNodeCatalog(Builder b) throws FileSystemException {
        FileSystemManager fsManager = (b.fsManager != null) ? b.fsManager : VFS.getManager();
        this.rootDir = fsManager.resolveFile(Objects.requireNonNull(b.rootUri, "rootUri"));
        if (!rootDir.exists() || !rootDir.isFolder()) {
            throw new FileSystemException("Root URI must exist and be a directory: " + b.rootUri);
        }
    }

    @Override
    public @NotNull List<Node> page(int offset, int limit) throws FileSystemException {
        List<Node> out = new ArrayList<>(Math.min(limit, 256));
        int skipped = 0;
        Deque<FileObject> stack = new ArrayDeque<>();
        pushChildren(stack, rootDir);
        while (!stack.isEmpty() && out.size() < limit) {
            FileObject fo = stack.pop();
            if (fo.isFolder()) pushChildren(stack, fo);
            if (skipped < offset) {
                skipped++;
                continue;
            }
            out.add(readNode(fo));
        }
        return out;
    }

    @Override
    public @NotNull Optional<Node> lookup(@NotNull String path) throws FileSystemException {
        FileObject fo = rootDir.resolveFile(stripLeadingSlash(path));
        if (!fo.exists()) return Optional.empty();
        return Optional.of(toNode(fo));
    }

    private void pushChildren(Deque<FileObject> stack, FileObject dir) {
        FileObject[] kids = safeChildren(dir);
        Arrays.sort(kids, Comparator.comparing((FileObject f) -> f.getName().getBaseName()).reversed());
        for (FileObject kid : kids) stack.push(kid);
    }

    private FileObject[] safeChildren(FileObject dir) {
        try {
            if (dir.exists() && dir.isFolder()) {
                try {
                    dir.refresh();
                } catch (FileSystemException e) {
                    logger.trace("Can't refresh {}", dir.getName(), e);
                }
                FileObject[] kids = dir.getChildren();
                return (kids != null) ? kids.clone() : EMPTY;
            }
        } catch (FileSystemException e) {
            logger.warn("Can't list children of {}", dir.getName(), e);
        }
        return EMPTY;
    }

    private Node readNode(FileObject fo) {
        try {
            return toNode(fo);
        } catch (FileSystemException e) {
            logger.debug("Can't read attributes of {}, listing it bare", fo.getName(), e);
            String path = fo.getName().getPath();
            String rootPath = rootDir.getName().getPath();
            if (path.startsWith(rootPath)) path = path.substring(rootPath.length());
            path = stripLeadingSlash(path);
            return Node.newBuilder()
                    .setUuid(UuidProvider.nameUuidString(path))
                    .setPath(path)
                    .setType(Node.Type.UNKNOWN)
                    .build();
        }
    }

    private Node toNode(FileObject fo) throws FileSystemException {
        String path = relativePath(fo);
        Node.Builder builder = Node.newBuilder()
                .setUuid(UuidProvider.nameUuidString(path))
                .setPath(path);
        if (fo.getType() == FileType.FOLDER) {
            builder.setType(Node.Type.COLLECTION);
        } else {
            builder.setType(Node.Type.LEAF)
                    .setSize(fo.getContent().getSize())
                    .setMtime(fo.getContent().getLastModifiedTime());
        }
        return builder.build();
    }

    private String relativePath(FileObject fo) throws FileSystemException {
        return stripLeadingSlash(rootDir.getName().getRelativeName(fo.getName()));
    }

    private static String stripLeadingSlash(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }

    public static class Builder {
        private FileSystemManager fsManager;
        private String rootUri;

        public Builder fsManager(FileSystemManager fsManager) {
            this.fsManager = fsManager;
            return this;
        }

        /**
         * Root URI, e.g. "file:///var/data" or "ram:///tree".
         */
        public Builder rootUri(String rootUri) {
            this.rootUri = rootUri;
            return this;
        }

        /**
         * Convenience: set root by local filesystem Path (converted to file:// URI).
         */
        public Builder rootPath(java.nio.file.Path path) {
            Objects.requireNonNull(path, "path");
            this.rootUri = path.toUri().toString();
            return this;
        }

        public VfsNodeCatalog build() throws FileSystemException {
            Objects.requireNonNull(rootUri, "rootUri");
            return new VfsNodeCatalog(this);
        }
    }
}
