package com.example.fstree;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point wiring the tree operations together. String paths are resolved against the
 * configured working directory.
 *
 * <p>The {@code *Async} variants run each operation as one task on a shared pool. An operation is
 * single-threaded from start to finish; concurrent operations on overlapping subtrees are not
 * serialized against each other, so their outcome is whatever interleaving the filesystem sees.
 */
public final class FileTree implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileTree.class);

    private final FileTreeConfig config;
    private final PathResolver resolver;
    private final NodeProbe probe;
    private final TreeWalker walker;
    private final Lister lister;
    private final RecursiveRemover remover;
    private final RecursiveCreator creator;
    private final TreeCopier copier;
    private final ExecutorService executor;

    public FileTree(FileTreeConfig config) {
        this(config, new NioFileSystemPrimitives());
    }

    public FileTree(FileTreeConfig config, FileSystemPrimitives primitives) {
        this.config = config;
        this.resolver = new PathResolver(config.workingDirectory());
        this.probe = new NodeProbe(primitives);
        this.walker = new TreeWalker(primitives, probe, resolver);
        this.lister = new Lister(walker, resolver, new ContentTypeDetector(new Tika(), primitives));
        this.remover = new RecursiveRemover(lister, probe, primitives, resolver);
        this.creator = new RecursiveCreator(probe, primitives, resolver, config.directoryMode().orElse(null));
        this.copier = new TreeCopier(primitives, new ByteStreamCopier(config.copyBufferSize()), lister, creator, resolver);
        this.executor = Executors.newFixedThreadPool(config.threadCount());
    }

    public Path resolve(String path) {
        return resolver.resolve(path);
    }

    public boolean exists(String path) {
        return probe.exists(resolve(path));
    }

    public void walk(String root, NodeVisitor visitor) throws IOException {
        walker.walk(resolve(root), visitor, WalkOptions.defaults().withFollowLinks(config.followLinks()));
    }

    public void walk(String root, NodeVisitor visitor, WalkOptions options) throws IOException {
        walker.walk(resolve(root), visitor, options);
    }

    public Listing list(String root, boolean recursive, boolean details) throws IOException {
        return lister.list(resolve(root), defaultListOptions().withRecursive(recursive).withDetails(details));
    }

    public Listing list(String root, ListOptions options) throws IOException {
        return lister.list(resolve(root), options);
    }

    public int removeTree(String root, boolean recursive) throws IOException {
        return remover.removeTree(resolve(root), recursive);
    }

    public List<Path> makeTreePath(String path) throws IOException {
        return creator.makeTreePath(resolve(path));
    }

    public List<Path> makeTreePath(String path, Set<PosixFilePermission> mode) throws IOException {
        return creator.makeTreePath(resolve(path), mode);
    }

    public long copyFile(String source, String destination) throws IOException {
        return copier.copyFile(resolve(source), resolve(destination));
    }

    public long copyFile(String source, String destination, TransferListener listener) throws IOException {
        return copier.copyFile(resolve(source), resolve(destination), listener);
    }

    public int copyTree(String source, String destination) throws IOException {
        return copier.copyTree(resolve(source), resolve(destination));
    }

    public CompletableFuture<Void> walkAsync(String root, NodeVisitor visitor, WalkOptions options) {
        return submit(() -> {
            walk(root, visitor, options);
            return null;
        });
    }

    public CompletableFuture<Listing> listAsync(String root, ListOptions options) {
        return submit(() -> list(root, options));
    }

    public CompletableFuture<Integer> removeTreeAsync(String root, boolean recursive) {
        return submit(() -> removeTree(root, recursive));
    }

    public CompletableFuture<List<Path>> makeTreePathAsync(String path) {
        return submit(() -> makeTreePath(path));
    }

    public CompletableFuture<Long> copyFileAsync(String source, String destination) {
        return submit(() -> copyFile(source, destination));
    }

    public CompletableFuture<Integer> copyTreeAsync(String source, String destination) {
        return submit(() -> copyTree(source, destination));
    }

    public FileTreeConfig config() {
        return config;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOGGER.warn("Tree operations still running after shutdown; interrupting them.");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private ListOptions defaultListOptions() {
        return ListOptions.defaults()
                .withFollowLinks(config.followLinks())
                .withDetectContentTypes(config.detectContentTypes());
    }

    // The future fails with the operation's own exception rather than a wrapper.
    private <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(task.call());
            } catch (Throwable ex) {
                LOGGER.debug("Async tree operation failed", ex);
                future.completeExceptionally(ex);
            }
        });
        return future;
    }
}
