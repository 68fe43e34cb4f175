package com.example.fstree;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileTreeTest {
    private static FileTree fileTree(Path workingDirectory) {
        return new FileTree(FileTreeConfig.defaults().withWorkingDirectory(workingDirectory));
    }

    @Test
    void listThenRemoveScenario() throws Exception {
        Path base = Files.createTempDirectory("filetree-test");
        Path root = Files.createDirectory(base.resolve("root"));
        Files.writeString(root.resolve("a.txt"), "alpha");
        Files.createDirectory(root.resolve("sub"));
        Files.writeString(root.resolve("sub/b.txt"), "bravo");

        try (FileTree tree = fileTree(base)) {
            List<Path> paths = tree.list("root", true, false).paths();
            assertEquals(3, paths.size());
            assertTrue(paths.indexOf(root.resolve("sub")) < paths.indexOf(root.resolve("sub/b.txt")));

            assertEquals(4, tree.removeTree("root", true));

            FileTreeException ex = assertThrows(FileTreeException.class, () -> tree.list("root", true, false));
            assertEquals(ErrorKind.NOT_FOUND, ex.kind());
            assertFalse(tree.exists("root"));
        }
    }

    @Test
    void makeTreePathThenCopy() throws Exception {
        Path base = Files.createTempDirectory("filetree-test");
        Files.writeString(base.resolve("src.txt"), "payload");

        try (FileTree tree = fileTree(base)) {
            assertEquals(3, tree.makeTreePath("x/y/z").size());
            assertTrue(tree.makeTreePath("x/y/z").isEmpty());
            assertEquals(7L, tree.copyFile("src.txt", "x/y/z/dst.txt"));
            assertEquals(1, tree.copyTree("x", "x-copy"));
        }

        assertEquals("payload", Files.readString(base.resolve("x-copy/y/z/dst.txt")));
    }

    @Test
    void asyncOperationsCompleteIndependently() throws Exception {
        Path base = Files.createTempDirectory("filetree-test");
        for (int i = 0; i < 4; i++) {
            Path dir = Files.createDirectories(base.resolve("tree" + i + "/nested"));
            Files.writeString(dir.resolve("file.txt"), "content " + i);
        }

        try (FileTree tree = fileTree(base)) {
            CompletableFuture<?>[] removals = new CompletableFuture<?>[4];
            for (int i = 0; i < 4; i++) {
                removals[i] = tree.removeTreeAsync("tree" + i, true);
            }
            CompletableFuture.allOf(removals).get();

            Listing remaining = tree.listAsync(".", ListOptions.defaults()).get();
            assertEquals(0, remaining.size());
        }
    }

    @Test
    void asyncWalkFailsWhenVisitorThrowsError() throws Exception {
        Path base = Files.createTempDirectory("filetree-test");
        AssertionError boom = new AssertionError("boom");

        try (FileTree tree = fileTree(base)) {
            CompletableFuture<Void> walk = tree.walkAsync(".", (path, record, failure) -> {
                throw boom;
            }, WalkOptions.defaults());

            ExecutionException ex = assertThrows(ExecutionException.class, () -> walk.get(10, TimeUnit.SECONDS));
            assertSame(boom, ex.getCause());

            // The pool keeps serving after the failed task.
            assertEquals(0, tree.listAsync(".", ListOptions.defaults()).get(10, TimeUnit.SECONDS).size());
        }
    }

    @Test
    void asyncFailureCarriesTypedException() throws Exception {
        Path base = Files.createTempDirectory("filetree-test");
        Files.writeString(base.resolve("blocker"), "file");

        try (FileTree tree = fileTree(base)) {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> tree.makeTreePathAsync("blocker/child").get());

            FileTreeException cause = assertInstanceOf(FileTreeException.class, ex.getCause());
            assertEquals(ErrorKind.INVALID_PATH, cause.kind());
            assertEquals(base.resolve("blocker"), cause.path());
        }
    }
}
