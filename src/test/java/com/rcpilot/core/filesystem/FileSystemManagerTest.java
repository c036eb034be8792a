package com.rcpilot.core.filesystem;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemManagerTest {

    @TempDir
    Path tempDir;

    private FileSystemManager fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = new FileSystemManager(tempDir.toString());
    }

    @Test
    void testWriteAndReadFile() throws Exception {
        String content = "int add(int a, int b) {\n    return a + b;\n}\n";

        fileSystem.writeFile("add.c", content);

        assertEquals(content, fileSystem.readFile("add.c"));
    }

    @Test
    void testWriteCreatesParentDirectories() throws Exception {
        fileSystem.writeFile("proj/src/proofs/fib/fib_lemmas.v", "Lemma x: True.");

        assertTrue(Files.exists(tempDir.resolve("proj/src/proofs/fib/fib_lemmas.v")));
    }

    @Test
    void testPathTraversalPrevention() {
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.readFile("../../etc/passwd")
        );
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.writeFile("proj/../../escape.c", "x")
        );
    }

    @Test
    void testFileOverwrite() throws Exception {
        fileSystem.writeFile("file.c", "first");
        fileSystem.writeFile("file.c", "second");

        assertEquals("second", fileSystem.readFile("file.c"));
    }

    @Test
    void testFindFilesSortedRelativeAndSkipsDotPaths() throws Exception {
        fileSystem.writeFile("proj/main.c", "int main(void) { return 0; }");
        fileSystem.writeFile("proj/lib/list.h", "struct list;");
        fileSystem.writeFile("proj/lib/list.c", "struct list;");
        fileSystem.writeFile("proj/notes.txt", "todo");
        fileSystem.writeFile("proj/.cache/old.c", "stale");

        List<String> files = fileSystem.findFiles("proj", p -> {
            String name = p.getFileName().toString();
            return name.endsWith(".c") || name.endsWith(".h");
        });

        assertEquals(List.of("lib/list.c", "lib/list.h", "main.c"), files);
    }

    @Test
    void testFindFilesOnMissingDirectory() {
        assertThrows(
            FileSystemManager.FileSystemException.class,
            () -> fileSystem.findFiles("missing", p -> true)
        );
    }

    @Test
    void testFileExistsAndIsDirectory() throws Exception {
        fileSystem.writeFile("proj/exists.c", "test");

        assertTrue(fileSystem.fileExists("proj/exists.c"));
        assertFalse(fileSystem.fileExists("proj/missing.c"));
        assertTrue(fileSystem.isDirectory("proj"));
        assertFalse(fileSystem.isDirectory("proj/exists.c"));
    }

    @Test
    void testResolveIsAbsoluteUnderRoot() throws Exception {
        Path resolved = fileSystem.resolve("proj/a.c");

        assertTrue(resolved.isAbsolute());
        assertTrue(resolved.startsWith(fileSystem.getRootPath()));
    }
}
