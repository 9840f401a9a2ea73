package com.gt.lift.store.impl;

import com.gt.lift.exception.LiftStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileSystemLiftStoreTests {

    private static final byte[] CONTENT_1 = "<lift version=\"0.13\"/>".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CONTENT_2 = "<lift version=\"0.13\"><entry id=\"a\"/></lift>".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path directory;

    private FileSystemLiftStore liftStore;

    @BeforeEach
    public void setup() {
        liftStore = new FileSystemLiftStore(directory);
    }

    @Test
    public void testWriteAndRead() {
        liftStore.write("dictionary.lift", CONTENT_1);

        assertTrue(liftStore.exists("dictionary.lift"));
        assertArrayEquals(CONTENT_1, liftStore.read("dictionary.lift"));
    }

    @Test
    public void testOverwrite() throws IOException {
        liftStore.write("dictionary.lift", CONTENT_1);
        liftStore.write("dictionary.lift", CONTENT_2);

        assertArrayEquals(CONTENT_2, liftStore.read("dictionary.lift"));
        try (var files = Files.list(directory)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    public void testFailedWriteLeavesNoTempFile() throws IOException {
        Files.createDirectories(directory.resolve("busy.lift").resolve("child"));

        assertThrows(LiftStoreException.class, () -> liftStore.write("busy.lift", CONTENT_1));

        try (var files = Files.list(directory)) {
            assertTrue(files.noneMatch(file -> file.getFileName().toString().endsWith(".tmp")));
        }
        assertTrue(Files.isDirectory(directory.resolve("busy.lift")));
    }

    @Test
    public void testWriteCreatesSubdirectories() {
        liftStore.write("project/ranges/sample.lift-ranges", CONTENT_1);

        assertTrue(Files.isRegularFile(directory.resolve("project").resolve("ranges").resolve("sample.lift-ranges")));
        assertTrue(liftStore.exists("project/ranges/sample.lift-ranges"));
    }

    @Test
    public void testMissingDocument() {
        assertFalse(liftStore.exists("missing.lift"));

        LiftStoreException ex = assertThrows(LiftStoreException.class, () -> liftStore.read("missing.lift"));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    public void testInvalidNames() {
        assertThrows(LiftStoreException.class, () -> liftStore.read(" "));
        assertThrows(LiftStoreException.class, () -> liftStore.write(null, CONTENT_1));
        assertThrows(LiftStoreException.class, () -> liftStore.read("../outside.lift"));
        assertThrows(LiftStoreException.class, () -> liftStore.exists("nested/../../outside.lift"));
    }
}
