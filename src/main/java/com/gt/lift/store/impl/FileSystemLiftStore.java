package com.gt.lift.store.impl;

import com.gt.lift.exception.LiftStoreException;
import com.gt.lift.store.LiftStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

// LIFT and ranges documents as files under one directory
public class FileSystemLiftStore implements LiftStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemLiftStore.class);

    private final Path directory;

    public FileSystemLiftStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public byte[] read(String name) {
        Path file = resolve(name);
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            log.error("Failed to read LIFT document {}", file, ex);
            throw new LiftStoreException("Error reading " + name, ex);
        }
    }

    // Written to a temporary file first so readers never see a partial document
    @Override
    public void write(String name, byte[] content) {
        Path file = resolve(name);
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            Files.write(temp, content);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote {} bytes to {}", content.length, file);
        } catch (IOException ex) {
            log.error("Failed to write LIFT document {}", file, ex);
            deleteTemp(temp);
            throw new LiftStoreException("Error writing " + name, ex);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Failed to remove temporary file {}", temp, ex);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new LiftStoreException("Document name must not be blank");
        }

        Path file = directory.resolve(name).normalize();
        if (!file.startsWith(directory)) {
            throw new LiftStoreException("Document name " + name + " points outside the store directory");
        }
        return file;
    }
}
