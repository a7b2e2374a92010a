package de.bsommerfeld.tachobridge.store;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File helpers shared by the JSON-backed stores.
 */
final class JsonFiles {

    private JsonFiles() {
    }

    /**
     * Serializes {@code value} into a {@code .tmp} sibling first and then
     * renames it over {@code target}, so a crash mid-write never leaves a
     * truncated file behind.
     */
    static void writeAtomically(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Moves an unreadable file aside as {@code <name>.corrupt} so the next
     * write does not destroy it.
     */
    static void quarantine(Path file) throws IOException {
        Files.move(file, file.resolveSibling(file.getFileName() + ".corrupt"), StandardCopyOption.REPLACE_EXISTING);
    }
}
