package com.hanyahunya.sandbox.adapter.out.storage;

import com.hanyahunya.sandbox.application.port.out.WorkspaceStoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Workspace storage on the local filesystem: storage paths are directories.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sandbox.storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalWorkspaceStorageAdapter implements WorkspaceStoragePort {

    @Override
    public void downloadFolder(String storagePath, Path destinationDir) {
        copyTree(Paths.get(storagePath), destinationDir);
    }

    @Override
    public void uploadFolder(Path sourceDir, String storagePath) {
        copyTree(sourceDir, Paths.get(storagePath));
    }

    @Override
    public String pathJoin(String... parts) {
        String[] nonEmpty = Arrays.stream(parts).filter(part -> part != null && !part.isEmpty()).toArray(String[]::new);
        if (nonEmpty.length == 0) return "";
        return Paths.get(nonEmpty[0], Arrays.copyOfRange(nonEmpty, 1, nonEmpty.length)).toString();
    }

    private void copyTree(Path source, Path target) {
        Path from = source.toAbsolutePath().normalize();
        Path to = target.toAbsolutePath().normalize();
        if (from.equals(to)) return;
        if (!Files.isDirectory(from)) {
            log.debug("Nothing to copy, {} does not exist", from);
            return;
        }

        try (Stream<Path> paths = Files.walk(from)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                Path destination = to.resolve(from.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
            log.debug("Copied workspace {} -> {}", from, to);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy " + from + " to " + to, e);
        }
    }
}
