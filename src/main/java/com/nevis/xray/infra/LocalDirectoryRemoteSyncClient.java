package com.nevis.xray.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Treats a mounted directory (network share, synced folder) as the remote side.
 */
@Slf4j
public class LocalDirectoryRemoteSyncClient implements RemoteSyncClient {

    private final Path root;

    public LocalDirectoryRemoteSyncClient(Path root) {
        this.root = root;
    }

    @Override
    public List<RemoteFile> listRemoteFiles(String folder) {
        Path dir = resolve(folder);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .map(file -> new RemoteFile(file.getFileName().toString(), join(folder, file.getFileName().toString())))
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .toList();
        } catch (IOException e) {
            log.warn("Failed to list remote folder {}: {}", folder, e.getMessage());
            return List.of();
        }
    }

    @Override
    public int uploadFile(Path local, String remotePath) {
        Path target = resolve(remotePath);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(local, target, StandardCopyOption.REPLACE_EXISTING);
            return 201;
        } catch (NoSuchFileException e) {
            log.warn("Upload source missing: {}", local);
            return 404;
        } catch (IOException e) {
            log.warn("Upload of {} to {} failed: {}", local, remotePath, e.getMessage());
            return 500;
        }
    }

    @Override
    public int downloadFile(String remotePath, Path local) {
        Path source = resolve(remotePath);
        if (!Files.isRegularFile(source)) {
            return 404;
        }
        try {
            Files.createDirectories(local.getParent());
            Files.copy(source, local, StandardCopyOption.REPLACE_EXISTING);
            return 200;
        } catch (IOException e) {
            log.warn("Download of {} to {} failed: {}", remotePath, local, e.getMessage());
            return 500;
        }
    }

    private Path resolve(String remotePath) {
        String relative = remotePath.startsWith("/") ? remotePath.substring(1) : remotePath;
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root.normalize())) {
            throw new IllegalArgumentException("Remote path escapes sync root: " + remotePath);
        }
        return resolved;
    }

    static String join(String folder, String name) {
        if (folder == null || folder.isEmpty()) {
            return name;
        }
        return folder.endsWith("/") ? folder + name : folder + "/" + name;
    }
}
