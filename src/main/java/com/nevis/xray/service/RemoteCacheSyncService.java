package com.nevis.xray.service;

import com.nevis.xray.config.SyncProperties;
import com.nevis.xray.infra.RemoteFile;
import com.nevis.xray.infra.RemoteSyncClient;
import com.nevis.xray.repository.FileSystemPartialCacheStore;
import com.nevis.xray.repository.PartialCacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Copies a document's cache files to and from the remote folder. Files are moved
 * as-is; their content is never inspected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RemoteCacheSyncService {

    private static final Pattern PARTIAL_FILE = Pattern.compile("^\\d+%\\.json$");

    private final PartialCacheStore store;
    private final RemoteSyncClient remote;
    private final SyncProperties properties;

    public SyncReport upload(String documentId, String folder) {
        RemotePaths paths = remotePaths(documentId, folder);
        Tally tally = new Tally();

        Path mainFile = store.mainFile(documentId);
        if (Files.isRegularFile(mainFile)) {
            upload(mainFile, join(paths.documentDir(), FileSystemPartialCacheStore.MAIN_FILE_NAME), tally);
        }

        Path analysisDir = store.partialDirectory(documentId);
        if (Files.isDirectory(analysisDir)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(analysisDir)) {
                for (Path file : files) {
                    String name = file.getFileName().toString();
                    if (PARTIAL_FILE.matcher(name).matches()) {
                        upload(file, join(paths.analysisDir(), name), tally);
                    }
                }
            } catch (IOException e) {
                log.warn("Could not list {} for upload", analysisDir, e);
                tally.fail(FileSystemPartialCacheStore.ANALYSIS_DIR + " (" + e.getMessage() + ")");
            }
        }

        log.info("Uploaded cache of document {}: {} ok, {} failed", documentId, tally.succeeded, tally.failed);
        return tally.report();
    }

    public SyncReport download(String documentId, String folder) {
        RemotePaths paths = remotePaths(documentId, folder);
        Tally tally = new Tally();

        String remoteMain = join(paths.documentDir(), FileSystemPartialCacheStore.MAIN_FILE_NAME);
        int code = remote.downloadFile(remoteMain, store.mainFile(documentId));
        if (code == 200) {
            tally.succeeded++;
        } else if (code == 404) {
            log.info("No remote main cache for document {}", documentId);
        } else {
            tally.fail(FileSystemPartialCacheStore.MAIN_FILE_NAME + " (" + code + ") <- " + remoteMain);
        }

        Path analysisDir = store.partialDirectory(documentId);
        for (RemoteFile file : remote.listRemoteFiles(paths.analysisDir())) {
            if (!PARTIAL_FILE.matcher(file.name()).matches()) {
                continue;
            }
            int status = remote.downloadFile(file.path(), analysisDir.resolve(file.name()));
            if (status == 200) {
                tally.succeeded++;
            } else {
                tally.fail(file.name() + " (" + status + ") <- " + file.path());
            }
        }

        log.info("Downloaded cache of document {}: {} ok, {} failed", documentId, tally.succeeded, tally.failed);
        return tally.report();
    }

    private void upload(Path local, String remotePath, Tally tally) {
        int code = remote.uploadFile(local, remotePath);
        if (code >= 200 && code < 300) {
            tally.succeeded++;
        } else {
            log.warn("Failed to upload {}: {}", local.getFileName(), code);
            tally.fail(local.getFileName() + " (" + code + ") -> " + remotePath);
        }
    }

    private RemotePaths remotePaths(String documentId, String folder) {
        String base = folder == null || folder.isBlank() ? properties.folder() : folder;
        String documentKey = store.mainFile(documentId).getParent().getFileName().toString();
        String documentDir = join(base, documentKey);
        return new RemotePaths(documentDir, join(documentDir, FileSystemPartialCacheStore.ANALYSIS_DIR));
    }

    private static String join(String parent, String child) {
        if (parent == null || parent.isEmpty()) {
            return child;
        }
        return parent.endsWith("/") ? parent + child : parent + "/" + child;
    }

    private record RemotePaths(String documentDir, String analysisDir) {}

    private static final class Tally {
        private int succeeded;
        private int failed;
        private final List<String> errors = new ArrayList<>();

        void fail(String error) {
            failed++;
            errors.add(error);
        }

        SyncReport report() {
            return new SyncReport(succeeded, failed, errors);
        }
    }
}
