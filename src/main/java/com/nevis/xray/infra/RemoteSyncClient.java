package com.nevis.xray.infra;

import java.nio.file.Path;
import java.util.List;

/**
 * Minimal file-moving contract used to share cache files between devices.
 * Implementations never interpret file contents.
 */
public interface RemoteSyncClient {

    List<RemoteFile> listRemoteFiles(String folder);

    /**
     * @return HTTP-style status code, 2xx on success
     */
    int uploadFile(Path local, String remotePath);

    /**
     * @return HTTP-style status code, 200 on success and 404 when the remote file is missing
     */
    int downloadFile(String remotePath, Path local);
}
