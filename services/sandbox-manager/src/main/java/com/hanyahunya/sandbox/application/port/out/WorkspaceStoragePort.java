package com.hanyahunya.sandbox.application.port.out;

import java.nio.file.Path;

public interface WorkspaceStoragePort {

    // 저장소 -> 로컬 마운트 디렉토리 (원본이 없으면 no-op)
    void downloadFolder(String storagePath, Path destinationDir);

    // 로컬 마운트 디렉토리 -> 저장소
    void uploadFolder(Path sourceDir, String storagePath);

    String pathJoin(String... parts);
}
