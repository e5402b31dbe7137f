package com.hanyahunya.sandbox.adapter.out.storage;

import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.pagination.sync.SdkIterable;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3WorkspaceStorageAdapterTest {

    private S3Client s3Client;
    private S3WorkspaceStorageAdapter adapter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        var properties = new SandboxManagerProperties(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null,
                new SandboxManagerProperties.Storage(SandboxManagerProperties.StorageType.S3,
                        new SandboxManagerProperties.S3(null, null, "workspaces", null, null)),
                null, null);
        adapter = new S3WorkspaceStorageAdapter(s3Client, properties);
    }

    @Test
    void downloadWritesObjectsUnderDestination() throws IOException {
        mockListing("sessions/abc/", "sessions/abc/", "sessions/abc/dir/", "sessions/abc/dir/file.txt");
        when(s3Client.getObject(any(GetObjectRequest.class))).thenAnswer(invocation -> content("hello"));

        Path destination = tempDir.resolve("ws");
        adapter.downloadFolder("sessions/abc", destination);

        assertEquals("hello", Files.readString(destination.resolve("dir/file.txt")));
        var captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(captor.capture());
        assertEquals("workspaces", captor.getValue().bucket());
        assertEquals("sessions/abc/dir/file.txt", captor.getValue().key());
    }

    @Test
    void downloadRejectsKeysEscapingDestination() {
        mockListing("sessions/abc/", "sessions/abc/../../evil.txt");

        assertThrows(UncheckedIOException.class, () -> adapter.downloadFolder("sessions/abc/", tempDir.resolve("ws")));
        verify(s3Client, never()).getObject(any(GetObjectRequest.class));
    }

    @Test
    void uploadSkipsFilesWhoseEtagMatches() throws Exception {
        Path source = tempDir.resolve("ws");
        Files.createDirectories(source.resolve("sub"));
        Files.writeString(source.resolve("same.txt"), "unchanged");
        Files.writeString(source.resolve("sub/new.txt"), "fresh");

        // md5("unchanged")
        String md5 = HexFormat.of().formatHex(
                MessageDigest.getInstance("MD5").digest("unchanged".getBytes(StandardCharsets.UTF_8)));
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenAnswer(invocation -> {
            HeadObjectRequest request = invocation.getArgument(0);
            if (request.key().equals("sessions/abc/same.txt")) {
                return HeadObjectResponse.builder().eTag("\"" + md5 + "\"").build();
            }
            throw NoSuchKeyException.builder().message("missing").build();
        });

        adapter.uploadFolder(source, "sessions/abc");

        var captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client, times(1)).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("sessions/abc/sub/new.txt", captor.getValue().key());
    }

    @Test
    void uploadOfMissingFolderIsNoop() {
        adapter.uploadFolder(tempDir.resolve("absent"), "sessions/abc");

        verifyNoInteractions(s3Client);
    }

    @Test
    void pathJoinNormalizesSlashes() {
        assertEquals("sessions/abc/file.txt", adapter.pathJoin("/sessions/", "", "abc/", "file.txt"));
        assertEquals("abc", adapter.pathJoin("", "abc"));
    }

    private void mockListing(String prefix, String... keys) {
        var iterable = mock(ListObjectsV2Iterable.class);
        List<S3Object> objects = Arrays.stream(keys)
                .map(key -> S3Object.builder().key(key).build())
                .toList();
        SdkIterable<S3Object> contents = objects::iterator;
        when(iterable.contents()).thenReturn(contents);
        when(s3Client.listObjectsV2Paginator(ListObjectsV2Request.builder().bucket("workspaces").prefix(prefix).build()))
                .thenReturn(iterable);
    }

    private static ResponseInputStream<GetObjectResponse> content(String text) {
        return new ResponseInputStream<>(GetObjectResponse.builder().build(),
                AbortableInputStream.create(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8))));
    }
}
