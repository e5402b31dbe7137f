package com.hanyahunya.sandbox.adapter.out.storage;

import com.hanyahunya.sandbox.application.port.out.WorkspaceStoragePort;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "sandbox.storage", name = "type", havingValue = "s3")
public class S3WorkspaceStorageAdapter implements WorkspaceStoragePort {

    private final S3Client s3Client;
    private final String bucketName;

    public S3WorkspaceStorageAdapter(S3Client s3Client, SandboxManagerProperties properties) {
        this.s3Client = s3Client;
        this.bucketName = properties.storage().s3().bucket();
    }

    @Override
    public void downloadFolder(String storagePath, Path destinationDir) {
        String prefix = storagePath.endsWith("/") ? storagePath : storagePath + "/";
        log.info("S3 Download Start: s3://{}/{} -> {}", bucketName, prefix, destinationDir);

        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .build();

        int count = 0;
        try {
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                String relative = object.key().substring(prefix.length());
                if (relative.isEmpty()) continue;

                Path target = resolveInside(destinationDir, relative);
                if (object.key().endsWith("/")) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());

                GetObjectRequest get = GetObjectRequest.builder()
                        .bucket(bucketName)
                        .key(object.key())
                        .build();
                try (ResponseInputStream<GetObjectResponse> s3Stream = s3Client.getObject(get)) {
                    Files.copy(s3Stream, target, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("S3 download failed: s3://" + bucketName + "/" + prefix, e);
        }
        log.info("S3 Download Success: {} files", count);
    }

    @Override
    public void uploadFolder(Path sourceDir, String storagePath) {
        if (!Files.isDirectory(sourceDir)) return;

        int uploaded = 0;
        int skipped = 0;
        try (Stream<Path> paths = Files.walk(sourceDir)) {
            for (Path path : (Iterable<Path>) paths.filter(Files::isRegularFile)::iterator) {
                String relative = sourceDir.relativize(path).toString().replace('\\', '/');
                String key = pathJoin(storagePath, relative);

                // ETag(MD5)가 같으면 업로드 생략
                if (md5Hex(path).equals(remoteEtag(key))) {
                    skipped++;
                    continue;
                }
                s3Client.putObject(PutObjectRequest.builder().bucket(bucketName).key(key).build(),
                        RequestBody.fromFile(path));
                uploaded++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("S3 upload failed: " + sourceDir, e);
        }
        log.info("S3 Upload: {} -> s3://{}/{} (uploaded={}, unchanged={})", sourceDir, bucketName, storagePath, uploaded, skipped);
    }

    @Override
    public String pathJoin(String... parts) {
        return Arrays.stream(parts)
                .filter(part -> part != null && !part.isEmpty())
                .map(part -> part.replaceAll("^/+|/+$", ""))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("/"));
    }

    private String remoteEtag(String key) {
        try {
            String etag = s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build()).eTag();
            return etag == null ? null : etag.replace("\"", "");
        } catch (NoSuchKeyException e) {
            return null;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return null;
            throw e;
        }
    }

    private static String md5Hex(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] buffer = new byte[8192];
            int len;
            while ((len = in.read(buffer)) > 0) {
                digest.update(buffer, 0, len);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    // 경로 탈출(Zip Slip 유형) 방지
    private static Path resolveInside(Path destinationDir, String relative) throws IOException {
        Path base = destinationDir.toAbsolutePath().normalize();
        Path target = base.resolve(relative).normalize();
        if (!target.startsWith(base)) {
            throw new IOException("Object is outside of the target dir: " + relative);
        }
        return target;
    }
}
