package com.hanyahunya.sandbox.infra.config;

import com.hanyahunya.sandbox.domain.model.SecurityLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "sandbox")
public record SandboxManagerProperties(
        Integer workers,
        String defaultType,
        List<String> poolTypes,
        Integer poolSize,
        Map<String, Integer> poolSizes,
        Boolean autoCleanup,
        String containerPrefix,
        Deployment deployment,
        String defaultMountDir,
        String storageFolder,
        Map<String, String> readonlyMounts,
        PortRange portRange,
        Boolean checkHostPorts,
        String advertisedHost,
        Integer containerPort,
        String bearerToken,
        Duration maxIdle,
        Duration shutdownGrace,
        Integer fillRetryLimit,
        Image image,
        Redis redis,
        Storage storage,
        K8s k8s,
        List<CustomType> customTypes
) {
    public SandboxManagerProperties {
        workers = workers == null ? 1 : workers;
        defaultType = defaultType == null ? "base" : defaultType;
        poolTypes = poolTypes == null ? List.of(defaultType) : List.copyOf(poolTypes);
        poolSize = poolSize == null ? 1 : poolSize;
        poolSizes = poolSizes == null ? Map.of() : Map.copyOf(poolSizes);
        autoCleanup = autoCleanup == null ? Boolean.TRUE : autoCleanup;
        containerPrefix = containerPrefix == null ? "sandbox-" : containerPrefix;
        deployment = deployment == null ? Deployment.DOCKER : deployment;
        // "" 이면 워크스페이스 마운트 비활성화
        defaultMountDir = defaultMountDir == null ? "sessions_mount_dir" : defaultMountDir;
        storageFolder = storageFolder == null ? "" : storageFolder;
        readonlyMounts = readonlyMounts == null ? Map.of() : Map.copyOf(readonlyMounts);
        portRange = portRange == null ? new PortRange(49152, 59152) : portRange;
        checkHostPorts = checkHostPorts == null ? Boolean.TRUE : checkHostPorts;
        advertisedHost = advertisedHost == null ? "localhost" : advertisedHost;
        containerPort = containerPort == null ? 80 : containerPort;
        bearerToken = bearerToken == null ? "" : bearerToken;
        maxIdle = maxIdle == null ? Duration.ofMinutes(30) : maxIdle;
        shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
        fillRetryLimit = fillRetryLimit == null ? 3 : fillRetryLimit;
        image = image == null ? new Image(null, null, null) : image;
        redis = redis == null ? new Redis(null, null) : redis;
        storage = storage == null ? new Storage(null, null) : storage;
        k8s = k8s == null ? new K8s(null, null) : k8s;
        customTypes = customTypes == null ? List.of() : List.copyOf(customTypes);
    }

    // Redis 없이 여러 워커는 포트 충돌 -> 1로 강제
    public int effectiveWorkers() {
        return redis.enabled() ? workers : Math.min(workers, 1);
    }

    /**
     * Warm pool capacity for a type: an explicit {@code pool-sizes} entry wins,
     * otherwise {@code pool-size} for types listed in {@code pool-types}, otherwise zero.
     */
    public int poolSizeFor(String type) {
        Integer explicit = poolSizes.get(type);
        if (explicit != null) return Math.max(explicit, 0);
        return poolTypes.contains(type) ? Math.max(poolSize, 0) : 0;
    }

    public Set<String> pooledTypes() {
        Set<String> types = new HashSet<>(poolTypes);
        types.addAll(poolSizes.keySet());
        types.removeIf(type -> poolSizeFor(type) <= 0);
        return types;
    }

    public boolean workspaceEnabled() {
        return !defaultMountDir.isBlank();
    }

    public enum Deployment {
        DOCKER, K8S
    }

    public enum StorageType {
        LOCAL, S3
    }

    public record PortRange(int low, int high) {
        public PortRange {
            if (low <= 0 || high > 65535 || low > high) {
                throw new IllegalArgumentException("Invalid port range [" + low + ", " + high + "]");
            }
        }

        public int size() {
            return high - low + 1;
        }
    }

    public record Image(String registry, String namespace, String tag) {
        public Image {
            registry = registry == null ? "" : registry;
            namespace = namespace == null ? "agentscope" : namespace;
            tag = tag == null ? "latest" : tag;
        }

        // {registry/}{namespace}/runtime-sandbox-{type}:{tag}
        public String referenceFor(String type) {
            String repository = namespace + "/runtime-sandbox-" + type;
            if (!registry.isBlank()) {
                repository = registry.replaceAll("/+$", "") + "/" + repository;
            }
            return repository + ":" + tag;
        }
    }

    public record Redis(Boolean enabled, String namespace) {
        public Redis {
            enabled = enabled != null && enabled;
            namespace = namespace == null ? "sandbox" : namespace;
        }
    }

    public record Storage(StorageType type, S3 s3) {
        public Storage {
            type = type == null ? StorageType.LOCAL : type;
            s3 = s3 == null ? new S3(null, null, null, null, null) : s3;
        }
    }

    public record S3(String endpoint, String region, String bucket, String accessKeyId, String secretAccessKey) {
        public S3 {
            region = region == null ? "us-east-1" : region;
        }
    }

    public record K8s(String namespace, String kubeconfigPath) {
        public K8s {
            namespace = namespace == null ? "default" : namespace;
        }
    }

    public record CustomType(
            String name,
            String image,
            SecurityLevel securityLevel,
            Duration timeout,
            Map<String, String> environment,
            String description,
            Long memoryMb,
            Double cpus,
            Boolean privileged
    ) {}
}
