package com.hanyahunya.sandbox.domain.model;

/**
 * Container resource limits. A {@code null} component means "no limit".
 */
public record ResourceLimits(
        Long memoryMb,
        Double cpus,
        Long shmSizeMb
) {
    public static final ResourceLimits NONE = new ResourceLimits(null, null, null);

    public Long memoryBytes() {
        return memoryMb == null ? null : memoryMb * 1024 * 1024L;
    }

    public Long nanoCpus() {
        return cpus == null ? null : (long) (cpus * 1_000_000_000L);
    }

    public Long shmSizeBytes() {
        return shmSizeMb == null ? null : shmSizeMb * 1024 * 1024L;
    }
}
