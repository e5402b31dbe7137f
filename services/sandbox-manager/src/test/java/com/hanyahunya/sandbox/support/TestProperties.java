package com.hanyahunya.sandbox.support;

import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Builder for {@link SandboxManagerProperties} with test-friendly defaults:
 * no workspace mounts, no host port probing, a small port range.
 */
public final class TestProperties {

    private String defaultType = "base";
    private List<String> poolTypes = List.of("base");
    private int poolSize = 0;
    private Map<String, Integer> poolSizes = Map.of();
    private boolean autoCleanup = true;
    private String defaultMountDir = "";
    private String storageFolder = "";
    private int portLow = 49152;
    private int portHigh = 49160;
    private String bearerToken = "";
    private Duration maxIdle = Duration.ofMinutes(30);
    private Duration shutdownGrace = Duration.ofSeconds(5);
    private int fillRetryLimit = 3;
    private boolean redisEnabled = false;
    private int workers = 1;

    public static TestProperties builder() {
        return new TestProperties();
    }

    public TestProperties defaultType(String defaultType) { this.defaultType = defaultType; return this; }
    public TestProperties poolTypes(List<String> poolTypes) { this.poolTypes = poolTypes; return this; }
    public TestProperties poolSize(int poolSize) { this.poolSize = poolSize; return this; }
    public TestProperties poolSizes(Map<String, Integer> poolSizes) { this.poolSizes = poolSizes; return this; }
    public TestProperties autoCleanup(boolean autoCleanup) { this.autoCleanup = autoCleanup; return this; }
    public TestProperties defaultMountDir(String defaultMountDir) { this.defaultMountDir = defaultMountDir; return this; }
    public TestProperties storageFolder(String storageFolder) { this.storageFolder = storageFolder; return this; }
    public TestProperties portRange(int low, int high) { this.portLow = low; this.portHigh = high; return this; }
    public TestProperties bearerToken(String bearerToken) { this.bearerToken = bearerToken; return this; }
    public TestProperties maxIdle(Duration maxIdle) { this.maxIdle = maxIdle; return this; }
    public TestProperties shutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; return this; }
    public TestProperties fillRetryLimit(int fillRetryLimit) { this.fillRetryLimit = fillRetryLimit; return this; }
    public TestProperties redisEnabled(boolean redisEnabled) { this.redisEnabled = redisEnabled; return this; }
    public TestProperties workers(int workers) { this.workers = workers; return this; }

    public SandboxManagerProperties build() {
        return new SandboxManagerProperties(
                workers,
                defaultType,
                poolTypes,
                poolSize,
                poolSizes,
                autoCleanup,
                "sandbox-",
                SandboxManagerProperties.Deployment.DOCKER,
                defaultMountDir,
                storageFolder,
                Map.of(),
                new SandboxManagerProperties.PortRange(portLow, portHigh),
                false,
                "localhost",
                80,
                bearerToken,
                maxIdle,
                shutdownGrace,
                fillRetryLimit,
                null,
                new SandboxManagerProperties.Redis(redisEnabled, "test"),
                null,
                null,
                List.of()
        );
    }
}
