package com.hanyahunya.sandbox.adapter.out.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import com.hanyahunya.sandbox.application.port.out.SandboxBackendPort;
import com.hanyahunya.sandbox.domain.exception.BackendUnavailableException;
import com.hanyahunya.sandbox.domain.exception.ProvisioningException;
import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.ContainerSpec;
import com.hanyahunya.sandbox.domain.model.ResourceLimits;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "sandbox", name = "deployment", havingValue = "docker", matchIfMissing = true)
public class DockerSandboxBackendAdapter implements SandboxBackendPort {

    private static final long PULL_TIMEOUT_MINUTES = 10;

    private final DockerClient dockerClient;
    private final String advertisedHost;

    public DockerSandboxBackendAdapter(DockerClient dockerClient, SandboxManagerProperties properties) {
        this.dockerClient = dockerClient;
        this.advertisedHost = properties.advertisedHost();
    }

    @Override
    public BackendHandle create(ContainerSpec spec) {
        log.info("Docker: Creating Container [Image: {}, Name: {}, Port: {}]", spec.image(), spec.name(), spec.hostPort());

        try {
            ensureImage(spec.image());
            // 같은 이름의 잔여 컨테이너 정리
            removeContainerIfExists(spec.name());

            List<String> envList = new ArrayList<>();
            spec.environment().forEach((k, v) -> envList.add(k + "=" + v));

            ExposedPort exposedPort = ExposedPort.tcp(spec.containerPort());
            Ports portBindings = new Ports();
            portBindings.bind(exposedPort, Ports.Binding.bindPort(spec.hostPort()));

            CreateContainerResponse container = dockerClient.createContainerCmd(spec.image())
                    .withName(spec.name())
                    .withEnv(envList)
                    .withLabels(spec.labels())
                    .withExposedPorts(exposedPort)
                    .withHostConfig(hostConfig(spec, portBindings))
                    .exec();

            return new BackendHandle(container.getId(), spec.name(), advertisedHost);

        } catch (DockerException e) {
            throw new ProvisioningException("Failed to create container " + spec.name() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw translate("create container " + spec.name(), e);
        }
    }

    @Override
    public void start(BackendHandle handle) {
        try {
            dockerClient.startContainerCmd(handle.id()).exec();
        } catch (NotModifiedException e) {
            log.debug("Container already running: {}", handle.name());
        } catch (DockerException e) {
            throw new ProvisioningException("Failed to start container " + handle.name() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw translate("start container " + handle.name(), e);
        }
    }

    @Override
    public void stop(BackendHandle handle) {
        try {
            dockerClient.stopContainerCmd(handle.id()).withTimeout(1).exec();
        } catch (NotModifiedException | NotFoundException e) {
            log.debug("Container already stopped or gone: {}", handle.name());
        } catch (RuntimeException e) {
            throw translate("stop container " + handle.name(), e);
        }
    }

    @Override
    public void destroy(BackendHandle handle) {
        try {
            dockerClient.removeContainerCmd(handle.id()).withForce(true).withRemoveVolumes(true).exec();
            log.info("Docker Container Removed: {}", handle.name());
        } catch (NotFoundException e) {
            log.debug("Container already removed: {}", handle.name());
        } catch (RuntimeException e) {
            throw translate("remove container " + handle.name(), e);
        }
    }

    @Override
    public boolean isAlive(BackendHandle handle) {
        try {
            InspectContainerResponse response = dockerClient.inspectContainerCmd(handle.id()).exec();
            return response.getState() != null && Boolean.TRUE.equals(response.getState().getRunning());
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            throw translate("inspect container " + handle.name(), e);
        }
    }

    private HostConfig hostConfig(ContainerSpec spec, Ports portBindings) {
        List<Bind> binds = new ArrayList<>();
        if (spec.workspaceDir() != null) {
            binds.add(Bind.parse(spec.workspaceDir() + ":" + ContainerSpec.WORKSPACE_MOUNT_PATH + ":rw"));
        }
        spec.readonlyMounts().forEach((hostPath, containerPath) ->
                binds.add(Bind.parse(hostPath + ":" + containerPath + ":ro")));

        HostConfig hostConfig = HostConfig.newHostConfig()
                .withPortBindings(portBindings)
                .withBinds(binds)
                .withPrivileged(spec.privileged());

        ResourceLimits limits = spec.resourceLimits();
        if (limits.memoryBytes() != null) hostConfig.withMemory(limits.memoryBytes());
        if (limits.nanoCpus() != null) hostConfig.withNanoCPUs(limits.nanoCpus());
        if (limits.shmSizeBytes() != null) hostConfig.withShmSize(limits.shmSizeBytes());
        return hostConfig;
    }

    // 이미지가 로컬에 없으면 pull
    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Docker: Pulling image {}", image);
        }

        int slash = image.lastIndexOf('/');
        int colon = image.lastIndexOf(':');
        String repository = colon > slash ? image.substring(0, colon) : image;
        String tag = colon > slash ? image.substring(colon + 1) : "latest";

        try {
            boolean completed = dockerClient.pullImageCmd(repository)
                    .withTag(tag)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!completed) {
                throw new ProvisioningException("Timed out pulling image " + image);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while pulling image " + image, e);
        }
    }

    private void removeContainerIfExists(String containerName) {
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.warn("Docker: Removed stale container with the same name: {}", containerName);
        } catch (NotFoundException e) {
            log.debug("Docker: No stale container named {}", containerName);
        }
    }

    // 데몬 연결 실패(IOException 계열)는 BackendUnavailable, 나머지는 Provisioning 실패
    static RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof ProvisioningException || e instanceof BackendUnavailableException) {
            return e;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException || cause instanceof UncheckedIOException) {
                return new BackendUnavailableException("Docker daemon unreachable while trying to " + action, e);
            }
        }
        return new ProvisioningException("Docker failed to " + action + ": " + e.getMessage(), e);
    }
}
