package com.hanyahunya.sandbox.adapter.out.k8s;

import com.hanyahunya.sandbox.application.port.out.SandboxBackendPort;
import com.hanyahunya.sandbox.domain.exception.BackendUnavailableException;
import com.hanyahunya.sandbox.domain.exception.ProvisioningException;
import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.ContainerSpec;
import com.hanyahunya.sandbox.domain.model.ResourceLimits;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs each sandbox as a Pod exposed through a NodePort Service whose node port is the
 * sandbox's allocated port. The configured port range must lie inside the cluster's
 * node port range.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sandbox", name = "deployment", havingValue = "k8s")
public class KubernetesSandboxBackendAdapter implements SandboxBackendPort {

    static final String POD_LABEL = "sandbox.pod";
    static final String CONTAINER_NAME = "sandbox";
    static final String SERVICE_SUFFIX = "-service";
    private static final long POD_READY_TIMEOUT_SECONDS = 120;

    private final KubernetesClient client;
    private final String namespace;
    private final String fallbackHost;

    public KubernetesSandboxBackendAdapter(KubernetesClient client, SandboxManagerProperties properties) {
        this.client = client;
        this.namespace = properties.k8s().namespace();
        this.fallbackHost = properties.advertisedHost();
    }

    @Override
    public BackendHandle create(ContainerSpec spec) {
        String podName = spec.name();
        log.info("K8s: Creating Pod [Image: {}, Name: {}, NodePort: {}]", spec.image(), podName, spec.hostPort());

        try {
            client.pods().inNamespace(namespace).resource(buildPod(spec)).create();
            client.services().inNamespace(namespace).resource(buildService(spec)).create();

            // 노드 배치 + Running 까지 대기 (엔드포인트 IP 확정)
            Pod running = client.pods().inNamespace(namespace).withName(podName)
                    .waitUntilCondition(KubernetesSandboxBackendAdapter::isRunning, POD_READY_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            return new BackendHandle(podName, podName, resolveNodeIp(running));

        } catch (KubernetesClientException e) {
            cleanupQuietly(podName);
            throw translate("create pod " + podName, e);
        }
    }

    @Override
    public void start(BackendHandle handle) {
        // 파드는 생성 시 기동됨: 상태만 확인
        Pod pod = getPod(handle.name());
        String phase = pod == null || pod.getStatus() == null ? null : pod.getStatus().getPhase();
        if (!"Running".equals(phase) && !"Pending".equals(phase)) {
            throw new ProvisioningException("Pod " + handle.name() + " is not running (phase: " + phase + ")");
        }
    }

    @Override
    public void stop(BackendHandle handle) {
        try {
            client.pods().inNamespace(namespace).withName(handle.name()).delete();
        } catch (KubernetesClientException e) {
            throw translate("stop pod " + handle.name(), e);
        }
    }

    @Override
    public void destroy(BackendHandle handle) {
        try {
            client.services().inNamespace(namespace).withName(handle.name() + SERVICE_SUFFIX).delete();
            client.pods().inNamespace(namespace).withName(handle.name()).withGracePeriod(0).delete();
            log.info("K8s: Pod and Service removed: {}", handle.name());
        } catch (KubernetesClientException e) {
            throw translate("remove pod " + handle.name(), e);
        }
    }

    @Override
    public boolean isAlive(BackendHandle handle) {
        return isRunning(getPod(handle.name()));
    }

    private Pod getPod(String podName) {
        try {
            return client.pods().inNamespace(namespace).withName(podName).get();
        } catch (KubernetesClientException e) {
            throw translate("inspect pod " + podName, e);
        }
    }

    private Pod buildPod(ContainerSpec spec) {
        List<EnvVar> env = new ArrayList<>();
        spec.environment().forEach((k, v) -> env.add(new EnvVar(k, v, null)));

        List<Volume> volumes = new ArrayList<>();
        List<VolumeMount> mounts = new ArrayList<>();
        if (spec.workspaceDir() != null) {
            // 매니저 로컬 디렉토리는 노드에 없으므로 emptyDir
            volumes.add(new VolumeBuilder().withName("workspace").withNewEmptyDir().endEmptyDir().build());
            mounts.add(new VolumeMountBuilder().withName("workspace").withMountPath(ContainerSpec.WORKSPACE_MOUNT_PATH).build());
        }
        int index = 0;
        for (Map.Entry<String, String> mount : spec.readonlyMounts().entrySet()) {
            String volumeName = "readonly-" + index++;
            volumes.add(new VolumeBuilder().withName(volumeName).withNewHostPath().withPath(mount.getKey()).endHostPath().build());
            mounts.add(new VolumeMountBuilder().withName(volumeName).withMountPath(mount.getValue()).withReadOnly(true).build());
        }

        Map<String, String> labels = new HashMap<>(spec.labels());
        labels.put(POD_LABEL, spec.name());

        return new PodBuilder()
                .withNewMetadata()
                    .withName(spec.name())
                    .withNamespace(namespace)
                    .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                    .withRestartPolicy("Never")
                    .addNewContainer()
                        .withName(CONTAINER_NAME)
                        .withImage(spec.image())
                        .withImagePullPolicy("IfNotPresent")
                        .withEnv(env)
                        .addNewPort().withContainerPort(spec.containerPort()).withProtocol("TCP").endPort()
                        .withNewResources().withLimits(limits(spec.resourceLimits())).endResources()
                        .withNewSecurityContext().withPrivileged(spec.privileged()).endSecurityContext()
                        .withVolumeMounts(mounts)
                    .endContainer()
                    .withVolumes(volumes)
                .endSpec()
                .build();
    }

    private Service buildService(ContainerSpec spec) {
        return new ServiceBuilder()
                .withNewMetadata()
                    .withName(spec.name() + SERVICE_SUFFIX)
                    .withNamespace(namespace)
                    .withLabels(spec.labels())
                .endMetadata()
                .withNewSpec()
                    .withType("NodePort")
                    .addToSelector(POD_LABEL, spec.name())
                    .addNewPort()
                        .withName("http")
                        .withProtocol("TCP")
                        .withPort(spec.containerPort())
                        .withTargetPort(new IntOrString(spec.containerPort()))
                        .withNodePort(spec.hostPort())
                    .endPort()
                .endSpec()
                .build();
    }

    private Map<String, Quantity> limits(ResourceLimits resourceLimits) {
        Map<String, Quantity> limits = new HashMap<>();
        if (resourceLimits.memoryMb() != null) limits.put("memory", new Quantity(resourceLimits.memoryMb() + "Mi"));
        if (resourceLimits.cpus() != null) limits.put("cpu", new Quantity(String.valueOf(resourceLimits.cpus())));
        return limits;
    }

    // ExternalIP 우선, 없으면 InternalIP
    private String resolveNodeIp(Pod pod) {
        String nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
        if (nodeName == null) return fallbackHost;

        Node node = client.nodes().withName(nodeName).get();
        if (node == null || node.getStatus() == null || node.getStatus().getAddresses() == null) {
            return fallbackHost;
        }
        List<NodeAddress> addresses = node.getStatus().getAddresses();
        return findAddress(addresses, "ExternalIP")
                .or(() -> findAddress(addresses, "InternalIP"))
                .orElse(fallbackHost);
    }

    private Optional<String> findAddress(List<NodeAddress> addresses, String type) {
        return addresses.stream()
                .filter(address -> type.equals(address.getType()))
                .map(NodeAddress::getAddress)
                .findFirst();
    }

    private void cleanupQuietly(String podName) {
        try {
            client.services().inNamespace(namespace).withName(podName + SERVICE_SUFFIX).delete();
            client.pods().inNamespace(namespace).withName(podName).withGracePeriod(0).delete();
        } catch (KubernetesClientException e) {
            log.warn("K8s: Failed to clean up after failed creation of {}: {}", podName, e.getMessage());
        }
    }

    static boolean isRunning(Pod pod) {
        return pod != null && pod.getStatus() != null && "Running".equals(pod.getStatus().getPhase());
    }

    static RuntimeException translate(String action, KubernetesClientException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return new BackendUnavailableException("Kubernetes API unreachable while trying to " + action, e);
            }
        }
        return new ProvisioningException("Kubernetes failed to " + action + ": " + e.getMessage(), e);
    }
}
