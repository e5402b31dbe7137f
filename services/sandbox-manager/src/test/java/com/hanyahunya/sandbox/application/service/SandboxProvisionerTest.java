package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.adapter.out.memory.InMemorySharedStateAdapter;
import com.hanyahunya.sandbox.adapter.out.storage.LocalWorkspaceStorageAdapter;
import com.hanyahunya.sandbox.application.port.out.SandboxBackendPort;
import com.hanyahunya.sandbox.domain.exception.BackendUnavailableException;
import com.hanyahunya.sandbox.domain.exception.ProvisioningException;
import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.ContainerSpec;
import com.hanyahunya.sandbox.domain.model.ContainerSpecFactory;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import com.hanyahunya.sandbox.domain.model.SandboxInstance;
import com.hanyahunya.sandbox.domain.model.SandboxState;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.domain.model.SecurityLevel;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import com.hanyahunya.sandbox.support.FakeSandboxBackend;
import com.hanyahunya.sandbox.support.MutableClock;
import com.hanyahunya.sandbox.support.SandboxFixture;
import com.hanyahunya.sandbox.support.TestProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SandboxProvisionerTest {

    private static final SandboxType BASE = SandboxType.of("base", SandboxFixture.BASE_IMAGE,
            SecurityLevel.MEDIUM, Duration.ofSeconds(30), "base");

    @TempDir
    Path tempDir;

    @Test
    void provisionedContainerCarriesTokenPortAndLabels() {
        var fixture = SandboxFixture.create(TestProperties.builder());

        SandboxInstance instance = fixture.provisioner.provision(BASE);

        ContainerSpec spec = fixture.backend.created().get(0);
        assertEquals("sandbox-" + instance.getId(), spec.name());
        assertEquals(SandboxFixture.BASE_IMAGE, spec.image());
        assertEquals(instance.getPort(), spec.hostPort());
        assertEquals(80, spec.containerPort());
        assertEquals(instance.getBearerToken(), spec.environment().get(ContainerSpecFactory.TOKEN_ENV));
        assertTrue(instance.getBearerToken().matches("[0-9a-f]{32}"));
        assertEquals(instance.getId(), spec.labels().get(SandboxProvisioner.LABEL_SANDBOX_ID));
        assertEquals("base", spec.labels().get(SandboxProvisioner.LABEL_SANDBOX_TYPE));
        assertEquals(SandboxFixture.NODE_ID, spec.labels().get(SandboxProvisioner.LABEL_OWNER_NODE));
        assertNull(spec.workspaceDir(), "workspace mounts are disabled");

        assertEquals(SandboxState.WARM, instance.getState());
        assertEquals("http://localhost:" + instance.getPort(), instance.getBaseUrl());
        var record = fixture.sharedState.findInstance(instance.getId()).orElseThrow();
        assertEquals(SandboxFixture.NODE_ID, record.ownerNodeId());
        assertEquals(0L, record.expiresAt());
    }

    @Test
    void tokensAreUniquePerInstance() {
        var fixture = SandboxFixture.create(TestProperties.builder());

        var first = fixture.provisioner.provision(BASE);
        var second = fixture.provisioner.provision(BASE);

        assertNotEquals(first.getBearerToken(), second.getBearerToken());
        assertNotEquals(first.getPort(), second.getPort());
    }

    @Test
    void workspaceIsMountedAndArchivedOnDestroy() throws IOException {
        Path mounts = tempDir.resolve("mounts");
        Path storage = tempDir.resolve("storage");
        var fixture = SandboxFixture.create(TestProperties.builder()
                .defaultMountDir(mounts.toString())
                .storageFolder(storage.toString()));

        SandboxInstance instance = fixture.provisioner.provision(BASE);
        Path workspace = Path.of(instance.getWorkspaceDir());
        assertTrue(Files.isDirectory(workspace));
        assertEquals(workspace.toString(), fixture.backend.created().get(0).workspaceDir());

        Files.writeString(workspace.resolve("notes.txt"), "hello");
        assertTrue(fixture.provisioner.destroy(instance));

        assertFalse(Files.exists(workspace));
        assertEquals("hello", Files.readString(storage.resolve(instance.getId()).resolve("notes.txt")));
        assertTrue(fixture.sharedState.reservedPorts().isEmpty());
        assertTrue(fixture.sharedState.findInstance(instance.getId()).isEmpty());
    }

    @Test
    void resetForReuseWipesWorkspaceButKeepsDirectory() throws IOException {
        Path mounts = tempDir.resolve("mounts");
        Path storage = tempDir.resolve("storage");
        var fixture = SandboxFixture.create(TestProperties.builder()
                .defaultMountDir(mounts.toString())
                .storageFolder(storage.toString()));
        SandboxInstance instance = fixture.provisioner.provision(BASE);
        Path workspace = Path.of(instance.getWorkspaceDir());
        Files.createDirectories(workspace.resolve("sub"));
        Files.writeString(workspace.resolve("sub/data.txt"), "x");

        assertTrue(fixture.provisioner.resetForReuse(instance));

        assertTrue(Files.isDirectory(workspace));
        try (Stream<Path> children = Files.list(workspace)) {
            assertEquals(0, children.count());
        }
        assertTrue(Files.exists(storage.resolve(instance.getId()).resolve("sub/data.txt")));
    }

    @Test
    void resetForReuseFailsWhenContainerDied() {
        var fixture = SandboxFixture.create(TestProperties.builder());
        SandboxInstance instance = fixture.provisioner.provision(BASE);
        fixture.backend.kill(instance.getBackendHandle().id());

        assertFalse(fixture.provisioner.resetForReuse(instance));
    }

    @Test
    void failedCreateRollsBackPortAndWorkspace() throws IOException {
        Path mounts = tempDir.resolve("mounts");
        var fixture = SandboxFixture.create(TestProperties.builder().defaultMountDir(mounts.toString()));
        fixture.backend.failCreates(true);

        assertThrows(ProvisioningException.class, () -> fixture.provisioner.provision(BASE));

        assertTrue(fixture.sharedState.reservedPorts().isEmpty());
        assertTrue(fixture.sharedState.listInstances().isEmpty());
        try (Stream<Path> children = Files.list(mounts)) {
            assertEquals(0, children.count());
        }
    }

    @Test
    void containerNotRunningAfterStartIsDestroyed() {
        SandboxManagerProperties properties = TestProperties.builder().build();
        var sharedState = new InMemorySharedStateAdapter(new MutableClock(Instant.EPOCH));
        SandboxBackendPort backend = mock(SandboxBackendPort.class);
        var handle = new BackendHandle("cid-1", "sandbox-1", "localhost");
        when(backend.create(any())).thenReturn(handle);
        when(backend.isAlive(handle)).thenReturn(false);
        var provisioner = new SandboxProvisioner(backend, new PortAllocator(sharedState, properties), sharedState,
                new LocalWorkspaceStorageAdapter(), properties, new NodeIdentity("n1"), new MutableClock(Instant.EPOCH));

        assertThrows(ProvisioningException.class, () -> provisioner.provision(BASE));

        verify(backend).destroy(handle);
        assertTrue(sharedState.reservedPorts().isEmpty());
    }

    @Test
    void unexpectedBackendErrorIsWrappedAndBusinessErrorsPassThrough() {
        SandboxManagerProperties properties = TestProperties.builder().build();
        var sharedState = new InMemorySharedStateAdapter(new MutableClock(Instant.EPOCH));
        SandboxBackendPort backend = mock(SandboxBackendPort.class);
        var provisioner = new SandboxProvisioner(backend, new PortAllocator(sharedState, properties), sharedState,
                new LocalWorkspaceStorageAdapter(), properties, new NodeIdentity("n1"), new MutableClock(Instant.EPOCH));

        when(backend.create(any())).thenThrow(new IllegalStateException("boom"));
        var wrapped = assertThrows(ProvisioningException.class, () -> provisioner.provision(BASE));
        assertInstanceOf(IllegalStateException.class, wrapped.getCause());

        reset(backend);
        when(backend.create(any())).thenThrow(new BackendUnavailableException("docker is down", null));
        assertThrows(BackendUnavailableException.class, () -> provisioner.provision(BASE));
        assertTrue(sharedState.reservedPorts().isEmpty());
    }

    @Test
    void destroyIsIdempotent() {
        var fixture = SandboxFixture.create(TestProperties.builder());
        SandboxInstance instance = fixture.provisioner.provision(BASE);

        assertTrue(fixture.provisioner.destroy(instance));
        assertTrue(fixture.provisioner.destroy(instance));

        assertEquals(SandboxState.DESTROYED, instance.getState());
        assertTrue(fixture.backend.wasDestroyed(instance.getBackendHandle().id()));
    }

    @Test
    void destroyRecordTearsDownOnlyOnce() {
        var fixture = SandboxFixture.create(TestProperties.builder());
        SandboxInstance instance = fixture.provisioner.provision(BASE);
        var record = fixture.sharedState.findInstance(instance.getId()).orElseThrow();
        var peer = fixture.peer("node-peer");

        assertTrue(peer.provisioner.destroyRecord(record));
        assertFalse(fixture.provisioner.destroyRecord(record));

        assertEquals(0, fixture.backend.runningCount());
        assertTrue(fixture.sharedState.reservedPorts().isEmpty());
    }

    @Test
    void destroyAfterPeerTeardownLeavesThePortToItsNewHolder() {
        var fixture = SandboxFixture.create(TestProperties.builder().portRange(49152, 49152));
        var peer = fixture.peer("node-peer");
        SandboxInstance instance = fixture.provisioner.provision(BASE);
        assertTrue(peer.provisioner.destroyRecord(fixture.sharedState.findInstance(instance.getId()).orElseThrow()));
        SandboxInstance next = peer.provisioner.provision(BASE);

        assertTrue(fixture.provisioner.destroy(instance));

        assertEquals(SandboxState.DESTROYED, instance.getState());
        assertEquals(Set.of(next.getPort()), fixture.sharedState.reservedPorts());
        assertTrue(fixture.backend.isAlive(next.getBackendHandle()));
        assertTrue(fixture.sharedState.findInstance(next.getId()).isPresent());
    }

    @Test
    void backendStopFailureStillDestroysAndReleasesPort() {
        SandboxManagerProperties properties = TestProperties.builder().build();
        var sharedState = new InMemorySharedStateAdapter(new MutableClock(Instant.EPOCH));
        FakeSandboxBackend fake = new FakeSandboxBackend();
        SandboxBackendPort backend = spy(fake);
        doThrow(new IllegalStateException("stop failed")).when(backend).stop(any());
        var provisioner = new SandboxProvisioner(backend, new PortAllocator(sharedState, properties), sharedState,
                new LocalWorkspaceStorageAdapter(), properties, new NodeIdentity("n1"), new MutableClock(Instant.EPOCH));
        SandboxInstance instance = provisioner.provision(BASE);

        assertFalse(provisioner.destroy(instance));

        verify(backend).destroy(instance.getBackendHandle());
        assertTrue(sharedState.reservedPorts().isEmpty());
    }
}
