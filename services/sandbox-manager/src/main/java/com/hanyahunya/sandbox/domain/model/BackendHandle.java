package com.hanyahunya.sandbox.domain.model;

/**
 * Substrate-specific reference to a running sandbox.
 *
 * @param id           container id (docker) or pod name (k8s)
 * @param name         container / pod name
 * @param endpointHost host callers use to reach the sandbox's published port
 */
public record BackendHandle(
        String id,
        String name,
        String endpointHost
) {}
