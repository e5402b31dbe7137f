package com.hanyahunya.sandbox.domain.model;

/**
 * Identity of this worker process within a deployment.
 */
public record NodeIdentity(String nodeId) {}
