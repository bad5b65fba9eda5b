package com.hangar.core.model;

/**
 * Result of creating a project container.
 */
public record ContainerHandle(String containerId, String containerName, int port) {}
