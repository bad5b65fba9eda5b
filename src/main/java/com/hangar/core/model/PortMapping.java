package com.hangar.core.model;

public record PortMapping(int hostPort, int containerPort) {}
