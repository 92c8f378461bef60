package com.acme.fleetlink.message;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Capacity and readiness of a single Kubernetes node. */
public record ClusterNode(
    @JsonProperty("name") String name,
    @JsonProperty("cpu_milli_cores") long cpuMilliCores,
    @JsonProperty("memory_bytes") long memoryBytes,
    @JsonProperty("ephemeral_storage_bytes") long ephemeralStorageBytes,
    @JsonProperty("gpu_information") GpuInformation gpuInformation,
    @JsonProperty("status") String status,
    @JsonProperty("is_ready") boolean ready) {}
