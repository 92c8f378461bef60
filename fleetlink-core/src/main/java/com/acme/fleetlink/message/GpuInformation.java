package com.acme.fleetlink.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GpuInformation(
    @JsonProperty("count") int count,
    @JsonProperty("type") String type,
    @JsonProperty("vendor") GpuVendor vendor,
    @JsonProperty("vram_bytes_per_device") long vramBytesPerDevice,
    @JsonProperty("product_name") String productName) {}
