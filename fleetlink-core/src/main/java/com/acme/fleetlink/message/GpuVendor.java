package com.acme.fleetlink.message;

public enum GpuVendor {
  NVIDIA,
  AMD
}
