package io.statusmvp.gasrouter.model;

public enum CongestionLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
