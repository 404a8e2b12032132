package com.example.dmpipeline.service;

public enum AdmissionResult {
  ENQUEUED("enqueued"),
  DUPLICATE_IN_FLIGHT("duplicate"),
  DUPLICATE_RECORDED("duplicate"),
  REJECTED("rejected");

  private final String metricValue;

  AdmissionResult(String metricValue) {
    this.metricValue = metricValue;
  }

  public String metricValue() {
    return metricValue;
  }
}
