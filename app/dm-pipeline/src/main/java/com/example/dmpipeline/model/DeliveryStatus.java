/*
 * Where: DM pipeline domain model
 * What: terminal outcome of a delivery
 * Why: the stored value is the lower-case form used by the delivery log
 */
package com.example.dmpipeline.model;

public enum DeliveryStatus {
  SENT("sent"),
  FAILED("failed");

  private final String value;

  DeliveryStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static DeliveryStatus fromValue(String status) {
    for (DeliveryStatus deliveryStatus : values()) {
      if (deliveryStatus.value.equalsIgnoreCase(status)) {
        return deliveryStatus;
      }
    }
    throw new IllegalArgumentException("unsupported delivery status: " + status);
  }
}
