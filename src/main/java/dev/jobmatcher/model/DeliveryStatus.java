package dev.jobmatcher.model;

public enum DeliveryStatus {
    PENDING,
    SENT,
    FAILED
}
