package com.fleetgate.store.model;

public enum WorkItemStatus {
    NEW,
    RUNNING,
    DONE,
    FAILED,
    CANCELED
}
