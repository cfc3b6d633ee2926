package com.vrfradar.query;

public enum QueryStatus {
    IDLE,
    FETCHING,
    READY,
    FAILED
}
