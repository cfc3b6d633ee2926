package com.vrfradar.query;

public enum SortField {
    TIMESTAMP,
    FEE,
    DEADLINE
}
