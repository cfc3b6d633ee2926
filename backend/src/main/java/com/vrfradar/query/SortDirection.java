package com.vrfradar.query;

public enum SortDirection {
    ASC,
    DESC
}
