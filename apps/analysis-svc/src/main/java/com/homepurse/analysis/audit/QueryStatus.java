package com.homepurse.analysis.audit;

public enum QueryStatus {
    PENDING,
    SUCCESS,
    FAILED
}
