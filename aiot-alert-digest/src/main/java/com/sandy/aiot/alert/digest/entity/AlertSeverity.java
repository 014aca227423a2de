package com.sandy.aiot.alert.digest.entity;

/**
 * Severity decided upstream by the threshold evaluator. Stored as its name.
 */
public enum AlertSeverity {
    Critical,
    Warning,
    Advisory
}
