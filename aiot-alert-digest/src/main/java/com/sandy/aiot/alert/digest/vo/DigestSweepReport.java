package com.sandy.aiot.alert.digest.vo;

import lombok.Data;

/** Counters for one scheduler sweep. */
@Data
public class DigestSweepReport {
    private int selected;
    private int sent;
    private int failed;
    private int skipped;
    private long durationMs;

    public void record(SendOutcome outcome) {
        selected++;
        switch (outcome.getStatus()) {
            case SENT -> sent++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
        }
    }
}
