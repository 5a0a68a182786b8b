package com.streamfirst.worklog.domain;

import lombok.With;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Tuning for session reconstruction. Built once at startup and passed to the clusterer,
 * merger and reconciliation engine; invalid values fail at construction.
 *
 * @param tauHours exponential decay constant for the proximity weight
 * @param clusterThreshold weight below which consecutive events start a new session
 * @param maxSessionHours cap applied to every session duration
 * @param minClusterGapMinutes sessions closer than this are merged; zero or less disables merging
 * @param zone zone used for session timestamps, day boundaries and descriptions
 */
@With
public record SessionSettings(double tauHours,
                              double clusterThreshold,
                              double maxSessionHours,
                              int minClusterGapMinutes,
                              ZoneId zone) {

    public static final double DEFAULT_TAU_HOURS = 2.5;
    public static final double DEFAULT_CLUSTER_THRESHOLD = 0.1;
    public static final double DEFAULT_MAX_SESSION_HOURS = 4.0;
    public static final int DEFAULT_MIN_CLUSTER_GAP_MINUTES = 30;
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Asuncion");

    public SessionSettings {
        if (!(tauHours > 0) || Double.isInfinite(tauHours)) {
            throw new IllegalArgumentException("tauHours must be positive, got " + tauHours);
        }
        if (!(clusterThreshold > 0) || clusterThreshold > 1) {
            throw new IllegalArgumentException("clusterThreshold must be within (0, 1], got " + clusterThreshold);
        }
        if (!(maxSessionHours > 0)) {
            throw new IllegalArgumentException("maxSessionHours must be positive, got " + maxSessionHours);
        }
        Objects.requireNonNull(zone, "Zone cannot be null");
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_TAU_HOURS, DEFAULT_CLUSTER_THRESHOLD,
                DEFAULT_MAX_SESSION_HOURS, DEFAULT_MIN_CLUSTER_GAP_MINUTES, DEFAULT_ZONE);
    }

    /**
     * Duration credited to a session made of a single event.
     */
    public double singleEventHours() {
        return Math.min(0.25, maxSessionHours);
    }
}
