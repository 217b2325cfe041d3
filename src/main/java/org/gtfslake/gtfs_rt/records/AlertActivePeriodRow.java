package org.gtfslake.gtfs_rt.records;

/**
 * One row of {@code realtime_alert_active_periods}, a validity window of an alert.
 *
 * @param serviceAlertId the owning alert
 * @param startTimestamp window start in POSIX seconds, nullable
 * @param endTimestamp   window end in POSIX seconds, nullable
 *
 * @since 1.0
 */
public record AlertActivePeriodRow(String serviceAlertId, Long startTimestamp, Long endTimestamp) {}
