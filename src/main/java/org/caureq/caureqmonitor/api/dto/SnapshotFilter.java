package org.caureq.caureqmonitor.api.dto;

import java.time.Instant;

/** Query parameters of GET /snapshots; null fields do not filter. */
public record SnapshotFilter(String hostname, Instant timestampGte, Instant timestampLte) {}
