package org.caureq.caureqmonitor.api.dto;

import java.time.Instant;

/** Query parameters of GET /windows-updates; null fields do not filter. */
public record WindowsUpdateFilter(String kbId, String title,
                                  Instant installedOnGte, Instant installedOnLte,
                                  String status) {}
