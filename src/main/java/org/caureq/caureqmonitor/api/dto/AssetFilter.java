package org.caureq.caureqmonitor.api.dto;

/** Query parameters of GET /assets; null fields do not filter. */
public record AssetFilter(String osPrettyName, String systemManufacturer,
                          Integer memoryTotalMbGte, Boolean isVm) {}
