package org.caureq.caureqmonitor.api.dto;

import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO.*;

import java.util.List;

public record MetricDataDTO(
        Long id,
        MemoryUsagePayload memoryUsage,
        CpuLoadPayload cpuLoad,
        NetworkUsagePayload networkUsage,
        TopProcessesPayload topProcesses,
        List<DiskUsagePayload> diskUsage,
        List<TopDiskConsumerPayload> topDiskConsumers
) {}
