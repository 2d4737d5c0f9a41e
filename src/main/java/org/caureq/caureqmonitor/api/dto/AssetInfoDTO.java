package org.caureq.caureqmonitor.api.dto;

import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO.*;

import java.util.List;

public record AssetInfoDTO(
        Long id,
        Long snapshotId,
        String hostname,
        OsPayload os,
        SystemPayload system,
        CpuPayload cpu,
        MemoryPayload memory,
        VirtualizationPayload virtualization,
        List<DiskPayload> disks,
        List<NetworkInterfacePayload> networkInterfaces,
        List<WindowsUpdatePayload> windowsUpdates
) {}
