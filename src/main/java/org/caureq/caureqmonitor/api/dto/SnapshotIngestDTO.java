package org.caureq.caureqmonitor.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Body of POST /snapshots, as sent by the collection agents (snake_case on the wire).
 * The leaf records are reused by the read side so a stored snapshot reads back in the
 * shape it was posted.
 */
public record SnapshotIngestDTO(
        @NotNull OffsetDateTime timestamp,
        @NotBlank @Size(max = 255) String hostname,
        @NotNull @Valid AssetPayload assetInfo,
        @NotNull @Valid MetricsPayload metrics
) {

    public record AssetPayload(
            @Size(max = 255) String hostname,
            @NotNull @Valid OsPayload os,
            @NotNull @Valid SystemPayload system,
            @NotNull @Valid CpuPayload cpu,
            @NotNull @Valid MemoryPayload memory,
            @NotNull @Valid VirtualizationPayload virtualization,
            List<@Valid @NotNull DiskPayload> disks,
            List<@Valid @NotNull NetworkInterfacePayload> networkInterfaces,
            List<@Valid @NotNull WindowsUpdatePayload> windowsUpdates // Windows agents only
    ) {}

    public record OsPayload(
            @Size(max = 255) String prettyName,
            @Size(max = 255) String kernelVersion
    ) {}

    public record SystemPayload(
            @Size(max = 255) String manufacturer,
            @Size(max = 255) String productName,
            @Size(max = 255) String serialNumber,
            @Size(max = 255) String biosVersion,
            @Size(max = 255) String chassisType,
            @Size(max = 255) String uptimeInitial,
            OffsetDateTime lastUpdateCheckTime,
            @PositiveOrZero Integer pendingUpdatesCount
    ) {}

    public record CpuPayload(
            @Size(max = 255) String modelName,
            @Size(max = 255) String vendorId,
            @PositiveOrZero Integer totalLogicalCpus,
            @PositiveOrZero Integer physicalCoresPerSocket,
            @Size(max = 50) String architecture
    ) {}

    public record MemoryPayload(
            @PositiveOrZero Integer totalMb,
            @Size(max = 100) String speed,
            @PositiveOrZero Integer modulesCount
    ) {}

    public record VirtualizationPayload(
            @JsonProperty("is_vm") Boolean isVm,
            @Size(max = 100) String hypervisor
    ) {}

    public record DiskPayload(
            @NotBlank @Size(max = 50) String name,
            @NotBlank @Size(max = 50) String size,
            @Size(max = 255) String model,
            @Size(max = 255) String serial
    ) {}

    public record NetworkInterfacePayload(
            @NotBlank @Size(max = 50) String name,
            @Size(max = 17) String macAddress,
            @IpAddress(IpAddress.Family.IPV4) String ipv4Address,
            @IpAddress(IpAddress.Family.IPV6) String ipv6Address
    ) {}

    public record WindowsUpdatePayload(
            @NotBlank @Size(max = 50) String kbId,
            @Size(max = 512) String title,
            OffsetDateTime installedOn,
            @Size(max = 50) String status
    ) {}

    public record MetricsPayload(
            @NotNull @Valid MemoryUsagePayload memoryUsage,
            @NotNull @Valid CpuLoadPayload cpuLoad,
            @NotNull @Valid NetworkUsagePayload networkUsage,
            @NotNull @Valid TopProcessesPayload topProcesses,
            List<@Valid @NotNull DiskUsagePayload> diskUsage,
            List<@Valid @NotNull TopDiskConsumerPayload> topDiskConsumers
    ) {}

    public record MemoryUsagePayload(
            @NotNull @PositiveOrZero Integer totalMb,
            @NotNull @PositiveOrZero Integer usedMb,
            @NotNull @PositiveOrZero Integer freeMb,
            @NotNull @PositiveOrZero Integer availableMb,
            @NotNull @DecimalMin("0.0") @DecimalMax("100.0") @Digits(integer = 3, fraction = 2)
            BigDecimal percentageUsed
    ) {}

    public record CpuLoadPayload(
            @JsonProperty("load_1min") @NotNull @DecimalMin("0.0") @Digits(integer = 3, fraction = 2)
            BigDecimal load1min,
            @JsonProperty("load_5min") @NotNull @DecimalMin("0.0") @Digits(integer = 3, fraction = 2)
            BigDecimal load5min,
            @JsonProperty("load_15min") @NotNull @DecimalMin("0.0") @Digits(integer = 3, fraction = 2)
            BigDecimal load15min
    ) {}

    public record NetworkUsagePayload(
            @NotNull @DecimalMin("0.0") @Digits(integer = 13, fraction = 2) BigDecimal receivedBps,
            @NotNull @DecimalMin("0.0") @Digits(integer = 13, fraction = 2) BigDecimal transmittedBps
    ) {}

    /** Input-only rankings; each entry becomes a process row tagged cpu or memory. */
    public record TopProcessesPayload(
            List<@Valid @NotNull ProcessPayload> byCpu,
            List<@Valid @NotNull ProcessPayload> byMemory
    ) {}

    public record ProcessPayload(
            @NotNull @PositiveOrZero Integer pid,
            @NotBlank @Size(max = 255) String user,
            // ps reports > 100% for multi-threaded processes
            @NotNull @DecimalMin("0.0") @DecimalMax("999.99") @Digits(integer = 3, fraction = 2)
            BigDecimal cpuPercent,
            @NotNull @DecimalMin("0.0") @DecimalMax("100.0") @Digits(integer = 3, fraction = 2)
            BigDecimal memPercent,
            @NotBlank String command
    ) {}

    public record DiskUsagePayload(
            @NotBlank @Size(max = 255) String filesystem,
            @NotNull @DecimalMin("0.0") @DecimalMax("100.0") @Digits(integer = 3, fraction = 2)
            BigDecimal percentageUsed,
            @NotBlank @Size(max = 50) String totalSize,
            @NotBlank @Size(max = 50) String usedSize,
            @NotBlank @Size(max = 50) String availableSize
    ) {}

    public record TopDiskConsumerPayload(
            @NotBlank @Size(max = 50) String size,
            @NotBlank @Size(max = 1024) String path
    ) {}
}
