package org.caureq.caureqmonitor.service;

import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO;
import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO.*;
import org.caureq.caureqmonitor.domain.*;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Builds the whole entity graph of one snapshot in memory from a validated payload.
 * Nothing touches the database here; the caller persists the root and the cascade
 * takes the rest.
 *
 * <p>Absent lists become empty, absent counters become 0, blank IP addresses become null.
 * The by_cpu / by_memory rankings are flattened into one process list, each row tagged
 * with the {@link ProcessType} of the list it came from.
 */
@Component
public class SnapshotAssembler {

    public Snapshot assemble(SnapshotIngestDTO d) {
        var hostname = d.hostname().trim();
        var snapshot = Snapshot.builder()
                .timestamp(d.timestamp().toInstant())
                .hostname(hostname)
                .build();
        snapshot.attach(assetInfo(d.assetInfo(), hostname));
        snapshot.attach(metricData(d.metrics()));
        return snapshot;
    }

    AssetInfo assetInfo(AssetPayload a, String snapshotHostname) {
        var asset = AssetInfo.builder()
                .hostname(blankToNull(a.hostname()) == null ? snapshotHostname : a.hostname().trim())
                .build();

        var os = a.os();
        asset.attach(OsInfo.builder()
                .prettyName(orEmpty(os.prettyName()))
                .kernelVersion(orEmpty(os.kernelVersion()))
                .build());

        var sys = a.system();
        asset.attach(SystemInfo.builder()
                .manufacturer(orEmpty(sys.manufacturer()))
                .productName(orEmpty(sys.productName()))
                .serialNumber(orEmpty(sys.serialNumber()))
                .biosVersion(orEmpty(sys.biosVersion()))
                .chassisType(orEmpty(sys.chassisType()))
                .uptimeInitial(orEmpty(sys.uptimeInitial()))
                .lastUpdateCheckTime(instant(sys.lastUpdateCheckTime()))
                .pendingUpdatesCount(sys.pendingUpdatesCount())
                .build());

        var cpu = a.cpu();
        asset.attach(CpuInfo.builder()
                .modelName(orEmpty(cpu.modelName()))
                .vendorId(orEmpty(cpu.vendorId()))
                .totalLogicalCpus(orZero(cpu.totalLogicalCpus()))
                .physicalCoresPerSocket(orZero(cpu.physicalCoresPerSocket()))
                .architecture(orEmpty(cpu.architecture()))
                .build());

        var mem = a.memory();
        asset.attach(MemoryInfo.builder()
                .totalMb(orZero(mem.totalMb()))
                .speed(orEmpty(mem.speed()))
                .modulesCount(orZero(mem.modulesCount()))
                .build());

        var virt = a.virtualization();
        asset.attach(VirtualizationInfo.builder()
                .vm(Boolean.TRUE.equals(virt.isVm()))
                .hypervisor(orEmpty(virt.hypervisor()))
                .build());

        for (var disk : orEmpty(a.disks())) {
            asset.addDisk(DiskInfo.builder()
                    .name(disk.name().trim())
                    .size(disk.size().trim())
                    .model(orEmpty(disk.model()))
                    .serial(orEmpty(disk.serial()))
                    .build());
        }
        for (var nic : orEmpty(a.networkInterfaces())) {
            asset.addNetworkInterface(NetworkInterfaceInfo.builder()
                    .name(nic.name().trim())
                    .macAddress(orEmpty(nic.macAddress()))
                    .ipv4Address(blankToNull(nic.ipv4Address()))
                    .ipv6Address(blankToNull(nic.ipv6Address()))
                    .build());
        }
        for (var update : orEmpty(a.windowsUpdates())) {
            asset.addWindowsUpdate(WindowsUpdate.builder()
                    .kbId(update.kbId().trim())
                    .title(orEmpty(update.title()))
                    .installedOn(instant(update.installedOn()))
                    .status(orEmpty(update.status()))
                    .build());
        }
        return asset;
    }

    MetricData metricData(MetricsPayload m) {
        var metrics = new MetricData();

        var mu = m.memoryUsage();
        metrics.attach(MemoryUsageMetric.builder()
                .totalMb(mu.totalMb())
                .usedMb(mu.usedMb())
                .freeMb(mu.freeMb())
                .availableMb(mu.availableMb())
                .percentageUsed(scale2(mu.percentageUsed()))
                .build());

        var load = m.cpuLoad();
        metrics.attach(CpuLoadMetric.builder()
                .load1min(scale2(load.load1min()))
                .load5min(scale2(load.load5min()))
                .load15min(scale2(load.load15min()))
                .build());

        var net = m.networkUsage();
        metrics.attach(NetworkUsageMetric.builder()
                .receivedBps(scale2(net.receivedBps()))
                .transmittedBps(scale2(net.transmittedBps()))
                .build());

        var top = new TopProcessesMetric();
        for (var p : orEmpty(m.topProcesses().byCpu())) top.addProcess(ProcessType.CPU, process(p));
        for (var p : orEmpty(m.topProcesses().byMemory())) top.addProcess(ProcessType.MEMORY, process(p));
        metrics.attach(top);

        for (var du : orEmpty(m.diskUsage())) {
            metrics.addDiskUsage(DiskUsageMetric.builder()
                    .filesystem(du.filesystem().trim())
                    .percentageUsed(scale2(du.percentageUsed()))
                    .totalSize(du.totalSize().trim())
                    .usedSize(du.usedSize().trim())
                    .availableSize(du.availableSize().trim())
                    .build());
        }
        for (var tdc : orEmpty(m.topDiskConsumers())) {
            metrics.addTopDiskConsumer(TopDiskConsumerMetric.builder()
                    .size(tdc.size().trim())
                    .path(tdc.path().trim())
                    .build());
        }
        return metrics;
    }

    private ProcessDetail process(ProcessPayload p) {
        return ProcessDetail.builder()
                .pid(p.pid())
                .user(p.user().trim())
                .cpuPercent(scale2(p.cpuPercent()))
                .memPercent(scale2(p.memPercent()))
                .command(p.command())
                .build();
    }

    // validation already capped the fraction digits at 2, this only pads
    static BigDecimal scale2(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }

    private static Instant instant(OffsetDateTime t) {
        return t == null ? null : t.toInstant();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    private static int orZero(Integer i) {
        return i == null ? 0 : i;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
