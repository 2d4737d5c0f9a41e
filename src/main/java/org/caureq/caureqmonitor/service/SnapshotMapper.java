package org.caureq.caureqmonitor.service;

import org.caureq.caureqmonitor.api.dto.*;
import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO.*;
import org.caureq.caureqmonitor.domain.*;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Entity graph -> API records. Must run inside the read transaction (lazy children). */
@Component
public class SnapshotMapper {

    public SnapshotDTO toDto(Snapshot s) {
        return new SnapshotDTO(
                s.getId(), utc(s.getTimestamp()), s.getHostname(),
                s.getAssetInfo() == null ? null : toDto(s.getAssetInfo()),
                s.getMetricData() == null ? null : toDto(s.getMetricData())
        );
    }

    public AssetInfoDTO toDto(AssetInfo a) {
        var os = a.getOs();
        var sys = a.getSystem();
        var cpu = a.getCpu();
        var mem = a.getMemory();
        var virt = a.getVirtualization();
        return new AssetInfoDTO(
                a.getId(),
                a.getSnapshot() == null ? null : a.getSnapshot().getId(),
                a.getHostname(),
                os == null ? null : new OsPayload(os.getPrettyName(), os.getKernelVersion()),
                sys == null ? null : new SystemPayload(
                        sys.getManufacturer(), sys.getProductName(), sys.getSerialNumber(),
                        sys.getBiosVersion(), sys.getChassisType(), sys.getUptimeInitial(),
                        utc(sys.getLastUpdateCheckTime()), sys.getPendingUpdatesCount()),
                cpu == null ? null : new CpuPayload(
                        cpu.getModelName(), cpu.getVendorId(), cpu.getTotalLogicalCpus(),
                        cpu.getPhysicalCoresPerSocket(), cpu.getArchitecture()),
                mem == null ? null : new MemoryPayload(mem.getTotalMb(), mem.getSpeed(), mem.getModulesCount()),
                virt == null ? null : new VirtualizationPayload(virt.isVm(), virt.getHypervisor()),
                a.getDisks().stream()
                        .map(d -> new DiskPayload(d.getName(), d.getSize(), d.getModel(), d.getSerial()))
                        .toList(),
                a.getNetworkInterfaces().stream()
                        .map(n -> new NetworkInterfacePayload(n.getName(), n.getMacAddress(),
                                n.getIpv4Address(), n.getIpv6Address()))
                        .toList(),
                a.getWindowsUpdates().stream()
                        .map(u -> new WindowsUpdatePayload(u.getKbId(), u.getTitle(), utc(u.getInstalledOn()), u.getStatus()))
                        .toList()
        );
    }

    public MetricDataDTO toDto(MetricData m) {
        var mu = m.getMemoryUsage();
        var load = m.getCpuLoad();
        var net = m.getNetworkUsage();
        var top = m.getTopProcesses();
        return new MetricDataDTO(
                m.getId(),
                mu == null ? null : new MemoryUsagePayload(mu.getTotalMb(), mu.getUsedMb(), mu.getFreeMb(),
                        mu.getAvailableMb(), mu.getPercentageUsed()),
                load == null ? null : new CpuLoadPayload(load.getLoad1min(), load.getLoad5min(), load.getLoad15min()),
                net == null ? null : new NetworkUsagePayload(net.getReceivedBps(), net.getTransmittedBps()),
                top == null ? null : new TopProcessesPayload(
                        top.processesOf(ProcessType.CPU).stream().map(this::toPayload).toList(),
                        top.processesOf(ProcessType.MEMORY).stream().map(this::toPayload).toList()),
                m.getDiskUsage().stream()
                        .map(d -> new DiskUsagePayload(d.getFilesystem(), d.getPercentageUsed(),
                                d.getTotalSize(), d.getUsedSize(), d.getAvailableSize()))
                        .toList(),
                m.getTopDiskConsumers().stream()
                        .map(t -> new TopDiskConsumerPayload(t.getSize(), t.getPath()))
                        .toList()
        );
    }

    public WindowsUpdateDTO toDto(WindowsUpdate u) {
        var asset = u.getAssetInfo();
        var hostname = asset.getSnapshot() == null ? asset.getHostname() : asset.getSnapshot().getHostname();
        return new WindowsUpdateDTO(u.getId(), asset.getId(), hostname,
                u.getKbId(), u.getTitle(), utc(u.getInstalledOn()), u.getStatus());
    }

    private ProcessPayload toPayload(ProcessDetail p) {
        return new ProcessPayload(p.getPid(), p.getUser(), p.getCpuPercent(), p.getMemPercent(), p.getCommand());
    }

    private static OffsetDateTime utc(Instant ts) {
        return ts == null ? null : ts.atOffset(ZoneOffset.UTC);
    }
}
