package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/** Static inventory of a host, captured once per snapshot. */
@Entity
@Table(name = "asset_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AssetInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "snapshot_id", nullable = false, unique = true)
    private Snapshot snapshot;

    @Column(length = 255)
    private String hostname; // as reported inside asset_info, usually same as the snapshot's

    @OneToOne(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    private OsInfo os;

    @OneToOne(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    private SystemInfo system;

    @OneToOne(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    private CpuInfo cpu;

    @OneToOne(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    private MemoryInfo memory;

    @OneToOne(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    private VirtualizationInfo virtualization;

    @OneToMany(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<DiskInfo> disks = new ArrayList<>();

    @OneToMany(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<NetworkInterfaceInfo> networkInterfaces = new ArrayList<>();

    @OneToMany(mappedBy = "assetInfo", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<WindowsUpdate> windowsUpdates = new ArrayList<>();

    public void attach(OsInfo o) { o.setAssetInfo(this); this.os = o; }
    public void attach(SystemInfo s) { s.setAssetInfo(this); this.system = s; }
    public void attach(CpuInfo c) { c.setAssetInfo(this); this.cpu = c; }
    public void attach(MemoryInfo m) { m.setAssetInfo(this); this.memory = m; }
    public void attach(VirtualizationInfo v) { v.setAssetInfo(this); this.virtualization = v; }

    public void addDisk(DiskInfo d) { d.setAssetInfo(this); disks.add(d); }
    public void addNetworkInterface(NetworkInterfaceInfo n) { n.setAssetInfo(this); networkInterfaces.add(n); }
    public void addWindowsUpdate(WindowsUpdate u) { u.setAssetInfo(this); windowsUpdates.add(u); }
}
