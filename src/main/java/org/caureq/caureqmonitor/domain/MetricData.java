package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/** Point-in-time performance measurements, captured once per snapshot. */
@Entity
@Table(name = "metric_data")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MetricData {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "snapshot_id", nullable = false, unique = true)
    private Snapshot snapshot;

    @OneToOne(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    private MemoryUsageMetric memoryUsage;

    @OneToOne(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    private CpuLoadMetric cpuLoad;

    @OneToOne(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    private NetworkUsageMetric networkUsage;

    @OneToOne(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    private TopProcessesMetric topProcesses;

    @OneToMany(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<DiskUsageMetric> diskUsage = new ArrayList<>();

    @OneToMany(mappedBy = "metricData", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<TopDiskConsumerMetric> topDiskConsumers = new ArrayList<>();

    public void attach(MemoryUsageMetric m) { m.setMetricData(this); this.memoryUsage = m; }
    public void attach(CpuLoadMetric c) { c.setMetricData(this); this.cpuLoad = c; }
    public void attach(NetworkUsageMetric n) { n.setMetricData(this); this.networkUsage = n; }
    public void attach(TopProcessesMetric t) { t.setMetricData(this); this.topProcesses = t; }

    public void addDiskUsage(DiskUsageMetric d) { d.setMetricData(this); diskUsage.add(d); }
    public void addTopDiskConsumer(TopDiskConsumerMetric t) { t.setMetricData(this); topDiskConsumers.add(t); }
}
