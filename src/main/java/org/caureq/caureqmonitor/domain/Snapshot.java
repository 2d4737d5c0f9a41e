package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One timestamped report from a single host. Root of the persisted graph:
 * deleting a snapshot removes its asset and metric subtrees.
 */
@Entity
@Table(name = "snapshots", indexes = {
        @Index(name = "idx_snapshot_ts", columnList = "ts DESC"),
        @Index(name = "idx_snapshot_host_ts", columnList = "hostname, ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Snapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ts", nullable = false)
    private Instant timestamp; // collection time, UTC

    @Column(nullable = false, length = 255)
    private String hostname;

    @OneToOne(mappedBy = "snapshot", cascade = CascadeType.ALL, orphanRemoval = true)
    private AssetInfo assetInfo;

    @OneToOne(mappedBy = "snapshot", cascade = CascadeType.ALL, orphanRemoval = true)
    private MetricData metricData;

    public void attach(AssetInfo asset) {
        asset.setSnapshot(this);
        this.assetInfo = asset;
    }

    public void attach(MetricData metrics) {
        metrics.setSnapshot(this);
        this.metricData = metrics;
    }
}
