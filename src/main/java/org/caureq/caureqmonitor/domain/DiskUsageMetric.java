package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "disk_usage_metrics", uniqueConstraints = {
        @UniqueConstraint(name = "uk_disk_usage_fs", columnNames = {"metric_data_id", "filesystem"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DiskUsageMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false)
    private MetricData metricData;

    @Column(nullable = false, length = 255)
    private String filesystem;    // ex: /dev/sda2

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal percentageUsed;

    // sizes stay as reported by df -h, ex: "512M"
    @Column(nullable = false, length = 50)
    private String totalSize;

    @Column(nullable = false, length = 50)
    private String usedSize;

    @Column(nullable = false, length = 50)
    private String availableSize;
}
