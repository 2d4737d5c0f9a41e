package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "memory_usage_metrics")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MemoryUsageMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false, unique = true)
    private MetricData metricData;

    private int totalMb;
    private int usedMb;
    private int freeMb;
    private int availableMb;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal percentageUsed;
}
