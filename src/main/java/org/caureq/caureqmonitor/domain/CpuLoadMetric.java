package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "cpu_load_metrics")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CpuLoadMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false, unique = true)
    private MetricData metricData;

    @Column(name = "load_1min", nullable = false, precision = 5, scale = 2)
    private BigDecimal load1min;

    @Column(name = "load_5min", nullable = false, precision = 5, scale = 2)
    private BigDecimal load5min;

    @Column(name = "load_15min", nullable = false, precision = 5, scale = 2)
    private BigDecimal load15min;
}
