package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "network_usage_metrics")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NetworkUsageMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false, unique = true)
    private MetricData metricData;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal receivedBps;    // bytes/s

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal transmittedBps;
}
