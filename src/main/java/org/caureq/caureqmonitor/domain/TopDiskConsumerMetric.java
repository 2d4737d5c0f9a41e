package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "top_disk_consumer_metrics", uniqueConstraints = {
        @UniqueConstraint(name = "uk_top_consumer_path", columnNames = {"metric_data_id", "path"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TopDiskConsumerMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false)
    private MetricData metricData;

    @Column(nullable = false, length = 50)
    private String size;    // ex: "103G"

    @Column(nullable = false, length = 1024)
    private String path;
}
