package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/** Container for the top processes, both rankings share one list discriminated by {@link ProcessType}. */
@Entity
@Table(name = "top_processes_metrics")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TopProcessesMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_data_id", nullable = false, unique = true)
    private MetricData metricData;

    @OneToMany(mappedBy = "topProcesses", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<ProcessDetail> processes = new ArrayList<>();

    public void addProcess(ProcessType type, ProcessDetail p) {
        p.setProcessType(type);
        p.setTopProcesses(this);
        processes.add(p);
    }

    public List<ProcessDetail> processesOf(ProcessType type) {
        return processes.stream().filter(p -> p.getProcessType() == type).toList();
    }
}
