package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "process_details", uniqueConstraints = {
        @UniqueConstraint(name = "uk_process_type_pid", columnNames = {"top_processes_id", "process_type", "pid"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProcessDetail {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "top_processes_id", nullable = false)
    private TopProcessesMetric topProcesses;

    @Column(name = "process_type", nullable = false, length = 10)
    private ProcessType processType;

    private int pid;

    @Column(name = "username", nullable = false, length = 255)
    private String user;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal cpuPercent;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal memPercent;

    @Column(nullable = false, columnDefinition = "text")
    private String command;
}
