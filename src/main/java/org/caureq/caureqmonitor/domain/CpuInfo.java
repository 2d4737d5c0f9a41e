package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "cpu_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CpuInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false, unique = true)
    private AssetInfo assetInfo;

    @Column(length = 255)
    private String modelName;

    @Column(length = 255)
    private String vendorId;

    private int totalLogicalCpus;
    private int physicalCoresPerSocket;

    @Column(length = 50)
    private String architecture;  // ex: x86_64
}
