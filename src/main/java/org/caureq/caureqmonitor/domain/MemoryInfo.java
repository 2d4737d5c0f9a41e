package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "memory_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MemoryInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false, unique = true)
    private AssetInfo assetInfo;

    private int totalMb;

    @Column(length = 100)
    private String speed;         // ex: "3200 MT/s"

    private int modulesCount;
}
