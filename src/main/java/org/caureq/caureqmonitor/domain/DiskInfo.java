package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "disk_info", uniqueConstraints = {
        @UniqueConstraint(name = "uk_disk_asset_name", columnNames = {"asset_info_id", "name"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DiskInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false)
    private AssetInfo assetInfo;

    @Column(nullable = false, length = 50)
    private String name;    // ex: sda, nvme0n1

    @Column(nullable = false, length = 50)
    private String size;    // as reported, ex: "256G"

    @Column(length = 255)
    private String model;

    @Column(length = 255)
    private String serial;
}
