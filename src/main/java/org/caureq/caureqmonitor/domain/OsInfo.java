package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "os_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OsInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false, unique = true)
    private AssetInfo assetInfo;

    @Column(length = 255)
    private String prettyName;    // ex: "Ubuntu 22.04.4 LTS"

    @Column(length = 255)
    private String kernelVersion;
}
