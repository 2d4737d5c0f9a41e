package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "system_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SystemInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false, unique = true)
    private AssetInfo assetInfo;

    @Column(length = 255)
    private String manufacturer;

    @Column(length = 255)
    private String productName;

    @Column(length = 255)
    private String serialNumber;

    @Column(length = 255)
    private String biosVersion;

    @Column(length = 255)
    private String chassisType;   // ex: "Laptop", "Rack Mount Chassis"

    @Column(length = 255)
    private String uptimeInitial; // free text from the agent, ex: "up 3 days, 4 hours"

    // Windows agents only
    private Instant lastUpdateCheckTime;
    private Integer pendingUpdatesCount;
}
