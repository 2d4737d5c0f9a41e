package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "windows_updates", indexes = {
        @Index(name = "idx_wu_installed_on", columnList = "installed_on DESC"),
        @Index(name = "idx_wu_kb", columnList = "kb_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WindowsUpdate {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false)
    private AssetInfo assetInfo;

    @Column(name = "kb_id", nullable = false, length = 50)
    private String kbId;    // ex: KB5034441

    @Column(length = 512)
    private String title;

    @Column(name = "installed_on")
    private Instant installedOn;

    @Column(length = 50)
    private String status;  // ex: "Succeeded", "Failed"
}
