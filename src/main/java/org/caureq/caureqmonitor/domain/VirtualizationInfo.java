package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "virtualization_info")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class VirtualizationInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false, unique = true)
    private AssetInfo assetInfo;

    @Column(name = "is_vm", nullable = false)
    private boolean vm;

    @Column(length = 100)
    private String hypervisor;    // ex: "kvm", "vmware"
}
