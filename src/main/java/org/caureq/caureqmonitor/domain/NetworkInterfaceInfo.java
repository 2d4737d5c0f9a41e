package org.caureq.caureqmonitor.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "network_interface_info", uniqueConstraints = {
        @UniqueConstraint(name = "uk_nic_asset_name", columnNames = {"asset_info_id", "name"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NetworkInterfaceInfo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "asset_info_id", nullable = false)
    private AssetInfo assetInfo;

    @Column(nullable = false, length = 50)
    private String name;    // ex: eth0, ens192

    @Column(length = 17)
    private String macAddress;

    @Column(length = 15)
    private String ipv4Address;

    @Column(length = 45)
    private String ipv6Address;
}
