package org.caureq.caureqmonitor.api.dto;

import java.time.OffsetDateTime;

/** A Windows update row on its own, with the asset and host it was reported by. */
public record WindowsUpdateDTO(
        Long id,
        Long assetInfoId,
        String hostname,
        String kbId,
        String title,
        OffsetDateTime installedOn,
        String status
) {}
