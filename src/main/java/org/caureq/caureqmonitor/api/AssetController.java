package org.caureq.caureqmonitor.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.AssetFilter;
import org.caureq.caureqmonitor.api.dto.AssetInfoDTO;
import org.caureq.caureqmonitor.service.AssetQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Asset inventory read APIs. Assets are created through POST /snapshots only.
 */
@RestController
@RequestMapping("/assets")
@RequiredArgsConstructor
public class AssetController {
    private final AssetQueryService service;

    /**
     * List asset inventories ordered by host name. Filters are combined with AND.
     *
     * @param osPrettyName substring of the OS name, case-insensitive
     * @param systemManufacturer substring of the manufacturer, case-insensitive
     * @param memoryTotalMbGte minimum installed memory in MB
     * @param isVm virtual machines only (true) or physical hosts only (false)
     * @param limit page size (default 200, max 1000)
     * @param offset start offset (0-based)
     */
    @GetMapping
    public List<AssetInfoDTO> list(
            @RequestParam(value = "os_pretty_name", required = false) String osPrettyName,
            @RequestParam(value = "system_manufacturer", required = false) String systemManufacturer,
            @RequestParam(value = "memory_total_mb_gte", required = false) Integer memoryTotalMbGte,
            @RequestParam(value = "is_vm", required = false) Boolean isVm,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        var filter = new AssetFilter(osPrettyName, systemManufacturer, memoryTotalMbGte, isVm);
        return service.list(filter, limit, offset);
    }

    @GetMapping("/{id}")
    public AssetInfoDTO get(@PathVariable Long id) {
        return service.get(id);
    }
}
