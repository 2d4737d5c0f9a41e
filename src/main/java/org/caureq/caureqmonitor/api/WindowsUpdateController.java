package org.caureq.caureqmonitor.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.WindowsUpdateDTO;
import org.caureq.caureqmonitor.api.dto.WindowsUpdateFilter;
import org.caureq.caureqmonitor.service.WindowsUpdateQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Windows update history, read-only. Most recently installed first, then by host.
 */
@RestController
@RequestMapping("/windows-updates")
@RequiredArgsConstructor
public class WindowsUpdateController {
    private final WindowsUpdateQueryService service;

    @GetMapping
    public List<WindowsUpdateDTO> list(
            @RequestParam(value = "kb_id", required = false) String kbId,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "installed_on_gte", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant installedOnGte,
            @RequestParam(value = "installed_on_lte", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant installedOnLte,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        var filter = new WindowsUpdateFilter(kbId, title, installedOnGte, installedOnLte, status);
        return service.list(filter, limit, offset);
    }

    @GetMapping("/{id}")
    public WindowsUpdateDTO get(@PathVariable Long id) {
        return service.get(id);
    }
}
