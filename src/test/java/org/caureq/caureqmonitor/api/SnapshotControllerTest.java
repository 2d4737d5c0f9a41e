package org.caureq.caureqmonitor.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.caureq.caureqmonitor.ApiTestSupport;
import org.caureq.caureqmonitor.Fixtures;
import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("Snapshot API")
class SnapshotControllerTest extends ApiTestSupport {

    private static final List<String> ALL_TABLES = List.of(
            "snapshots", "asset_info", "os_info", "system_info", "cpu_info", "memory_info",
            "virtualization_info", "disk_info", "network_interface_info", "windows_updates",
            "metric_data", "memory_usage_metrics", "cpu_load_metrics", "network_usage_metrics",
            "top_processes_metrics", "process_details", "disk_usage_metrics", "top_disk_consumer_metrics");

    @Test
    @DisplayName("POST stores the snapshot and answers 201 with the nested record and ids")
    void createsSnapshot() throws Exception {
        postSnapshot(Fixtures.load(Fixtures.LINUX))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.hostname").value("web01"))
                .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00Z"))
                .andExpect(jsonPath("$.asset_info.id").isNumber())
                .andExpect(jsonPath("$.asset_info.snapshot_id").isNumber())
                .andExpect(jsonPath("$.asset_info.os.pretty_name").value("Ubuntu 22.04.4 LTS"))
                .andExpect(jsonPath("$.asset_info.virtualization.is_vm").value(true))
                .andExpect(jsonPath("$.asset_info.disks", hasSize(2)))
                .andExpect(jsonPath("$.asset_info.windows_updates", hasSize(0)))
                .andExpect(jsonPath("$.metrics.id").isNumber())
                .andExpect(jsonPath("$.metrics.cpu_load.load_1min").value(1.5))
                .andExpect(jsonPath("$.metrics.top_processes.by_cpu", hasSize(3)))
                .andExpect(jsonPath("$.metrics.top_processes.by_memory", hasSize(2)));
    }

    @Test
    @DisplayName("one row per list element, one row per one-to-one child")
    void persistsOneRowPerInputElement() throws Exception {
        ingest(Fixtures.load(Fixtures.LINUX));
        ingest(Fixtures.load(Fixtures.WINDOWS));

        assertThat(count("snapshots")).isEqualTo(2);
        assertThat(count("asset_info")).isEqualTo(2);
        assertThat(count("os_info")).isEqualTo(2);
        assertThat(count("system_info")).isEqualTo(2);
        assertThat(count("cpu_info")).isEqualTo(2);
        assertThat(count("memory_info")).isEqualTo(2);
        assertThat(count("virtualization_info")).isEqualTo(2);
        assertThat(count("metric_data")).isEqualTo(2);
        assertThat(count("memory_usage_metrics")).isEqualTo(2);
        assertThat(count("cpu_load_metrics")).isEqualTo(2);
        assertThat(count("network_usage_metrics")).isEqualTo(2);
        assertThat(count("top_processes_metrics")).isEqualTo(2);

        assertThat(count("disk_info")).isEqualTo(2 + 1);
        assertThat(count("network_interface_info")).isEqualTo(2 + 1);
        assertThat(count("windows_updates")).isEqualTo(0 + 3);
        assertThat(count("disk_usage_metrics")).isEqualTo(2 + 1);
        assertThat(count("top_disk_consumer_metrics")).isEqualTo(2 + 0);
        assertThat(count("process_details")).isEqualTo((3 + 2) + (1 + 1));
    }

    @Test
    @DisplayName("by_cpu and by_memory rows are tagged cpu and memory, nothing else")
    void tagsProcessRowsByRanking() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        // a caller-supplied tag must not leak through
        ((ObjectNode) Fixtures.metrics(body).at("/top_processes/by_cpu/0")).put("process_type", "memory");
        ingest(body);

        Map<String, Integer> byType = jdbc.queryForList(
                        "select process_type, count(*) as n from process_details group by process_type")
                .stream()
                .collect(Collectors.toMap(r -> (String) r.get("process_type"), r -> ((Number) r.get("n")).intValue()));
        assertThat(byType).containsOnly(Map.entry("cpu", 3), Map.entry("memory", 2));
    }

    @Test
    @DisplayName("missing required object: 400 naming the field, nothing stored")
    void rejectsMissingCpu() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        Fixtures.assetInfo(body).remove("cpu");

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.field_errors['asset_info.cpu']").exists());

        for (var table : ALL_TABLES) {
            assertThat(count(table)).as(table).isZero();
        }
    }

    @Test
    @DisplayName("every required nested object is checked")
    void rejectsEachMissingRequiredObject() throws Exception {
        var required = Map.of(
                "/asset_info", List.of("os", "system", "cpu", "memory", "virtualization"),
                "/metrics", List.of("memory_usage", "cpu_load", "network_usage", "top_processes"));
        for (var entry : required.entrySet()) {
            var parentName = entry.getKey().substring(1);
            for (var field : entry.getValue()) {
                var body = Fixtures.load(Fixtures.LINUX);
                ((ObjectNode) body.at(entry.getKey())).remove(field);
                postSnapshot(body)
                        .andExpect(status().isBadRequest())
                        .andExpect(jsonPath("$.details.field_errors['" + parentName + "." + field + "']").exists());
            }
        }
        assertThat(count("snapshots")).isZero();
    }

    @Test
    @DisplayName("percentage over 100 is reported with its JSON path")
    void rejectsOutOfRangePercentage() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.metrics(body).at("/disk_usage/0")).put("percentage_used", new BigDecimal("100.50"));

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field_errors['metrics.disk_usage[0].percentage_used']").exists());
        assertThat(count("snapshots")).isZero();
    }

    @Test
    @DisplayName("more than two decimals on a load average is rejected")
    void rejectsTooPreciseLoad() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.metrics(body).get("cpu_load")).put("load_5min", new BigDecimal("1.255"));

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field_errors['metrics.cpu_load.load_5min']").exists());
    }

    @Test
    @DisplayName("unparseable timestamp and non-numeric counters are 400 with the path")
    void rejectsWrongTypes() throws Exception {
        var badTs = Fixtures.load(Fixtures.LINUX);
        badTs.put("timestamp", "yesterday");
        postSnapshot(badTs)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.field_errors.timestamp").exists());

        var badNumber = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.assetInfo(badNumber).get("memory")).put("total_mb", "lots");
        postSnapshot(badNumber)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field_errors['asset_info.memory.total_mb']").exists());

        assertThat(count("snapshots")).isZero();
    }

    @Test
    @DisplayName("a fraction on an integer counter is a 400, not truncated")
    void rejectsFractionalInteger() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.assetInfo(body).get("memory")).put("total_mb", new BigDecimal("16000.7"));

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field_errors['asset_info.memory.total_mb']").exists());
        assertThat(count("snapshots")).isZero();
        assertThat(count("memory_info")).isZero();
    }

    @Test
    @DisplayName("an integer beyond 32 bits is a 400 naming the field")
    void rejectsOverflowingInteger() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.assetInfo(body).get("memory")).put("total_mb", 3_000_000_000L);

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.field_errors['asset_info.memory.total_mb']").exists());
        assertThat(count("snapshots")).isZero();
    }

    @Test
    @DisplayName("invalid IPv4 literal is rejected")
    void rejectsBadIpv4() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.assetInfo(body).at("/network_interfaces/1")).put("ipv4_address", "300.1.1.1");

        postSnapshot(body)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field_errors['asset_info.network_interfaces[1].ipv4_address']").exists());
    }

    @Test
    @DisplayName("empty body is a 400, not a server error")
    void rejectsEmptyBody() throws Exception {
        mockMvc.perform(post("/snapshots").contentType(MediaType.APPLICATION_JSON).content(""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("list fields may be omitted and come back empty")
    void defaultsAbsentListsToEmpty() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        Fixtures.assetInfo(body).remove(List.of("disks", "network_interfaces", "windows_updates"));
        Fixtures.metrics(body).remove(List.of("disk_usage", "top_disk_consumers"));
        ((ObjectNode) Fixtures.metrics(body).get("top_processes")).removeAll();

        var created = ingest(body);

        assertThat(created.at("/asset_info/disks").size()).isZero();
        assertThat(created.at("/asset_info/network_interfaces").size()).isZero();
        assertThat(created.at("/metrics/disk_usage").size()).isZero();
        assertThat(created.at("/metrics/top_processes/by_cpu").size()).isZero();
        assertThat(count("snapshots")).isEqualTo(1);
        assertThat(count("top_processes_metrics")).isEqualTo(1);
        assertThat(count("process_details")).isZero();
    }

    @Test
    @DisplayName("duplicate disk name: 409, no partial rows, earlier snapshot untouched")
    void rejectsDuplicateDiskName() throws Exception {
        var first = ingest(Fixtures.load(Fixtures.LINUX));
        int disksBefore = count("disk_info");

        var body = Fixtures.load(Fixtures.LINUX, "web02", "2024-05-01T11:00:00Z");
        ((ObjectNode) Fixtures.assetInfo(body).at("/disks/1")).put("name", "sda");

        postSnapshot(body)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));

        assertThat(count("snapshots")).isEqualTo(1);
        assertThat(count("asset_info")).isEqualTo(1);
        assertThat(count("metric_data")).isEqualTo(1);
        assertThat(count("disk_info")).isEqualTo(disksBefore);
        mockMvc.perform(get("/snapshots/{id}", first.get("id").asLong()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset_info.disks[*].name", contains("sda", "sdb")));
    }

    @Test
    @DisplayName("duplicate filesystem in disk_usage: 409")
    void rejectsDuplicateFilesystem() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.metrics(body).at("/disk_usage/1")).put("filesystem", "/dev/sda2");

        postSnapshot(body).andExpect(status().isConflict());
        assertThat(count("snapshots")).isZero();
        assertThat(count("process_details")).isZero();
    }

    @Test
    @DisplayName("duplicate interface name: 409, nothing stored")
    void rejectsDuplicateInterfaceName() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.assetInfo(body).at("/network_interfaces/1")).put("name", "ens18");

        postSnapshot(body)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
        for (var table : ALL_TABLES) {
            assertThat(count(table)).as(table).isZero();
        }
    }

    @Test
    @DisplayName("duplicate top consumer path: 409, nothing stored")
    void rejectsDuplicateConsumerPath() throws Exception {
        var body = Fixtures.load(Fixtures.LINUX);
        ((ObjectNode) Fixtures.metrics(body).at("/top_disk_consumers/1")).put("path", "/var/lib/docker");

        postSnapshot(body)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));
        for (var table : ALL_TABLES) {
            assertThat(count(table)).as(table).isZero();
        }
    }

    @Test
    @DisplayName("GET by id returns what was posted")
    void roundTripsThroughStorage() throws Exception {
        var input = Fixtures.load(Fixtures.WINDOWS);
        var created = ingest(input);

        var json = mockMvc.perform(get("/snapshots/{id}", created.get("id").asLong()))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        var expected = objectMapper.treeToValue(input, SnapshotIngestDTO.class);
        var actual = objectMapper.readValue(json, SnapshotIngestDTO.class);
        assertThat(actual)
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .ignoringExpectedNullFields()
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("hostname filter is a case-insensitive exact match")
    void filtersByHostname() throws Exception {
        ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T10:00:00Z"));
        ingest(Fixtures.load(Fixtures.LINUX, "WEB01", "2024-05-01T10:05:00Z"));
        ingest(Fixtures.load(Fixtures.LINUX, "web011", "2024-05-01T10:10:00Z"));

        mockMvc.perform(get("/snapshots").param("hostname", "WEB01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].hostname", containsInAnyOrder("web01", "WEB01")));

        mockMvc.perform(get("/snapshots").param("hostname", "db01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("timestamp range is inclusive and results are newest first")
    void filtersByTimestampRange() throws Exception {
        ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T09:00:00Z"));
        ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T10:00:00Z"));
        ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T11:00:00Z"));
        ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T12:00:00Z"));

        mockMvc.perform(get("/snapshots")
                        .param("timestamp_gte", "2024-05-01T10:00:00Z")
                        .param("timestamp_lte", "2024-05-01T11:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].timestamp", contains("2024-05-01T11:00:00Z", "2024-05-01T10:00:00Z")));

        mockMvc.perform(get("/snapshots"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-05-01T12:00:00Z"))
                .andExpect(jsonPath("$[3].timestamp").value("2024-05-01T09:00:00Z"));
    }

    @Test
    @DisplayName("limit and offset page through the list")
    void pagesWithLimitAndOffset() throws Exception {
        for (int h = 0; h < 5; h++) {
            ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T1" + h + ":00:00Z"));
        }
        mockMvc.perform(get("/snapshots").param("limit", "2").param("offset", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].timestamp", contains("2024-05-01T12:00:00Z", "2024-05-01T11:00:00Z")));
    }

    @Test
    @DisplayName("an offset that is not a multiple of the limit starts at that exact row")
    void pagesFromExactOffset() throws Exception {
        for (int h = 0; h < 5; h++) {
            ingest(Fixtures.load(Fixtures.LINUX, "web01", "2024-05-01T1" + h + ":00:00Z"));
        }
        mockMvc.perform(get("/snapshots").param("limit", "2").param("offset", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].timestamp", contains("2024-05-01T11:00:00Z", "2024-05-01T10:00:00Z")));
        mockMvc.perform(get("/snapshots").param("limit", "3").param("offset", "1"))
                .andExpect(jsonPath("$[*].timestamp", contains(
                        "2024-05-01T13:00:00Z", "2024-05-01T12:00:00Z", "2024-05-01T11:00:00Z")));
    }

    @Test
    @DisplayName("unknown id is a 404")
    void unknownIdIsNotFound() throws Exception {
        mockMvc.perform(get("/snapshots/{id}", 999_999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("bad query parameter type is a 400")
    void badTimestampParameter() throws Exception {
        mockMvc.perform(get("/snapshots").param("timestamp_gte", "not-a-date"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.parameter").value("timestamp_gte"));
    }

    @Test
    @DisplayName("DELETE removes the snapshot and its whole subtree")
    void deleteCascades() throws Exception {
        var linux = ingest(Fixtures.load(Fixtures.LINUX));
        ingest(Fixtures.load(Fixtures.WINDOWS));

        mockMvc.perform(delete("/snapshots/{id}", linux.get("id").asLong()))
                .andExpect(status().isNoContent());

        assertThat(count("snapshots")).isEqualTo(1);
        assertThat(count("disk_info")).isEqualTo(1);
        assertThat(count("process_details")).isEqualTo(2);
        assertThat(count("top_disk_consumer_metrics")).isZero();
        assertThat(count("windows_updates")).isEqualTo(3);

        mockMvc.perform(delete("/snapshots/{id}", linux.get("id").asLong()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("snapshots cannot be updated")
    void noUpdate() throws Exception {
        var created = ingest(Fixtures.load(Fixtures.LINUX));
        mockMvc.perform(put("/snapshots/{id}", created.get("id").asLong())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Fixtures.load(Fixtures.LINUX))))
                .andExpect(status().isMethodNotAllowed());
    }
}
