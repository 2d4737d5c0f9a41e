package org.caureq.caureqmonitor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Agent payloads under src/test/resources/fixtures, loaded as mutable JSON trees. */
public final class Fixtures {
    public static final String LINUX = "snapshot-linux.json";
    public static final String WINDOWS = "snapshot-windows.json";

    /** Same naming and time handling as the application's mapper, for tests without a Spring context. */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);

    private Fixtures() {}

    public static ObjectNode load(String name) {
        try (var in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("no fixture " + name);
            return (ObjectNode) MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Fixture with another host name and collection time, so several snapshots can coexist. */
    public static ObjectNode load(String name, String hostname, String timestamp) {
        var node = load(name);
        node.put("hostname", hostname);
        node.put("timestamp", timestamp);
        ((ObjectNode) node.get("asset_info")).put("hostname", hostname);
        return node;
    }

    public static ObjectNode assetInfo(ObjectNode snapshot) {
        return (ObjectNode) snapshot.get("asset_info");
    }

    public static ObjectNode metrics(ObjectNode snapshot) {
        return (ObjectNode) snapshot.get("metrics");
    }
}
