package org.caureq.caureqmonitor.domain;

/**
 * Which ranking a {@link ProcessDetail} row came from. Assigned while expanding the
 * agent's {@code by_cpu} / {@code by_memory} lists, never read from the payload.
 */
public enum ProcessType {
    CPU("cpu"),
    MEMORY("memory");

    private final String code;

    ProcessType(String code) { this.code = code; }

    public String code() { return code; }

    public static ProcessType fromCode(String code) {
        for (var t : values()) if (t.code.equals(code)) return t;
        throw new IllegalArgumentException("unknown process type: " + code);
    }
}
