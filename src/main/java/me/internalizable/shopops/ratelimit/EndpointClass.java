package me.internalizable.shopops.ratelimit;

import lombok.Getter;

/**
 * Logical endpoint groups, each limited independently.
 */
@Getter
public enum EndpointClass {

    GENERAL("general", "", "100-M", "requests", false),
    EXPORT("export", ":export", "10-H", "exports", false),
    SYNC("sync", ":sync", "60-M", "sync requests", false),
    /**
     * Restores are counted per device and refuse callers that send no device id.
     */
    RESTORE("restore", ":restore", "1-H", "restores", true);

    private final String id;
    private final String keySuffix;
    private final String defaultRate;
    private final String noun;
    private final boolean deviceRequired;

    EndpointClass(String id, String keySuffix, String defaultRate, String noun, boolean deviceRequired) {
        this.id = id;
        this.keySuffix = keySuffix;
        this.defaultRate = defaultRate;
        this.noun = noun;
        this.deviceRequired = deviceRequired;
    }

    public static EndpointClass fromId(String id) {
        for (EndpointClass endpointClass : values()) {
            if (endpointClass.id.equalsIgnoreCase(id)) {
                return endpointClass;
            }
        }
        throw new IllegalArgumentException("Unknown endpoint class: " + id);
    }
}
