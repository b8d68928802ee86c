package fun.fengwk.discovery.core.facade.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a business result.
 *
 * @author fengwk
 */
public enum BusinessSource {

    /**
     * Only found in the platform catalog.
     */
    LOCAL("local"),

    /**
     * Only found at the external places provider.
     */
    EXTERNAL("external"),

    /**
     * Catalog record that absorbed a matching external place.
     */
    MERGED("merged");

    private final String value;

    BusinessSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BusinessSource fromValue(String value) {
        for (BusinessSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("unsupported source: " + value);
    }

}
