package fun.fengwk.discovery.core.facade.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fun.fengwk.discovery.core.exception.SearchValidationException;
import org.springframework.util.StringUtils;

/**
 * Supported sort keys.
 *
 * @author fengwk
 */
public enum SortBy {

    RATING("rating"),
    REVIEWS("reviews"),
    NAME("name"),
    DISTANCE("distance");

    private final String value;

    SortBy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SortBy fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return RATING;
        }
        for (SortBy sortBy : values()) {
            if (sortBy.value.equalsIgnoreCase(value.trim())) {
                return sortBy;
            }
        }
        throw new SearchValidationException("unsupported sortBy: " + value);
    }

}
