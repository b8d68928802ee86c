package fun.fengwk.discovery.core.facade.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fun.fengwk.discovery.core.exception.SearchValidationException;
import org.springframework.util.StringUtils;

/**
 * @author fengwk
 */
public enum SortOrder {

    ASC("asc"),
    DESC("desc");

    private final String value;

    SortOrder(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isDescending() {
        return this == DESC;
    }

    @JsonCreator
    public static SortOrder fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return DESC;
        }
        for (SortOrder order : values()) {
            if (order.value.equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new SearchValidationException("unsupported sortOrder: " + value);
    }

}
