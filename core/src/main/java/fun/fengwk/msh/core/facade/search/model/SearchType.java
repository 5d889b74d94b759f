package fun.fengwk.msh.core.facade.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of search which decides the eligible providers.
 *
 * @author fengwk
 */
public enum SearchType {

    WEB("web"),
    IMAGE("image"),
    NEWS("news"),
    VIDEO("video"),
    LOCAL("local");

    private final String value;

    SearchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve search type from its wire value, blank means {@link #WEB}.
     *
     * @return search type, or {@code null} when the value is unknown
     */
    public static SearchType of(String value) {
        if (value == null || value.isBlank()) {
            return WEB;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SearchType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }

}
