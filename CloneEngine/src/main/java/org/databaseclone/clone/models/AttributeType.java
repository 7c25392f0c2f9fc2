package org.databaseclone.clone.models;

import java.util.Arrays;
import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum AttributeType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATETIME("datetime"),
    EMAIL("email"),
    IP("ip"),
    URL("url"),
    ENUM("enum"),
    RELATIONSHIP("relationship"),
    UNKNOWN(null);

    private static final Set<AttributeType> STRING_FORMATS = Set.of(EMAIL, IP, URL, ENUM);

    /** Name used by the service, also the path segment of the type specific create call. */
    private final String wireName;

    /**
     * The service lists email, ip, url and enum attributes as {@code string} with a
     * {@code format}, so the format wins when it names one of those.
     */
    public static AttributeType fromWire(String type, String format) {
        if ("string".equals(type) && format != null) {
            var formatted = lookup(format);
            if (STRING_FORMATS.contains(formatted)) {
                return formatted;
            }
        }
        if ("double".equals(type)) {
            return FLOAT;
        }
        return lookup(type);
    }

    private static AttributeType lookup(String name) {
        return Arrays.stream(values())
            .filter(t -> t.wireName != null && t.wireName.equals(name))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
