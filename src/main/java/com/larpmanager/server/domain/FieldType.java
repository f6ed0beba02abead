package com.larpmanager.server.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Value types an {@link EntityField} can hold.
 *
 * <p>Each type knows its dictionary form and which loose inputs it accepts
 * when a dictionary is written back onto an entity.
 */
public enum FieldType {

    UUID(java.util.UUID.class),
    TIMESTAMP(OffsetDateTime.class),
    STRING(String.class),
    INTEGER(Integer.class),
    BOOLEAN(Boolean.class);

    private final Class<?> javaType;

    FieldType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Converts a field value to its dictionary form.
     *
     * Identifiers become their canonical string, timestamps ISO-8601 text
     * with offset. Everything else, null included, is returned as is.
     *
     * @param value the field value
     * @return the dictionary value
     */
    public Object toDictValue(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case UUID:
                return value.toString();
            case TIMESTAMP:
                return ((OffsetDateTime) value).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            default:
                return value;
        }
    }

    /**
     * Converts a dictionary value to this type.
     *
     * Accepted conversions: String to UUID, String or Instant to timestamp,
     * integral Number to Integer when it fits.
     *
     * @param fieldName field being written, used in error messages
     * @param raw the incoming value, may be null
     * @return the converted value, or null
     * @throws IllegalArgumentException if the value cannot be converted unambiguously
     */
    public Object coerce(String fieldName, Object raw) {
        if (raw == null || javaType.isInstance(raw)) {
            return raw;
        }
        try {
            switch (this) {
                case UUID:
                    if (raw instanceof String) {
                        return java.util.UUID.fromString(((String) raw).trim());
                    }
                    break;
                case TIMESTAMP:
                    if (raw instanceof String) {
                        return OffsetDateTime.parse(((String) raw).trim());
                    }
                    if (raw instanceof Instant) {
                        return ((Instant) raw).atOffset(ZoneOffset.UTC);
                    }
                    break;
                case INTEGER:
                    if (raw instanceof Long || raw instanceof Short || raw instanceof Byte
                            || raw instanceof BigInteger) {
                        return Math.toIntExact(((Number) raw).longValue());
                    }
                    break;
                default:
                    break;
            }
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            throw new IllegalArgumentException(
                "Field '" + fieldName + "' cannot take value '" + raw + "': " + e.getMessage(), e);
        }
        throw new IllegalArgumentException(
            "Field '" + fieldName + "' expects " + javaType.getSimpleName()
                + " but got " + raw.getClass().getSimpleName());
    }
}
