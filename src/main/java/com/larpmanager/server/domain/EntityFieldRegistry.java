package com.larpmanager.server.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, duplicate-free set of the fields one entity type exposes.
 *
 * <p>Each concrete entity declares a single static registry:
 * <pre>
 * {@code
 * private static final EntityFieldRegistry<GameSession> FIELDS =
 *     EntityFieldRegistry.<GameSession>withAuditFields()
 *         .add(HasName.NAME)
 *         .add(HasDescription.DESCRIPTION)
 *         .build();
 * }
 * </pre>
 *
 * @param <E> entity type
 */
public final class EntityFieldRegistry<E> {

    /** Fields a dictionary update skips unless the caller says otherwise. */
    public static final Set<String> DEFAULT_EXCLUDE = Set.of(
        HasIdentity.ID.name(),
        HasTimestamps.CREATED_AT.name(),
        HasTimestamps.UPDATED_AT.name());

    private final Map<String, EntityField<? super E, ?>> fields;

    private EntityFieldRegistry(Map<String, EntityField<? super E, ?>> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    /**
     * Starts a registry with {@code id}, {@code created_at} and {@code updated_at}.
     */
    public static <E extends HasIdentity & HasTimestamps> Builder<E> withAuditFields() {
        return EntityFieldRegistry.<E>builder()
            .add(HasIdentity.ID)
            .add(HasTimestamps.CREATED_AT)
            .add(HasTimestamps.UPDATED_AT);
    }

    // =========================================================================
    // Dictionary conversion
    // =========================================================================

    public Map<String, Object> toDict(E entity) {
        return toDict(entity, Set.of());
    }

    /**
     * Converts an entity to a dictionary in field declaration order.
     *
     * @param entity the entity
     * @param exclude field names to leave out
     * @return a new insertion-ordered map
     */
    public Map<String, Object> toDict(E entity, Set<String> exclude) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (EntityField<? super E, ?> field : fields.values()) {
            if (!exclude.contains(field.name())) {
                result.put(field.name(), field.read(entity));
            }
        }
        return result;
    }

    public Set<String> updateFromDict(E entity, Map<String, ?> data) {
        return updateFromDict(entity, data, DEFAULT_EXCLUDE);
    }

    /**
     * Writes dictionary values onto an entity.
     *
     * Keys that are excluded, unknown or read-only are skipped.
     *
     * @param entity the entity
     * @param data incoming values by field name
     * @param exclude field names to skip; null or empty falls back to {@link #DEFAULT_EXCLUDE}
     * @return the names of the fields whose value changed, in data order
     * @throws IllegalArgumentException if a value cannot be converted
     */
    public Set<String> updateFromDict(E entity, Map<String, ?> data, Set<String> exclude) {
        Set<String> skipped = exclude == null || exclude.isEmpty() ? DEFAULT_EXCLUDE : exclude;
        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (skipped.contains(key)) {
                continue;
            }
            EntityField<? super E, ?> field = fields.get(key);
            if (field == null || !field.isWritable()) {
                continue;
            }
            if (field.write(entity, entry.getValue())) {
                changed.add(key);
            }
        }
        return changed;
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    /**
     * Names of the fields a new row cannot do without.
     *
     * @return fields that are non-nullable and have no generated default
     */
    public List<String> requiredFields() {
        List<String> required = new ArrayList<>();
        for (EntityField<? super E, ?> field : fields.values()) {
            if (field.isRequired()) {
                required.add(field.name());
            }
        }
        return required;
    }

    public Optional<EntityField<? super E, ?>> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public static final class Builder<E> {

        private final Map<String, EntityField<? super E, ?>> fields = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Appends a field.
         *
         * @throws IllegalArgumentException if a field with the same name was already added
         */
        public Builder<E> add(EntityField<? super E, ?> field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate entity field: " + field.name());
            }
            return this;
        }

        public EntityFieldRegistry<E> build() {
            return new EntityFieldRegistry<>(fields);
        }
    }
}
