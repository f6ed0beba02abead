package com.larpmanager.server.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One named, typed property of an entity, with explicit accessors.
 *
 * <p>Fields are declared once per type as constants and collected into an
 * {@link EntityFieldRegistry}, which drives dictionary conversion without
 * reflection. Fields are non-nullable and without a default unless marked
 * otherwise.
 *
 * @param <E> entity type the field belongs to
 * @param <V> value type
 */
public final class EntityField<E, V> {

    private final String name;
    private final FieldType type;
    private final Class<V> javaType;
    private final Function<? super E, ? extends V> getter;
    private final BiConsumer<? super E, ? super V> setter;
    private final boolean nullable;
    private final boolean hasDefault;

    private EntityField(
            String name,
            FieldType type,
            Class<V> javaType,
            Function<? super E, ? extends V> getter,
            BiConsumer<? super E, ? super V> setter,
            boolean nullable,
            boolean hasDefault) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.javaType = javaType;
        this.getter = Objects.requireNonNull(getter, "getter");
        this.setter = setter;
        this.nullable = nullable;
        this.hasDefault = hasDefault;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static <E> EntityField<E, UUID> uuid(
            String name, Function<E, UUID> getter, BiConsumer<E, UUID> setter) {
        return new EntityField<>(name, FieldType.UUID, UUID.class, getter, setter, false, false);
    }

    /** Read-only UUID field. */
    public static <E> EntityField<E, UUID> uuid(String name, Function<E, UUID> getter) {
        return new EntityField<>(name, FieldType.UUID, UUID.class, getter, null, false, false);
    }

    public static <E> EntityField<E, OffsetDateTime> timestamp(
            String name, Function<E, OffsetDateTime> getter, BiConsumer<E, OffsetDateTime> setter) {
        return new EntityField<>(name, FieldType.TIMESTAMP, OffsetDateTime.class, getter, setter, false, false);
    }

    /** Read-only timestamp field. */
    public static <E> EntityField<E, OffsetDateTime> timestamp(String name, Function<E, OffsetDateTime> getter) {
        return new EntityField<>(name, FieldType.TIMESTAMP, OffsetDateTime.class, getter, null, false, false);
    }

    public static <E> EntityField<E, String> string(
            String name, Function<E, String> getter, BiConsumer<E, String> setter) {
        return new EntityField<>(name, FieldType.STRING, String.class, getter, setter, false, false);
    }

    public static <E> EntityField<E, Integer> integer(
            String name, Function<E, Integer> getter, BiConsumer<E, Integer> setter) {
        return new EntityField<>(name, FieldType.INTEGER, Integer.class, getter, setter, false, false);
    }

    public static <E> EntityField<E, Boolean> bool(
            String name, Function<E, Boolean> getter, BiConsumer<E, Boolean> setter) {
        return new EntityField<>(name, FieldType.BOOLEAN, Boolean.class, getter, setter, false, false);
    }

    /** Copy of this field that accepts null. */
    public EntityField<E, V> nullable() {
        return new EntityField<>(name, type, javaType, getter, setter, true, hasDefault);
    }

    /** Copy of this field whose value is generated when the entity is created. */
    public EntityField<E, V> withDefault() {
        return new EntityField<>(name, type, javaType, getter, setter, nullable, true);
    }

    /** Copy of this field that dictionary updates never write. */
    public EntityField<E, V> readOnly() {
        return new EntityField<>(name, type, javaType, getter, null, nullable, hasDefault);
    }

    // =========================================================================
    // Access
    // =========================================================================

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public boolean isWritable() {
        return setter != null;
    }

    /** A field is required when it can be neither null nor generated. */
    public boolean isRequired() {
        return !nullable && !hasDefault;
    }

    public V get(E entity) {
        return getter.apply(entity);
    }

    /**
     * Reads the value in dictionary form.
     *
     * @param entity the entity
     * @return the converted value
     * @see FieldType#toDictValue(Object)
     */
    public Object read(E entity) {
        return type.toDictValue(getter.apply(entity));
    }

    /**
     * Writes a dictionary value onto the entity.
     *
     * @param entity the entity
     * @param raw the incoming value
     * @return true if the stored value changed
     * @throws IllegalArgumentException if the value has the wrong type or is null for a non-nullable field
     * @throws IllegalStateException if the field is read-only
     */
    public boolean write(E entity, Object raw) {
        if (setter == null) {
            throw new IllegalStateException("Field '" + name + "' is read-only");
        }
        V value = javaType.cast(type.coerce(name, raw));
        if (value == null && !nullable) {
            throw new IllegalArgumentException("Field '" + name + "' must not be null");
        }
        if (Objects.equals(getter.apply(entity), value)) {
            return false;
        }
        setter.accept(entity, value);
        return true;
    }

    @Override
    public String toString() {
        return "EntityField[" + name + ": " + type + (nullable ? ", nullable" : "") + "]";
    }
}
