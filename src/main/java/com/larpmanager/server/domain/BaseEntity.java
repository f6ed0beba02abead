package com.larpmanager.server.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PreUpdate;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Base class for every persisted entity.
 *
 * Provides:
 * - a random UUID primary key, assigned at construction and never updated
 * - {@code created_at}/{@code updated_at} audit timestamps (timestamp with time zone);
 *   only {@code updated_at} has a setter
 * - placement in the {@value #SCHEMA} schema
 * - dictionary conversion driven by the subclass's {@link EntityFieldRegistry}
 *
 * Table and column names are derived from the Java names by
 * {@link SchemaNamingStrategy}, so {@code GameSession.maxPlayers} lives in
 * {@code larp_manager.game_session.max_players}.
 *
 * Example:
 * <pre>
 * {@code
 * @Entity
 * public class Game extends BaseEntity<Game> implements HasName {
 *
 *     private static final EntityFieldRegistry<Game> FIELDS =
 *         EntityFieldRegistry.<Game>withAuditFields().add(HasName.NAME).build();
 *
 *     @Column(nullable = false, length = HasName.MAX_LENGTH)
 *     private String name;
 *
 *     @Override
 *     protected EntityFieldRegistry<Game> fields() {
 *         return FIELDS;
 *     }
 * }
 * }
 * </pre>
 *
 * @param <E> the concrete entity type
 */
@Getter
@Setter
@MappedSuperclass
public abstract class BaseEntity<E extends BaseEntity<E>> implements HasIdentity, HasTimestamps {

    /** Schema every entity table lives in. */
    public static final String SCHEMA = "larp_manager";

    @Id
    @Setter(AccessLevel.NONE)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id = UUID.randomUUID();

    @Setter(AccessLevel.NONE)
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected BaseEntity() {
        OffsetDateTime now = now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Field registry of the concrete type, in declaration order.
     *
     * @return the registry, normally a static constant
     */
    protected abstract EntityFieldRegistry<E> fields();

    @PreUpdate
    protected void onUpdate() {
        touch();
    }

    /** Moves {@code updated_at} to the current instant. */
    public void touch() {
        this.updatedAt = now();
    }

    // =========================================================================
    // Dictionary conversion
    // =========================================================================

    public Map<String, Object> toDict() {
        return fields().toDict(self());
    }

    /**
     * Converts this entity to a dictionary.
     *
     * Identifiers and timestamps are rendered as strings.
     *
     * @param exclude field names to leave out
     * @return field values by name, in declaration order
     */
    public Map<String, Object> toDict(Set<String> exclude) {
        return fields().toDict(self(), exclude);
    }

    /**
     * Updates this entity from a dictionary, skipping {@code id},
     * {@code created_at} and {@code updated_at}.
     *
     * @param data incoming values by field name
     * @return names of the fields that changed
     */
    public Set<String> updateFromDict(Map<String, ?> data) {
        return updateFromDict(data, EntityFieldRegistry.DEFAULT_EXCLUDE);
    }

    /**
     * Updates this entity from a dictionary.
     *
     * Unknown keys are ignored. {@code updated_at} is refreshed when any
     * field changed, unless the update set it explicitly.
     *
     * @param data incoming values by field name
     * @param exclude field names to skip; null or empty means the default set
     * @return names of the fields that changed
     */
    public Set<String> updateFromDict(Map<String, ?> data, Set<String> exclude) {
        Set<String> changed = fields().updateFromDict(self(), data, exclude);
        if (!changed.isEmpty() && !changed.contains(HasTimestamps.UPDATED_AT.name())) {
            touch();
        }
        return changed;
    }

    public List<String> fieldNames() {
        return fields().fieldNames();
    }

    public List<String> requiredFields() {
        return fields().requiredFields();
    }

    @SuppressWarnings("unchecked")
    private E self() {
        return (E) this;
    }

    // Microseconds: the resolution PostgreSQL stores
    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + id + ")";
    }
}
