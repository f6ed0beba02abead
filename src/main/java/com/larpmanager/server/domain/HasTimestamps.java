package com.larpmanager.server.domain;

import java.time.OffsetDateTime;

/**
 * Entity carrying audit timestamps.
 *
 * {@code created_at} never changes after construction; {@code updated_at}
 * moves forward on every modification.
 */
public interface HasTimestamps {

    EntityField<HasTimestamps, OffsetDateTime> CREATED_AT =
        EntityField.timestamp("created_at", HasTimestamps::getCreatedAt).withDefault();

    EntityField<HasTimestamps, OffsetDateTime> UPDATED_AT = EntityField.timestamp(
        "updated_at", HasTimestamps::getUpdatedAt, HasTimestamps::setUpdatedAt).withDefault();

    OffsetDateTime getCreatedAt();

    OffsetDateTime getUpdatedAt();

    void setUpdatedAt(OffsetDateTime updatedAt);
}
