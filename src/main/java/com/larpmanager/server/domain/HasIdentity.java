package com.larpmanager.server.domain;

import java.util.UUID;

/**
 * Entity identified by a random UUID, fixed at construction.
 */
public interface HasIdentity {

    EntityField<HasIdentity, UUID> ID = EntityField.uuid("id", HasIdentity::getId).withDefault();

    UUID getId();
}
