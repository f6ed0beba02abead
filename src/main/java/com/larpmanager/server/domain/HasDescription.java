package com.larpmanager.server.domain;

/**
 * Entity with an optional free-text description of at most {@link #MAX_LENGTH} characters.
 */
public interface HasDescription {

    int MAX_LENGTH = 1000;

    EntityField<HasDescription, String> DESCRIPTION =
        EntityField.string("description", HasDescription::getDescription, HasDescription::setDescription)
            .nullable();

    String getDescription();

    void setDescription(String description);
}
