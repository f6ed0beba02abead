package com.larpmanager.server.domain;

/**
 * Entity with a human-readable name.
 *
 * Implementations map {@code name} as a non-null column of at most
 * {@link #MAX_LENGTH} characters.
 */
public interface HasName {

    int MAX_LENGTH = 255;

    EntityField<HasName, String> NAME = EntityField.string("name", HasName::getName, HasName::setName);

    String getName();

    void setName(String name);

    /**
     * Renders {@code TypeName(name)}.
     *
     * @param entity the named entity
     * @return the display form
     */
    static String display(HasName entity) {
        return entity.getClass().getSimpleName() + "(" + entity.getName() + ")";
    }
}
