package com.larpmanager.server.domain;

/**
 * Derives snake_case table and column names from Java type and property names.
 */
public final class TableNames {

    private TableNames() {
    }

    /**
     * Inserts {@code _} before every non-leading uppercase letter and lowercases
     * the result: {@code GameSession} becomes {@code game_session},
     * {@code ABTest} becomes {@code a_b_test}.
     *
     * @param typeName a Java type or property name
     * @return the snake_case name
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static String fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
        StringBuilder result = new StringBuilder(typeName.length() + 4);
        for (int i = 0; i < typeName.length(); i++) {
            char c = typeName.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                result.append('_');
            }
            result.append(Character.toLowerCase(c));
        }
        return result.toString();
    }

    public static String forEntity(Class<?> entityType) {
        return fromTypeName(entityType.getSimpleName());
    }
}
