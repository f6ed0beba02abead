package com.larpmanager.server.domain;

import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.boot.model.naming.PhysicalNamingStrategyStandardImpl;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;

/**
 * Maps entity and property names onto snake_case tables and columns.
 *
 * Names that are already snake_case pass through unchanged, so explicit
 * {@code @Table}/{@code @Column} names keep working.
 *
 * @see TableNames#fromTypeName(String)
 */
public class SchemaNamingStrategy extends PhysicalNamingStrategyStandardImpl {

    @Override
    public Identifier toPhysicalTableName(Identifier logicalName, JdbcEnvironment context) {
        return snakeCase(logicalName);
    }

    @Override
    public Identifier toPhysicalColumnName(Identifier logicalName, JdbcEnvironment context) {
        return snakeCase(logicalName);
    }

    private static Identifier snakeCase(Identifier name) {
        if (name == null || name.isQuoted()) {
            return name;
        }
        return Identifier.toIdentifier(TableNames.fromTypeName(name.getText()));
    }
}
