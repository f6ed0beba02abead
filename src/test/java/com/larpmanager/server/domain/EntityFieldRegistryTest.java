package com.larpmanager.server.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class EntityFieldRegistryTest {

    private static final EntityField<GameSession, String> LOCKED_NAME =
        EntityField.string("name", GameSession::getName, GameSession::setName).readOnly();

    @Test
    void builder_DuplicateName_ShouldThrow() {
        EntityFieldRegistry.Builder<GameSession> builder = EntityFieldRegistry.<GameSession>builder()
            .add(HasName.NAME);

        assertThatThrownBy(() -> builder.add(LOCKED_NAME))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Duplicate entity field: name");
    }

    @Test
    void updateFromDict_ReadOnlyField_ShouldBeSkipped() {
        // Given
        EntityFieldRegistry<GameSession> registry = EntityFieldRegistry.<GameSession>builder()
            .add(LOCKED_NAME)
            .add(GameSession.MAX_PLAYERS)
            .build();
        GameSession game = new GameSession("Winter Court");

        // When
        Set<String> changed = registry.updateFromDict(game, Map.of("name", "Other", "max_players", 12));

        // Then
        assertThat(changed).containsExactly("max_players");
        assertThat(game.getName()).isEqualTo("Winter Court");
    }

    @Test
    void readOnlyField_DirectWrite_ShouldThrow() {
        assertThatThrownBy(() -> LOCKED_NAME.write(new GameSession("Winter Court"), "Other"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void field_ShouldExposeDeclaredMetadata() {
        EntityFieldRegistry<GameSession> registry = GameSession.FIELDS;

        assertThat(registry.field("id")).hasValueSatisfying(field -> {
            assertThat(field.type()).isEqualTo(FieldType.UUID);
            assertThat(field.hasDefault()).isTrue();
            assertThat(field.isRequired()).isFalse();
        });
        assertThat(registry.field("description")).hasValueSatisfying(field ->
            assertThat(field.isNullable()).isTrue());
        assertThat(registry.field("missing")).isEmpty();
    }

    @Test
    void fieldNames_ShouldBeImmutable() {
        assertThatThrownBy(() -> GameSession.FIELDS.fieldNames().add("extra"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fieldType_Timestamp_ShouldRejectUnparseableText() {
        assertThatThrownBy(() -> FieldType.TIMESTAMP.coerce("created_at", "yesterday"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("created_at");
    }

    @Test
    void fieldType_Boolean_ShouldPassThroughBooleans() {
        assertThat(FieldType.BOOLEAN.coerce("active", Boolean.TRUE)).isEqualTo(Boolean.TRUE);
        assertThat(FieldType.BOOLEAN.toDictValue(false)).isEqualTo(false);
    }
}
