package com.larpmanager.server.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Method;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

/**
 * Dictionary conversion and audit conventions shared by every entity.
 */
class BaseEntityTest {

    // =========================================================================
    // Construction
    // =========================================================================

    @Test
    void newEntity_ShouldHaveIdAndEqualTimestamps() {
        // When
        GameSession game = new GameSession("Winter Court");

        // Then
        assertThat(game.getId()).isNotNull();
        assertThat(game.getCreatedAt()).isNotNull();
        assertThat(game.getUpdatedAt()).isEqualTo(game.getCreatedAt());
        assertThat(game.getCreatedAt().getOffset()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void newEntities_ShouldNotShareIds() {
        assertThat(new GameSession("a").getId()).isNotEqualTo(new GameSession("b").getId());
    }

    @Test
    void toString_ShouldRenderTypeAndId() {
        GameSession game = new GameSession("Winter Court");

        assertThat(game.toString()).isEqualTo("GameSession(" + game.getId() + ")");
        assertThat(HasName.display(game)).isEqualTo("GameSession(Winter Court)");
    }

    // =========================================================================
    // toDict
    // =========================================================================

    @Test
    void toDict_ShouldRenderIdentifiersAndTimestampsAsStrings() {
        // Given
        GameSession game = new GameSession("Winter Court");
        game.setMaxPlayers(40);

        // When
        Map<String, Object> dict = game.toDict();

        // Then
        assertThat(dict).containsOnlyKeys("id", "created_at", "updated_at", "name", "description", "max_players");
        assertThat(dict.get("id")).isEqualTo(game.getId().toString());
        assertThat(dict.get("created_at")).isInstanceOf(String.class);
        assertThat(OffsetDateTime.parse((String) dict.get("created_at"))).isEqualTo(game.getCreatedAt());
        assertThat(dict.get("name")).isEqualTo("Winter Court");
        assertThat(dict.get("description")).isNull();
        assertThat(dict.get("max_players")).isEqualTo(40);
    }

    @Test
    void toDict_ShouldKeepFieldDeclarationOrder() {
        GameSession game = new GameSession("Winter Court");

        assertThat(game.toDict().keySet())
            .containsExactly("id", "created_at", "updated_at", "name", "description", "max_players");
    }

    @Test
    void toDict_WithExclude_ShouldDropExcludedFields() {
        // Given
        GameSession game = new GameSession("Winter Court");

        // When
        Map<String, Object> dict = game.toDict(Set.of("id"));

        // Then
        assertThat(dict).doesNotContainKey("id");
        assertThat(dict).containsKeys("created_at", "updated_at", "name");
    }

    // =========================================================================
    // updateFromDict
    // =========================================================================

    @Test
    void updateFromDict_DefaultExclusions_ShouldKeepIdAndSetName() {
        // Given
        GameSession game = new GameSession("Winter Court");
        UUID originalId = game.getId();
        Map<String, Object> data = new HashMap<>();
        data.put("id", UUID.randomUUID().toString());
        data.put("name", "Summer Court");

        // When
        Set<String> changed = game.updateFromDict(data);

        // Then
        assertThat(game.getId()).isEqualTo(originalId);
        assertThat(game.getName()).isEqualTo("Summer Court");
        assertThat(changed).containsExactly("name");
    }

    @Test
    void updateFromDict_EmptyExclude_ShouldFallBackToDefaultExclusions() {
        // Given
        GameSession game = new GameSession("Winter Court");
        UUID originalId = game.getId();
        OffsetDateTime originalCreatedAt = game.getCreatedAt();
        Map<String, Object> data = new HashMap<>();
        data.put("id", UUID.randomUUID().toString());
        data.put("created_at", "2020-01-01T00:00:00Z");
        data.put("updated_at", "2020-01-01T00:00:00Z");
        data.put("name", "Summer Court");

        // When
        Set<String> changed = game.updateFromDict(data, Set.of());

        // Then
        assertThat(game.getId()).isEqualTo(originalId);
        assertThat(game.getCreatedAt()).isEqualTo(originalCreatedAt);
        assertThat(game.getUpdatedAt()).isAfterOrEqualTo(originalCreatedAt);
        assertThat(game.getName()).isEqualTo("Summer Court");
        assertThat(changed).containsExactly("name");
    }

    @Test
    void updateFromDict_ExcludeWithoutIdentity_ShouldStillKeepIdAndCreatedAt() {
        // Given
        GameSession game = new GameSession("Winter Court");
        UUID originalId = game.getId();
        OffsetDateTime originalCreatedAt = game.getCreatedAt();

        // When - only description is excluded, so id and created_at reach the registry
        Set<String> changed = game.updateFromDict(
            Map.of("id", UUID.randomUUID(), "created_at", "2020-01-01T00:00:00Z", "name", "Summer Court"),
            Set.of("description"));

        // Then
        assertThat(game.getId()).isEqualTo(originalId);
        assertThat(game.getCreatedAt()).isEqualTo(originalCreatedAt);
        assertThat(changed).containsExactly("name");
    }

    @Test
    void identityAndCreatedAt_ShouldHaveNoPublicSetters() {
        // When
        List<String> methods = Arrays.stream(GameSession.class.getMethods())
            .map(Method::getName)
            .collect(Collectors.toList());

        // Then
        assertThat(methods).doesNotContain("setId", "setCreatedAt");
        assertThat(methods).contains("setUpdatedAt", "setName");
        assertThat(HasIdentity.ID.isWritable()).isFalse();
        assertThat(HasTimestamps.CREATED_AT.isWritable()).isFalse();
        assertThat(HasTimestamps.UPDATED_AT.isWritable()).isTrue();
    }

    @Test
    void updateFromDict_ShouldIgnoreUnknownKeys() {
        // Given
        GameSession game = new GameSession("Winter Court");

        // When
        Set<String> changed = game.updateFromDict(Map.of("dragons", 3));

        // Then
        assertThat(changed).isEmpty();
        assertThat(game.toDict()).doesNotContainKey("dragons");
    }

    @Test
    void updateFromDict_AnyChange_ShouldTouchUpdatedAt() {
        // Given
        GameSession game = new GameSession("Winter Court");
        OffsetDateTime past = OffsetDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        game.setUpdatedAt(past);

        // When
        game.updateFromDict(Map.of("description", "Snowbound castle"));

        // Then
        assertThat(game.getUpdatedAt()).isAfter(past);
        assertThat(game.getCreatedAt()).isNotEqualTo(past);
    }

    @Test
    void updateFromDict_NoChange_ShouldNotTouchUpdatedAt() {
        // Given
        GameSession game = new GameSession("Winter Court");
        OffsetDateTime past = OffsetDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        game.setUpdatedAt(past);

        // When
        Set<String> changed = game.updateFromDict(Map.of("name", "Winter Court"));

        // Then
        assertThat(changed).isEmpty();
        assertThat(game.getUpdatedAt()).isEqualTo(past);
    }

    @Test
    void updateFromDict_ExplicitUpdatedAt_ShouldKeepTheGivenValue() {
        // Given
        GameSession game = new GameSession("Winter Court");
        Instant stamp = Instant.parse("2024-05-01T10:15:30Z");

        // When
        game.updateFromDict(Map.of("updated_at", stamp, "name", "Spring Court"), Set.of("id"));

        // Then
        assertThat(game.getUpdatedAt()).isEqualTo(stamp.atOffset(ZoneOffset.UTC));
    }

    @Test
    void updateFromDict_ShouldCoerceIntegralNumbers() {
        // Given
        GameSession game = new GameSession("Winter Court");

        // When
        game.updateFromDict(Map.of("max_players", 75L));

        // Then
        assertThat(game.getMaxPlayers()).isEqualTo(75);
    }

    @Test
    void updateFromDict_NullForNullableField_ShouldClearIt() {
        // Given
        GameSession game = new GameSession("Winter Court");
        game.setDescription("Snowbound castle");
        Map<String, Object> data = new HashMap<>();
        data.put("description", null);

        // When
        Set<String> changed = game.updateFromDict(data);

        // Then
        assertThat(changed).containsExactly("description");
        assertThat(game.getDescription()).isNull();
    }

    @Test
    void updateFromDict_NullForRequiredField_ShouldThrow() {
        GameSession game = new GameSession("Winter Court");
        Map<String, Object> data = new HashMap<>();
        data.put("name", null);

        assertThatThrownBy(() -> game.updateFromDict(data))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }

    @Test
    void updateFromDict_WrongType_ShouldThrow() {
        GameSession game = new GameSession("Winter Court");

        assertThatThrownBy(() -> game.updateFromDict(Map.of("max_players", "many")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max_players");
        assertThatThrownBy(() -> game.updateFromDict(Map.of("max_players", Long.MAX_VALUE)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    @Test
    void requiredFields_ShouldListOnlyNonNullableFieldsWithoutDefault() {
        assertThat(new GameSession("Winter Court").requiredFields()).containsExactly("name");
    }

    @Test
    void fieldNames_ShouldListAuditFieldsFirst() {
        assertThat(new GameSession("Winter Court").fieldNames())
            .containsExactly("id", "created_at", "updated_at", "name", "description", "max_players");
    }
}
