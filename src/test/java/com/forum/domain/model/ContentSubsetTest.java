package com.forum.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentSubset")
class ContentSubsetTest {

    @Test
    @DisplayName("Should resolve configured names")
    void shouldResolveConfiguredNames() {
        assertEquals(ContentSubset.SENSITIVE, ContentSubset.fromConfig("sensitive"));
        assertEquals(ContentSubset.NON_SENSITIVE, ContentSubset.fromConfig("non-sensitive"));
        assertEquals(ContentSubset.ALL, ContentSubset.fromConfig("all"));
    }

    @Test
    @DisplayName("Should fail fast on unknown names")
    void shouldFailFastOnUnknownName() {
        var ex = assertThrows(IllegalStateException.class, () -> ContentSubset.fromConfig("adult"));
        assertTrue(ex.getMessage().contains("adult"));
    }

    @Test
    @DisplayName("Should fail fast on a missing name")
    void shouldFailFastOnNull() {
        assertThrows(IllegalStateException.class, () -> ContentSubset.fromConfig(null));
    }
}
