package com.forum.infrastructure.config;

import com.forum.domain.model.ContentSubset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentSubsetResolver")
class ContentSubsetResolverTest {

    private static AppProperties properties(String defaultSubset, Map<String, String> byHost) {
        AppProperties properties = new AppProperties();
        properties.getDiscussions().setContentSubset(defaultSubset);
        properties.getDiscussions().setSubsetByHost(byHost);
        return properties;
    }

    @Test
    @DisplayName("Should use the host mapping, ignoring case")
    void shouldUseHostMapping() {
        ContentSubsetResolver resolver = new ContentSubsetResolver(
            properties("non-sensitive", Map.of("Sleazy.Example.org", "sensitive")));

        assertEquals(ContentSubset.SENSITIVE, resolver.resolve("sleazy.example.org"));
        assertEquals(ContentSubset.NON_SENSITIVE, resolver.resolve("forum.example.org"));
    }

    @Test
    @DisplayName("Should fall back to the default without a host")
    void shouldFallBackWithoutHost() {
        ContentSubsetResolver resolver = new ContentSubsetResolver(properties("all", Map.of()));

        assertEquals(ContentSubset.ALL, resolver.resolve(null));
    }

    @Test
    @DisplayName("Should refuse to start with an unknown default subset")
    void shouldFailOnUnknownDefault() {
        assertThrows(IllegalStateException.class,
            () -> new ContentSubsetResolver(properties("everything", Map.of())));
    }

    @Test
    @DisplayName("Should refuse to start with an unknown host subset")
    void shouldFailOnUnknownHostSubset() {
        assertThrows(IllegalStateException.class,
            () -> new ContentSubsetResolver(properties("all", Map.of("a.example.org", "spicy"))));
    }
}
