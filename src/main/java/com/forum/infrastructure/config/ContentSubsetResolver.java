package com.forum.infrastructure.config;

import com.forum.domain.model.ContentSubset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the content subset a request is served from. Each host may be bound to its own subset;
 * any other host gets the default one.
 *
 * <p>All configured values are resolved when the bean is created, so a typo stops the application
 * from starting instead of failing requests.
 */
@Component
public class ContentSubsetResolver {

    private static final Logger log = LoggerFactory.getLogger(ContentSubsetResolver.class);

    private final ContentSubset defaultSubset;
    private final Map<String, ContentSubset> byHost;

    public ContentSubsetResolver(AppProperties appProperties) {
        AppProperties.Discussions config = appProperties.getDiscussions();
        this.defaultSubset = ContentSubset.fromConfig(config.getContentSubset());
        this.byHost = new HashMap<>();
        config.getSubsetByHost().forEach((host, subset) ->
            byHost.put(host.toLowerCase(Locale.ROOT), ContentSubset.fromConfig(subset)));
        log.info("Content subsets configured: default={}, hosts={}", defaultSubset.configValue(), byHost.keySet());
    }

    public ContentSubset resolve(String host) {
        if (host == null) {
            return defaultSubset;
        }
        return byHost.getOrDefault(host.toLowerCase(Locale.ROOT), defaultSubset);
    }
}
