package com.forum.domain.filter;

import com.forum.domain.model.DiscussionCategory;

public sealed interface CategoryFilter {

    String NO_SCRIPTS_PARAM = "no-scripts";

    /**
     * Parameter value that reproduces this filter.
     */
    String param();

    record Keyed(DiscussionCategory category) implements CategoryFilter {
        @Override
        public String param() {
            return category.categoryKey();
        }
    }

    /**
     * Pseudo-category matching every category not tied to a script.
     */
    record NoScripts() implements CategoryFilter {
        public static final NoScripts INSTANCE = new NoScripts();

        @Override
        public String param() {
            return NO_SCRIPTS_PARAM;
        }
    }
}
