package org.keywordtree.lines;

import java.util.Collection;
import java.util.Locale;

/**
 * How the presence of several keywords in a line is combined.
 */
public enum Connector {

    AND {
        @Override
        public boolean test(Collection<String> keywords, Collection<String> found) {
            return found.containsAll(keywords);
        }
    },

    OR {
        @Override
        public boolean test(Collection<String> keywords, Collection<String> found) {
            for (String keyword : keywords) {
                if (found.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    };

    public abstract boolean test(Collection<String> keywords, Collection<String> found);

    public static Connector fromString(String value) {
        if (value != null) {
            for (Connector connector : values()) {
                if (connector.name().equals(value.toUpperCase(Locale.ROOT))) {
                    return connector;
                }
            }
        }
        throw new IllegalArgumentException("Unknown connector '" + value + "', expected 'and' or 'or'");
    }
}
