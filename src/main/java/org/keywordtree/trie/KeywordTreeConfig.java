package org.keywordtree.trie;

public class KeywordTreeConfig {

    private boolean caseInsensitive = false;

    public KeywordTreeConfig() {
    }

    public KeywordTreeConfig(KeywordTreeConfig other) {
        this.caseInsensitive = other.caseInsensitive;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public void setCaseInsensitive(boolean caseInsensitive) {
        this.caseInsensitive = caseInsensitive;
    }
}
