package org.keywordtree.trie;

import java.util.Objects;

/**
 * One occurrence of a keyword in a searched text. Positions are inclusive character offsets.
 */
public class Emit {

    private final int start;

    private final int end;

    private final String keyword;

    public Emit(int start, int end, String keyword) {
        this.start = start;
        this.end = end;
        this.keyword = keyword;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getKeyword() {
        return keyword;
    }

    public int size() {
        return end - start + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Emit)) {
            return false;
        }
        Emit other = (Emit) o;
        return start == other.start && end == other.end && Objects.equals(keyword, other.keyword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, keyword);
    }

    @Override
    public String toString() {
        return start + ":" + end + "=" + keyword;
    }
}
