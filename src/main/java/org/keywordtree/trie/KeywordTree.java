package org.keywordtree.trie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aho-Corasick keyword tree. Keywords are added first, then {@link #finalizeTree()} computes the
 * failure states once, after which the tree is read-only and can be searched any number of times,
 * from any number of threads.
 *
 * <p>Based on the Aho-Corasick white paper, Bell technologies: "Efficient string matching: an aid to
 * bibliographic search" (1975).
 */
public class KeywordTree {

    private static final Logger logger = LoggerFactory.getLogger(KeywordTree.class);

    private final KeywordTreeConfig config;

    // Owns every state; a state's id is its index.
    private final List<State> states = new ArrayList<State>();

    private final State rootState;

    private int keywordCount = 0;

    private volatile boolean finalized = false;

    public KeywordTree(KeywordTreeConfig config) {
        this.config = new KeywordTreeConfig(config);
        this.rootState = createState(null, null);
    }

    public KeywordTree(boolean caseInsensitive) {
        this(configFor(caseInsensitive));
    }

    public KeywordTree() {
        this(new KeywordTreeConfig());
    }

    private static KeywordTreeConfig configFor(boolean caseInsensitive) {
        KeywordTreeConfig config = new KeywordTreeConfig();
        config.setCaseInsensitive(caseInsensitive);
        return config;
    }

    /**
     * Adds a keyword. Empty and {@code null} keywords are ignored, adding a keyword twice has no further
     * effect. In case-insensitive mode the keyword is matched in lower case, code point by code point, but
     * reported as given.
     *
     * @throws IllegalStateException if the tree has been finalized
     */
    public void add(String keyword) {
        if (finalized) {
            throw new IllegalStateException("KeywordTree has been finalized. No more keyword additions allowed");
        }
        if (keyword == null || keyword.length() == 0) {
            return;
        }
        State currentState = this.rootState;
        for (int offset = 0; offset < keyword.length(); ) {
            int codePoint = keyword.codePointAt(offset);
            currentState = addState(currentState, normalize(codePoint));
            offset += Character.charCount(codePoint);
        }
        if (!currentState.isSuccess()) {
            keywordCount++;
        }
        currentState.markSuccess(keyword);
    }

    public void addAll(Collection<String> keywords) {
        for (String keyword : keywords) {
            add(keyword);
        }
    }

    /**
     * Computes the failure state of every state and merges the failure transitions into each state, so
     * that a search takes exactly one transition per character.
     *
     * @throws IllegalStateException if the tree has already been finalized
     */
    public void finalizeTree() {
        if (finalized) {
            throw new IllegalStateException("KeywordTree has already been finalized");
        }
        constructFailureStates();
        this.finalized = true;
        logger.debug("Finalized keyword tree with {} keywords and {} states", keywordCount, states.size());
    }

    /**
     * Searches the text for all occurrences of the keywords, left to right by end position. Occurrences
     * ending at the same position are reported longest first.
     *
     * @return the matched keywords, one entry per occurrence, empty if nothing matched
     * @throws IllegalStateException if the tree has not been finalized
     */
    public List<String> searchAll(String text) {
        checkFinalized();

        State currentState = this.rootState;
        List<String> matches = new ArrayList<String>();
        for (int position = 0; position < text.length(); ) {
            int codePoint = text.codePointAt(position);
            currentState = getState(currentState, normalize(codePoint));
            for (State state = currentState; !state.isRoot(); state = state.failure()) {
                if (state.isSuccess()) {
                    matches.add(state.getMatchedKeyword());
                }
            }
            position += Character.charCount(codePoint);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Searched {} characters, {} matches", text.length(), matches.size());
        }
        return matches;
    }

    /**
     * Same as {@link #searchAll(String)}, with the position of every occurrence. Positions are {@code char}
     * offsets into {@code text}; an occurrence ending in a supplementary character ends at its low surrogate.
     */
    public List<Emit> parseText(String text) {
        checkFinalized();

        State currentState = this.rootState;
        List<Emit> collectedEmits = new ArrayList<Emit>();
        for (int position = 0; position < text.length(); ) {
            int codePoint = text.codePointAt(position);
            currentState = getState(currentState, normalize(codePoint));
            position += Character.charCount(codePoint);
            storeEmits(position - 1, currentState, collectedEmits);
        }
        return collectedEmits;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public boolean isCaseInsensitive() {
        return config.isCaseInsensitive();
    }

    /**
     * @return the number of states, root included
     */
    public int size() {
        return states.size();
    }

    /**
     * @return the number of distinct keywords, after case normalization
     */
    public int getKeywordCount() {
        return keywordCount;
    }

    State getRootState() {
        return rootState;
    }

    List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    private State createState(Integer symbol, State parent) {
        State state = new State(states.size(), symbol, parent);
        states.add(state);
        return state;
    }

    private State addState(State currentState, int codePoint) {
        State nextState = currentState.nextState(codePoint);
        if (nextState == null) {
            nextState = createState(codePoint, currentState);
            currentState.addTransition(codePoint, nextState);
        }
        return nextState;
    }

    private int normalize(int codePoint) {
        return config.isCaseInsensitive() ? Character.toLowerCase(codePoint) : codePoint;
    }

    private void checkFinalized() {
        if (!finalized) {
            throw new IllegalStateException("KeywordTree has not been finalized. Call finalizeTree() first");
        }
    }

    // Unknown symbols fall back to the root's transition, then to the root itself.
    private State getState(State currentState, int codePoint) {
        State newCurrentState = currentState.nextState(codePoint);
        if (newCurrentState == null) {
            newCurrentState = this.rootState.nextState(codePoint);
        }
        return newCurrentState == null ? this.rootState : newCurrentState;
    }

    private void constructFailureStates() {
        BitSet processed = new BitSet(states.size());
        Queue<State> queue = new ArrayDeque<State>();

        rootState.setFailure(rootState);
        processed.set(rootState.getId());
        queue.add(rootState);

        while (!queue.isEmpty()) {
            State currentState = queue.remove();

            // Inherited transitions point outside this subtree, only the children are visited here
            for (State targetState : new ArrayList<State>(currentState.getTransitionTargets())) {
                if (!currentState.isParentOf(targetState)) {
                    continue;
                }
                // Already set when a failure state was resolved ahead of the traversal
                if (!processed.get(targetState.getId())) {
                    constructFailureState(targetState, processed);
                }
                queue.add(targetState);
            }
        }
    }

    private void constructFailureState(State state, BitSet processed) {
        int symbol = state.getSymbol();
        State traceFailureState = state.getParent().failure();
        State newFailureState;
        while (true) {
            State candidate = traceFailureState.nextState(symbol);
            if (candidate != null && candidate != state) {
                newFailureState = candidate;
                break;
            }
            if (traceFailureState.isRoot()) {
                newFailureState = this.rootState;
                break;
            }
            traceFailureState = traceFailureState.failure();
        }
        state.setFailure(newFailureState);
        processed.set(state.getId());

        if (newFailureState.isRoot()) {
            return;
        }
        // Breadth-first order resolves every shallower state first, so this only runs if the traversal
        // order changes
        if (!newFailureState.hasFailure()) {
            constructFailureState(newFailureState, processed);
        }
        state.inheritTransitions(newFailureState);
    }

    private void storeEmits(int position, State currentState, List<Emit> collectedEmits) {
        for (State state = currentState; !state.isRoot(); state = state.failure()) {
            if (state.isSuccess()) {
                String keyword = state.getMatchedKeyword();
                collectedEmits.add(new Emit(position - keyword.length() + 1, position, keyword));
            }
        }
    }
}
