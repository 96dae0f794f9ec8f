package org.keywordtree.trie;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A state of the keyword tree. Before finalization the states form a plain prefix trie; afterwards
 * every state also carries its failure state (the longest strict suffix of its path that is also a
 * path in the trie) and the transitions inherited from it.
 *
 * <p>States are created and owned by {@link KeywordTree}. {@code parent} and {@code failure} are back
 * references into the same tree.
 */
public class State {

    private final int id;

    private final Integer symbol;

    private final State parent;

    private final Map<Integer, State> transitions = new HashMap<Integer, State>();

    private boolean success;

    private String matchedKeyword;

    private State failure;

    State(int id, Integer symbol, State parent) {
        this.id = id;
        this.symbol = symbol;
        this.parent = parent;
    }

    public int getId() {
        return id;
    }

    /**
     * @return the code point consumed to reach this state from its parent, {@code null} for the root
     */
    public Integer getSymbol() {
        return symbol;
    }

    public State getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMatchedKeyword() {
        return matchedKeyword;
    }

    public State nextState(int codePoint) {
        return transitions.get(codePoint);
    }

    public State failure() {
        return failure;
    }

    public boolean hasFailure() {
        return failure != null;
    }

    /**
     * After finalization this includes the transitions inherited from the failure state, whose targets
     * lie outside this state's subtree.
     */
    public Collection<State> getTransitionTargets() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    /**
     * True if {@code child} was created from this state, as opposed to a transition inherited from the
     * failure state.
     */
    boolean isParentOf(State child) {
        return child.parent == this;
    }

    void addTransition(int codePoint, State target) {
        transitions.put(codePoint, target);
    }

    void markSuccess(String keyword) {
        this.success = true;
        this.matchedKeyword = keyword;
    }

    void setFailure(State failState) {
        if (this.failure != null) {
            throw new IllegalStateException("Failure state of state " + id + " has already been set");
        }
        this.failure = failState;
    }

    /**
     * Copies every transition of {@code failState} for a symbol this state has no transition for.
     */
    void inheritTransitions(State failState) {
        for (Map.Entry<Integer, State> entry : failState.transitions.entrySet()) {
            transitions.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public String toString() {
        String symbolText = symbol == null ? null : new String(Character.toChars(symbol));
        return "State{id=" + id + ", symbol=" + symbolText + ", success=" + success
                + (success ? ", keyword=" + matchedKeyword : "") + "}";
    }
}
