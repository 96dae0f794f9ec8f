package org.keywordtree.trie;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

/**
 * Compares the automaton against checking every keyword at every end position.
 */
public class KeywordTreeBruteForceTest {

    private static final List<String> CLASSIC_KEYWORDS = Arrays.asList("a", "ab", "bab", "bc", "bca", "c", "caa");

    private static List<Emit> bruteForce(Set<String> keywords, String text) {
        List<String> longestFirst = new ArrayList<String>(keywords);
        longestFirst.sort(Comparator.comparingInt(String::length).reversed());
        List<Emit> emits = new ArrayList<Emit>();
        for (int end = 0; end < text.length(); end++) {
            for (String keyword : longestFirst) {
                int start = end - keyword.length() + 1;
                if (start >= 0 && text.startsWith(keyword, start)) {
                    emits.add(new Emit(start, end, keyword));
                }
            }
        }
        return emits;
    }

    private static KeywordTree build(Iterable<String> keywords) {
        KeywordTree tree = new KeywordTree();
        for (String keyword : keywords) {
            tree.add(keyword);
        }
        tree.finalizeTree();
        return tree;
    }

    @Test
    public void classicExample() {
        KeywordTree tree = build(CLASSIC_KEYWORDS);
        Assert.assertEquals(Arrays.asList("a", "ab", "bc", "c", "c", "a", "ab"), tree.searchAll("abccab"));
        Assert.assertEquals(bruteForce(new LinkedHashSet<String>(CLASSIC_KEYWORDS), "abccab"), tree.parseText("abccab"));
    }

    @Test
    public void classicExampleFailureStates() {
        KeywordTree tree = build(CLASSIC_KEYWORDS);
        State root = tree.getRootState();
        State a = root.nextState('a');
        State b = root.nextState('b');
        State c = root.nextState('c');
        State ba = b.nextState('a');
        State bab = ba.nextState('b');
        State bca = b.nextState('c').nextState('a');
        State caa = c.nextState('a').nextState('a');

        Assert.assertSame(root, a.failure());
        Assert.assertSame(a, ba.failure());
        Assert.assertSame(a.nextState('b'), bab.failure());
        Assert.assertSame(c.nextState('a'), bca.failure());
        Assert.assertSame(a, caa.failure());
    }

    @Test
    public void randomKeywordsAndTexts() {
        Random random = new Random(20240611L);
        char[] alphabet = {'a', 'b', 'c'};
        for (int round = 0; round < 200; round++) {
            Set<String> keywords = new LinkedHashSet<String>();
            int keywordCount = 1 + random.nextInt(8);
            for (int i = 0; i < keywordCount; i++) {
                keywords.add(randomString(random, alphabet, 1 + random.nextInt(5)));
            }
            KeywordTree tree = build(keywords);
            String text = randomString(random, alphabet, random.nextInt(40));

            List<Emit> expected = bruteForce(keywords, text);
            Assert.assertEquals("keywords " + keywords + ", text " + text, expected, tree.parseText(text));

            List<String> expectedKeywords = new ArrayList<String>();
            for (Emit emit : expected) {
                expectedKeywords.add(emit.getKeyword());
            }
            Assert.assertEquals(expectedKeywords, tree.searchAll(text));
        }
    }

    @Test
    public void randomCaseInsensitive() {
        Random random = new Random(7L);
        char[] alphabet = {'a', 'B', 'A', 'b'};
        for (int round = 0; round < 100; round++) {
            Set<String> keywords = new LinkedHashSet<String>();
            Set<String> lowerKeywords = new LinkedHashSet<String>();
            for (int i = 0; i < 4; i++) {
                String keyword = randomString(random, alphabet, 1 + random.nextInt(4));
                if (lowerKeywords.add(keyword.toLowerCase())) {
                    keywords.add(keyword);
                }
            }
            KeywordTree tree = new KeywordTree(true);
            tree.addAll(keywords);
            tree.finalizeTree();
            String text = randomString(random, alphabet, random.nextInt(30));

            List<Emit> lowerEmits = bruteForce(lowerKeywords, text.toLowerCase());
            List<Emit> actual = tree.parseText(text);
            Assert.assertEquals(lowerEmits.size(), actual.size());
            for (int i = 0; i < actual.size(); i++) {
                Assert.assertEquals(lowerEmits.get(i).getEnd(), actual.get(i).getEnd());
                Assert.assertEquals(lowerEmits.get(i).getKeyword(), actual.get(i).getKeyword().toLowerCase());
            }
        }
    }

    private static String randomString(Random random, char[] alphabet, int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(alphabet[random.nextInt(alphabet.length)]);
        }
        return builder.toString();
    }
}
