package org.keywordtree.lines;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.keywordtree.trie.KeywordTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the lines of a text in which all (or any) of a set of keywords occur.
 *
 * <p>A keyword is present in a line when it equals one of the keywords reported by
 * {@link KeywordTree#searchAll(String)} for that line.
 */
public class LineFinder {

    private static final Logger logger = LoggerFactory.getLogger(LineFinder.class);

    private final List<String> keywords;

    private final Connector connector;

    private final KeywordTree keywordTree;

    public LineFinder(Collection<String> keywords, boolean caseSensitive, Connector connector) {
        this.keywords = new ArrayList<String>(keywords);
        this.connector = connector;
        this.keywordTree = new KeywordTree(!caseSensitive);
        this.keywordTree.addAll(this.keywords);
        this.keywordTree.finalizeTree();
    }

    /**
     * @return the 1-based numbers of the matching lines, ascending
     */
    public List<Integer> findLines(List<String> lines) {
        List<Integer> lineNumbers = new ArrayList<Integer>();
        for (int i = 0; i < lines.size(); i++) {
            if (matches(lines.get(i))) {
                lineNumbers.add(i + 1);
            }
        }
        logger.debug("Scanned {} lines, {} matched", lines.size(), lineNumbers.size());
        return lineNumbers;
    }

    public List<Integer> findLines(BufferedReader reader) throws IOException {
        List<Integer> lineNumbers = new ArrayList<Integer>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (matches(line)) {
                lineNumbers.add(lineNumber);
            }
        }
        logger.debug("Scanned {} lines, {} matched", lineNumber, lineNumbers.size());
        return lineNumbers;
    }

    public List<Integer> findLines(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return findLines(reader);
        }
    }

    public boolean matches(String line) {
        Set<String> found = new HashSet<String>(keywordTree.searchAll(line));
        return connector.test(keywords, found);
    }
}
