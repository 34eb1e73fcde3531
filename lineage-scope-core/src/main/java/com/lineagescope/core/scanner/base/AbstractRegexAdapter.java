package com.lineagescope.core.scanner.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for adapters that read script text with regular expressions.
 *
 * <p>Used for script dialects where a full grammar would be overkill: the adapter only
 * needs the tables a statement reads and writes, not its semantics.
 *
 * @see AbstractFormatAdapter
 */
public abstract class AbstractRegexAdapter extends AbstractFormatAdapter {

    protected AbstractRegexAdapter() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return snapshot of every match, in text order
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    // ==================== String Utilities ====================

    /**
     * Removes SQL block and line comments.
     *
     * @param sql script text
     * @return text without comments
     */
    protected String stripSqlComments(String sql) {
        return SqlPatterns.stripComments(sql);
    }
}
