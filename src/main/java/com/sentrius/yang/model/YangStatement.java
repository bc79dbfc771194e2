package com.sentrius.yang.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement as produced by the grammar engine: keyword, optional argument,
 * substatements and source line.
 */
public class YangStatement {
    private final String keyword;
    private final String argument;
    private final int line;
    private final List<YangStatement> substatements;

    public YangStatement(String keyword, String argument, int line, List<YangStatement> substatements) {
        this.keyword = keyword;
        this.argument = argument;
        this.line = line;
        this.substatements = substatements != null ? substatements : Collections.emptyList();
    }

    public String getKeyword() {
        return keyword;
    }

    public String getArgument() {
        return argument;
    }

    public int getLine() {
        return line;
    }

    public List<YangStatement> getSubstatements() {
        return substatements;
    }

    /**
     * All substatements with the given keyword, in declaration order. Empty when
     * there are none, a singleton when declared once.
     */
    public List<YangStatement> substatements(String keyword) {
        List<YangStatement> matches = new ArrayList<>();
        for (YangStatement statement : substatements) {
            if (keyword.equals(statement.keyword)) {
                matches.add(statement);
            }
        }
        return matches;
    }

    public YangStatement substatement(String keyword) {
        for (YangStatement statement : substatements) {
            if (keyword.equals(statement.keyword)) {
                return statement;
            }
        }
        return null;
    }

    /**
     * Argument of the first substatement with the given keyword.
     * @return The argument, or null if the substatement is absent
     */
    public String argumentOf(String keyword) {
        YangStatement statement = substatement(keyword);
        return statement != null ? statement.argument : null;
    }

    @Override
    public String toString() {
        return "YangStatement{keyword='" + keyword + "', argument='" + argument + "', line=" + line +
               ", substatements=" + substatements.size() + "}";
    }
}
