package org.healthdata.reporting.jql;

/**
 * A lexical token of a JQL string. {@code text} of a {@link Type#QUOTED} token has its quotes removed.
 */
public record JqlToken(Type type, String text, int position) {

    public enum Type {
        WORD,
        QUOTED,
        EQUALS,
        NOT_EQUALS,
        TILDE,
        NOT_TILDE,
        GREATER_THAN,
        LESS_THAN,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        UNKNOWN
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    /** True for a bare word equal to {@code keyword}, ignoring case. */
    public boolean isKeyword(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    /** Bare words and quoted strings can both stand as a value. */
    public boolean isValue() {
        return type == Type.WORD || type == Type.QUOTED;
    }
}
