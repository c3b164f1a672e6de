package org.healthdata.reporting.jql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a JQL string into one unambiguous token stream. Every character of the input ends up in at most one
 * token, so {@code !=} can never also be read as {@code =}. Never throws: an unterminated quote runs to the end
 * of the input and a stray {@code !} becomes an {@link JqlToken.Type#UNKNOWN} token.
 */
public final class JqlTokenizer {

    private static final String PUNCTUATION = "=!~<>(),'\"";

    private JqlTokenizer() {}

    public static List<JqlToken> tokenize(String input) {
        List<JqlToken> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        int i = 0;
        int length = input.length();
        while (i < length) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            switch (c) {
                case '=':
                    tokens.add(new JqlToken(JqlToken.Type.EQUALS, "=", i));
                    i++;
                    break;
                case '~':
                    tokens.add(new JqlToken(JqlToken.Type.TILDE, "~", i));
                    i++;
                    break;
                case '>':
                    tokens.add(new JqlToken(JqlToken.Type.GREATER_THAN, ">", i));
                    i++;
                    break;
                case '<':
                    tokens.add(new JqlToken(JqlToken.Type.LESS_THAN, "<", i));
                    i++;
                    break;
                case '(':
                    tokens.add(new JqlToken(JqlToken.Type.LEFT_PAREN, "(", i));
                    i++;
                    break;
                case ')':
                    tokens.add(new JqlToken(JqlToken.Type.RIGHT_PAREN, ")", i));
                    i++;
                    break;
                case ',':
                    tokens.add(new JqlToken(JqlToken.Type.COMMA, ",", i));
                    i++;
                    break;
                case '!':
                    i = readBang(input, i, tokens);
                    break;
                case '\'':
                case '"':
                    i = readQuoted(input, i, tokens);
                    break;
                default:
                    i = readWord(input, i, tokens);
                    break;
            }
        }
        return tokens;
    }

    private static int readBang(String input, int start, List<JqlToken> tokens) {
        if (start + 1 < input.length()) {
            char next = input.charAt(start + 1);
            if (next == '=') {
                tokens.add(new JqlToken(JqlToken.Type.NOT_EQUALS, "!=", start));
                return start + 2;
            }
            if (next == '~') {
                tokens.add(new JqlToken(JqlToken.Type.NOT_TILDE, "!~", start));
                return start + 2;
            }
        }
        tokens.add(new JqlToken(JqlToken.Type.UNKNOWN, "!", start));
        return start + 1;
    }

    private static int readQuoted(String input, int start, List<JqlToken> tokens) {
        char quote = input.charAt(start);
        int end = input.indexOf(quote, start + 1);
        if (end < 0) {
            tokens.add(new JqlToken(JqlToken.Type.QUOTED, input.substring(start + 1), start));
            return input.length();
        }
        tokens.add(new JqlToken(JqlToken.Type.QUOTED, input.substring(start + 1, end), start));
        return end + 1;
    }

    private static int readWord(String input, int start, List<JqlToken> tokens) {
        int i = start;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c) || PUNCTUATION.indexOf(c) >= 0) {
                break;
            }
            i++;
        }
        tokens.add(new JqlToken(JqlToken.Type.WORD, input.substring(start, i), start));
        return i;
    }
}
