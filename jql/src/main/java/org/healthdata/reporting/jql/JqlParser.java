package org.healthdata.reporting.jql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.healthdata.reporting.jql.ir.FilterCondition;
import org.healthdata.reporting.jql.ir.Operator;
import org.healthdata.reporting.jql.ir.OrderBy;
import org.healthdata.reporting.jql.ir.ParsedQuery;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link ParsedQuery} from the token stream of {@link JqlTokenizer} in a single left-to-right pass.
 *
 * <p>Recognized forms (keywords are case-insensitive, all conditions are conjunctive):
 * <pre>
 *   project = name
 *   field = v | field != v | field ~ v | field !~ v | field &gt; v | field &lt; v
 *   field in (a, b) | field not in (a, b)
 *   field is null | field is not null
 *   order by field [asc|desc] [, field [asc|desc]]...
 *   limit n
 * </pre>
 * {@code and} connectors and anything that fits none of these forms are skipped without error;
 * {@link #parse(String)} never throws.
 */
@Slf4j
public class JqlParser {

    public static final String PROJECT_KEY = "project";

    private static final Pattern LIMIT_VALUE = Pattern.compile("\\d{1,9}");

    private static final Map<JqlToken.Type, Operator> COMPARISONS = Map.of(
        JqlToken.Type.EQUALS, Operator.EQUALS,
        JqlToken.Type.NOT_EQUALS, Operator.NOT_EQUALS,
        JqlToken.Type.TILDE, Operator.CONTAINS,
        JqlToken.Type.NOT_TILDE, Operator.NOT_CONTAINS,
        JqlToken.Type.GREATER_THAN, Operator.GREATER_THAN,
        JqlToken.Type.LESS_THAN, Operator.LESS_THAN
    );

    public ParsedQuery parse(String input) {
        if (input == null || input.isBlank()) {
            return ParsedQuery.empty();
        }
        var cursor = new Cursor(JqlTokenizer.tokenize(input.trim()));
        var builder = new Builder();
        while (!cursor.atEnd()) {
            if (!(parseComparison(cursor, builder)
                || parseOrderBy(cursor, builder)
                || parseLimit(cursor, builder)
                || parseInList(cursor, builder)
                || parseNullCheck(cursor, builder))) {
                cursor.advance(1);
            }
        }
        ParsedQuery parsed = builder.build();
        log.atDebug().setMessage("Parsed JQL into {} project(s), {} condition(s), {} sort key(s), limit={}")
            .addArgument(() -> parsed.projects().size())
            .addArgument(() -> parsed.conditions().size())
            .addArgument(() -> parsed.orderBy().size())
            .addArgument(parsed::limit)
            .log();
        return parsed;
    }

    private boolean parseComparison(Cursor cursor, Builder builder) {
        JqlToken field = cursor.peek(0);
        JqlToken op = cursor.peek(1);
        JqlToken value = cursor.peek(2);
        if (field == null || op == null || value == null
            || !field.is(JqlToken.Type.WORD) || !value.isValue() || !COMPARISONS.containsKey(op.type())) {
            return false;
        }
        Operator operator = COMPARISONS.get(op.type());
        if (operator == Operator.EQUALS && field.isKeyword(PROJECT_KEY)) {
            // only the first project clause counts
            if (builder.projects.isEmpty()) {
                builder.projects.add(value.text());
            }
        } else {
            builder.conditions.add(FilterCondition.of(field.text(), operator, value.text()));
        }
        cursor.advance(3);
        return true;
    }

    private boolean parseOrderBy(Cursor cursor, Builder builder) {
        JqlToken order = cursor.peek(0);
        JqlToken by = cursor.peek(1);
        if (order == null || by == null || !order.isKeyword("order") || !by.isKeyword("by")) {
            return false;
        }
        cursor.advance(2);
        while (!cursor.atEnd() && cursor.peek(0).is(JqlToken.Type.WORD)) {
            String field = cursor.peek(0).text();
            cursor.advance(1);
            OrderBy.Direction direction = OrderBy.Direction.ASC;
            JqlToken next = cursor.peek(0);
            if (next != null && (next.isKeyword("asc") || next.isKeyword("desc"))) {
                direction = OrderBy.Direction.parse(next.text());
                cursor.advance(1);
            }
            builder.orderBy.add(new OrderBy(field, direction));
            if (cursor.atEnd() || !cursor.peek(0).is(JqlToken.Type.COMMA)) {
                break;
            }
            cursor.advance(1);
        }
        return true;
    }

    private boolean parseLimit(Cursor cursor, Builder builder) {
        JqlToken limit = cursor.peek(0);
        JqlToken value = cursor.peek(1);
        if (limit == null || value == null || !limit.isKeyword("limit")
            || !value.is(JqlToken.Type.WORD) || !LIMIT_VALUE.matcher(value.text()).matches()) {
            return false;
        }
        builder.limit = Integer.parseInt(value.text());
        cursor.advance(2);
        return true;
    }

    private boolean parseInList(Cursor cursor, Builder builder) {
        JqlToken field = cursor.peek(0);
        if (field == null || !field.is(JqlToken.Type.WORD)) {
            return false;
        }
        int offset;
        Operator operator;
        if (isKeywordAt(cursor, 1, "in") && isTypeAt(cursor, 2, JqlToken.Type.LEFT_PAREN)) {
            offset = 3;
            operator = Operator.IN;
        } else if (isKeywordAt(cursor, 1, "not") && isKeywordAt(cursor, 2, "in")
            && isTypeAt(cursor, 3, JqlToken.Type.LEFT_PAREN)) {
            offset = 4;
            operator = Operator.NOT_IN;
        } else {
            return false;
        }
        cursor.advance(offset);

        List<String> values = new ArrayList<>();
        StringBuilder element = new StringBuilder();
        while (!cursor.atEnd() && !cursor.peek(0).is(JqlToken.Type.RIGHT_PAREN)) {
            JqlToken token = cursor.peek(0);
            if (token.is(JqlToken.Type.COMMA)) {
                addListElement(values, element);
            } else if (token.isValue()) {
                if (element.length() > 0) {
                    element.append(' ');
                }
                element.append(token.text());
            }
            cursor.advance(1);
        }
        addListElement(values, element);
        cursor.advance(1);
        builder.conditions.add(FilterCondition.ofValues(field.text(), operator, values));
        return true;
    }

    private static void addListElement(List<String> values, StringBuilder element) {
        String trimmed = element.toString().trim();
        if (!trimmed.isEmpty()) {
            values.add(trimmed);
        }
        element.setLength(0);
    }

    private boolean parseNullCheck(Cursor cursor, Builder builder) {
        JqlToken field = cursor.peek(0);
        if (field == null || !field.is(JqlToken.Type.WORD) || !isKeywordAt(cursor, 1, "is")) {
            return false;
        }
        if (isKeywordAt(cursor, 2, "null")) {
            builder.conditions.add(FilterCondition.ofPresence(field.text(), Operator.IS_NULL));
            cursor.advance(3);
            return true;
        }
        if (isKeywordAt(cursor, 2, "not") && isKeywordAt(cursor, 3, "null")) {
            builder.conditions.add(FilterCondition.ofPresence(field.text(), Operator.IS_NOT_NULL));
            cursor.advance(4);
            return true;
        }
        return false;
    }

    private static boolean isKeywordAt(Cursor cursor, int offset, String keyword) {
        JqlToken token = cursor.peek(offset);
        return token != null && token.isKeyword(keyword);
    }

    private static boolean isTypeAt(Cursor cursor, int offset, JqlToken.Type type) {
        JqlToken token = cursor.peek(offset);
        return token != null && token.is(type);
    }

    private static class Cursor {
        private final List<JqlToken> tokens;
        private int position;

        Cursor(List<JqlToken> tokens) {
            this.tokens = tokens;
        }

        JqlToken peek(int offset) {
            int index = position + offset;
            return index < tokens.size() ? tokens.get(index) : null;
        }

        void advance(int count) {
            position = Math.min(tokens.size(), position + count);
        }

        boolean atEnd() {
            return position >= tokens.size();
        }
    }

    private static class Builder {
        private final List<String> projects = new ArrayList<>();
        private final List<FilterCondition> conditions = new ArrayList<>();
        private final List<OrderBy> orderBy = new ArrayList<>();
        private Integer limit;

        ParsedQuery build() {
            return new ParsedQuery(projects, conditions, orderBy, limit);
        }
    }
}
