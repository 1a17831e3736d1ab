package com.taskforge.core.scheduler;

import java.time.ZonedDateTime;
import java.util.BitSet;

/**
 * A parsed five-field cron expression: minute, hour, day of month, month and day of
 * week (0 = Sunday). Each field accepts {@code *}, comma lists, ranges {@code a-b},
 * and steps {@code *}/n, {@code a/n} or {@code a-b/n}. Day of month and day of week
 * are both required to match.
 */
public final class CronExpression {

    private static final int[][] BOUNDS = {{0, 59}, {0, 23}, {1, 31}, {1, 12}, {0, 6}};
    private static final String[] FIELD_NAMES = {"minute", "hour", "day of month", "month", "day of week"};

    private final String expression;
    private final BitSet[] fields;

    private CronExpression(String expression, BitSet[] fields) {
        this.expression = expression;
        this.fields = fields;
    }

    /**
     * @throws InvalidCronExpressionException for a wrong field count, a non-numeric
     *                                        token, an out-of-range value or a zero step
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidCronExpressionException(expression, "need 5 fields, got " + parts.length);
        }
        BitSet[] fields = new BitSet[5];
        for (int i = 0; i < 5; i++) {
            fields[i] = parseField(expression, parts[i], i);
        }
        return new CronExpression(expression, fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    private static BitSet parseField(String expression, String field, int index) {
        int min = BOUNDS[index][0];
        int max = BOUNDS[index][1];
        BitSet values = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(expression, index, "empty list element");
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = number(expression, index, part.substring(slash + 1));
                if (step == 0) {
                    throw invalid(expression, index, "step must be positive");
                }
            }

            int from;
            int to;
            if (range.equals("*")) {
                from = min;
                to = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw invalid(expression, index, "bad range '" + range + "'");
                }
                from = number(expression, index, bounds[0]);
                to = number(expression, index, bounds[1]);
                if (from > to) {
                    throw invalid(expression, index, "range start after end in '" + range + "'");
                }
            } else {
                from = number(expression, index, range);
                // a/n runs from a to the end of the field
                to = slash >= 0 ? max : from;
            }
            if (from < min || to > max) {
                throw invalid(expression, index, "value out of range " + min + "-" + max + " in '" + part + "'");
            }
            for (int v = from; v <= to; v += step) {
                values.set(v);
            }
        }
        return values;
    }

    private static int number(String expression, int index, String token) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit) || token.length() > 4) {
            throw invalid(expression, index, "not a number: '" + token + "'");
        }
        return Integer.parseInt(token);
    }

    private static InvalidCronExpressionException invalid(String expression, int index, String detail) {
        return new InvalidCronExpressionException(expression, FIELD_NAMES[index] + ": " + detail);
    }

    /**
     * True when every field matches the given time, to minute precision.
     */
    public boolean matches(ZonedDateTime time) {
        return fields[0].get(time.getMinute())
                && fields[1].get(time.getHour())
                && fields[2].get(time.getDayOfMonth())
                && fields[3].get(time.getMonthValue())
                && fields[4].get(time.getDayOfWeek().getValue() % 7);
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
