package com.taskforge.core.intent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises instructions that spell out their capability sequence literally, either
 * under a "Required tools:" header or as numbered steps naming known capabilities.
 */
final class ExplicitSequenceParser {

    private static final Pattern HEADER = Pattern.compile(
            "required\\s+(?:tools|capabilities)\\s*:\\s*(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*\\d+[.)]\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][\\w.:-]*[\\w]");

    private ExplicitSequenceParser() {}

    /**
     * @return capability names in order of appearance, or an empty list when the
     *         instruction does not enumerate any
     */
    static List<String> parse(String instruction, Collection<String> known) {
        if (instruction == null || instruction.isBlank()) {
            return List.of();
        }
        List<String> names = fromHeader(instruction, known);
        if (names.isEmpty()) {
            names = fromNumberedSteps(instruction, known);
        }
        return dedupeShortNames(names);
    }

    private static List<String> fromHeader(String instruction, Collection<String> known) {
        Matcher header = HEADER.matcher(instruction);
        if (!header.find()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String line : header.group(1).split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!names.isEmpty()) {
                    break;
                }
                continue;
            }
            Matcher id = IDENTIFIER.matcher(trimmed.replaceAll("^[-*\\d.)\\s]+", ""));
            boolean lineHadName = false;
            while (id.find()) {
                String token = id.group();
                if (looksLikeCapability(token, known)) {
                    names.add(token);
                    lineHadName = true;
                }
            }
            if (!lineHadName && !names.isEmpty()) {
                break;
            }
        }
        return names;
    }

    private static List<String> fromNumberedSteps(String instruction, Collection<String> known) {
        List<String> names = new ArrayList<>();
        Matcher line = NUMBERED_LINE.matcher(instruction);
        while (line.find()) {
            Matcher id = IDENTIFIER.matcher(line.group(1));
            while (id.find()) {
                String token = id.group();
                if (known.contains(token) || known.contains(ActionPatternTable.shortName(token))) {
                    names.add(token);
                    break;
                }
            }
        }
        return names;
    }

    private static boolean looksLikeCapability(String token, Collection<String> known) {
        if (known.contains(token) || known.contains(ActionPatternTable.shortName(token))) {
            return true;
        }
        return token.contains("_") || token.contains(".") || token.contains(":");
    }

    /**
     * Drops exact repeats and short names already covered by a namespaced name
     * ({@code search} next to {@code catalog.search}).
     */
    static List<String> dedupeShortNames(List<String> names) {
        Set<String> unique = new LinkedHashSet<>(names);
        List<String> result = new ArrayList<>();
        for (String name : unique) {
            boolean qualified = name.contains(".") || name.contains(":");
            if (!qualified && coveredByQualified(name, unique)) {
                continue;
            }
            result.add(name);
        }
        return result;
    }

    private static boolean coveredByQualified(String shortName, Set<String> names) {
        String lower = shortName.toLowerCase(Locale.ROOT);
        for (String other : names) {
            if (other.equals(shortName)) {
                continue;
            }
            String otherLower = other.toLowerCase(Locale.ROOT);
            if (otherLower.endsWith("." + lower) || otherLower.endsWith(":" + lower)) {
                return true;
            }
        }
        return false;
    }
}
