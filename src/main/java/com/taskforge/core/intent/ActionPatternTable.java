package com.taskforge.core.intent;

import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskStep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic action/pattern/capability table used when the model cannot classify an instruction.
 */
public final class ActionPatternTable {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Rule> RULES = List.of(
            new Rule(TaskAction.EXTRACT, Pattern.compile("\\b(?:extract|parse|ocr)", FLAGS), null,
                    List.of("extract_table_to_excel", "match_specification_to_catalog", "view", "bash_tool")),
            new Rule(TaskAction.SEARCH, Pattern.compile("\\b(?:search|find|lookup|look up)", FLAGS), null,
                    List.of("expert_search", "category_search", "match_specification_to_catalog",
                            "search_files_by_name")),
            new Rule(TaskAction.CALCULATE, Pattern.compile("\\b(?:calculate|compute)", FLAGS), null,
                    List.of("execute_code", "execute_bash", "bash_tool")),
            new Rule(TaskAction.CREATE, Pattern.compile("\\b(?:create|generate|make)", FLAGS),
                    Pattern.compile("\\b(?:excel|pdf|word|report)", FLAGS),
                    List.of("create_file", "create_artifact", "extract_table_to_excel")),
            new Rule(TaskAction.COMPARE, Pattern.compile("\\b(?:compare|match|correlate)", FLAGS), null,
                    List.of("compare_products", "search_products")),
            new Rule(TaskAction.ANALYZE, Pattern.compile("\\b(?:analy[sz]e|examine|review)", FLAGS), null,
                    List.of("analyze_search_params", "execute_code")),
            new Rule(TaskAction.TRANSFORM, Pattern.compile("\\b(?:transform|convert)", FLAGS), null,
                    List.of("execute_code", "bash_tool"))
    );

    private ActionPatternTable() {}

    /**
     * Steps for every matching rule, ordered by where the rule first matched in the text.
     * An instruction matching nothing yields a single {@code analyze} step.
     */
    public static List<TaskStep> match(String instruction) {
        String text = instruction == null ? "" : instruction;
        List<Hit> hits = new ArrayList<>();
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(text);
            if (!m.find()) {
                continue;
            }
            if (rule.requires() != null && !rule.requires().matcher(text).find()) {
                continue;
            }
            hits.add(new Hit(m.start(), rule));
        }
        if (hits.isEmpty()) {
            return List.of(new TaskStep(TaskAction.ANALYZE, List.of(), "No action pattern matched"));
        }
        hits.sort(Comparator.comparingInt(Hit::position));
        List<TaskStep> steps = new ArrayList<>();
        for (Hit hit : hits) {
            steps.add(new TaskStep(hit.rule().action(), hit.rule().capabilities(),
                    "Matched " + hit.rule().action().wireName() + " pattern"));
        }
        return steps;
    }

    /**
     * Action categories the table associates with a capability name. Namespaced names
     * ({@code ns.name} or {@code ns:name}) are looked up by their short name.
     */
    public static Set<TaskAction> actionsFor(String capability) {
        Set<TaskAction> actions = EnumSet.noneOf(TaskAction.class);
        if (capability == null) {
            return actions;
        }
        String shortName = shortName(capability);
        for (Rule rule : RULES) {
            if (rule.capabilities().contains(shortName)) {
                actions.add(rule.action());
            }
        }
        return actions;
    }

    static String shortName(String capability) {
        int cut = Math.max(capability.lastIndexOf('.'), capability.lastIndexOf(':'));
        return cut >= 0 ? capability.substring(cut + 1) : capability;
    }

    private record Rule(TaskAction action, Pattern pattern, Pattern requires, List<String> capabilities) {}

    private record Hit(int position, Rule rule) {}
}
