package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.model.ValidationOutcome;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Static structural and safety checks for generated Blender scripts.
 *
 * Checks, in order: forbidden operations on non-comment lines, the required
 * {@code bpy} import, and balanced brackets outside string literals and
 * comments. Issues are reported in that order.
 */
public final class ScriptValidator {

    static final List<String> FORBIDDEN_OPERATIONS = List.of(
            "os.system",
            "subprocess",
            "eval(",
            "exec(",
            "__import__",
            "open(",
            "compile(",
            "globals()",
            "locals()"
    );

    private ScriptValidator() {}

    public static ValidationOutcome validate(String script, boolean autoFixApplied) {
        List<String> issues = new ArrayList<>();
        if (script == null || script.isBlank()) {
            issues.add("Script is empty");
            return new ValidationOutcome(false, issues, autoFixApplied);
        }

        for (String forbidden : FORBIDDEN_OPERATIONS) {
            boolean used = script.lines()
                    .filter(line -> !line.strip().startsWith("#"))
                    .anyMatch(line -> line.contains(forbidden));
            if (used) {
                issues.add("Forbidden operation '" + forbidden + "'");
            }
        }
        if (!importsBpy(script)) {
            issues.add("Missing required import 'bpy'");
        }
        String bracketIssue = checkBrackets(script);
        if (bracketIssue != null) {
            issues.add(bracketIssue);
        }
        return new ValidationOutcome(issues.isEmpty(), issues, autoFixApplied);
    }

    /**
     * The single repair the pipeline attempts: add a missing {@code import bpy},
     * and {@code import math} when math helpers are used without it.
     * Idempotent; never touches anything else.
     */
    public static String autoFix(String script) {
        String fixed = script;
        if (!importsBpy(fixed)) {
            fixed = "import bpy\n" + fixed;
        }
        boolean usesMath = fixed.contains("math.") || fixed.contains("radians(");
        if (usesMath && !hasImportLine(fixed, "import math")) {
            List<String> lines = new ArrayList<>(fixed.lines().toList());
            int at = 0;
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).strip().equals("import bpy")) {
                    at = i + 1;
                    break;
                }
            }
            lines.add(at, "import math");
            fixed = String.join("\n", lines) + (script.endsWith("\n") ? "\n" : "");
        }
        return fixed;
    }

    private static boolean importsBpy(String script) {
        return hasImportLine(script, "import bpy")
            || script.lines().anyMatch(l -> l.strip().startsWith("from bpy import"));
    }

    private static boolean hasImportLine(String script, String statement) {
        return script.lines().map(String::strip)
                .anyMatch(l -> l.equals(statement) || l.startsWith(statement + " ")
                            || l.startsWith(statement + ","));
    }

    /** @return null if balanced, otherwise a description of the first problem */
    static String checkBrackets(String script) {
        Deque<int[]> open = new ArrayDeque<>();
        String quote = null;
        int line = 1;
        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (c == '\n') line++;

            if (quote != null) {
                if (c == '\\') {
                    i++;
                } else if (script.startsWith(quote, i)) {
                    i += quote.length() - 1;
                    quote = null;
                } else if (c == '\n' && quote.length() == 1) {
                    return "Unterminated string literal on line " + (line - 1);
                }
                continue;
            }
            switch (c) {
                case '#' -> {
                    int end = script.indexOf('\n', i);
                    i = (end < 0 ? script.length() : end) - 1;
                }
                case '"', '\'' -> {
                    String triple = String.valueOf(c).repeat(3);
                    quote = script.startsWith(triple, i) ? triple : String.valueOf(c);
                    i += quote.length() - 1;
                }
                case '(', '[', '{' -> open.push(new int[] {c, line});
                case ')', ']', '}' -> {
                    if (open.isEmpty()) {
                        return "Unmatched '" + c + "' on line " + line;
                    }
                    int[] top = open.pop();
                    if (top[0] != opening(c)) {
                        return "Mismatched '" + (char) top[0] + "' (line " + top[1]
                                + ") closed by '" + c + "' on line " + line;
                    }
                }
                default -> { }
            }
        }
        if (quote != null) {
            return "Unterminated string literal";
        }
        if (!open.isEmpty()) {
            int[] top = open.pop();
            return "Unclosed '" + (char) top[0] + "' opened on line " + top[1];
        }
        return null;
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default  -> '{';
        };
    }
}
