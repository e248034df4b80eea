package com.whereq.contextforge.handler;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * Cheap structural signals of a piece of content, attached to classification and quality results
 */
@Value
public class ContentCharacteristics {

    private static final Pattern VARIABLES = Pattern.compile("\\{\\{.*?}}|\\$\\{.*?}|\\{[^{}]*}");
    private static final Pattern INSTRUCTIONS = Pattern.compile(
        "\\b(you are|act as|your task|instructions?|follow|do not|must|should)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXAMPLES = Pattern.compile(
        "\\b(example|for instance|such as|e\\.g\\.|like)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITIONALS = Pattern.compile(
        "\\b(if|when|unless|otherwise|depending|based on)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSTRAINTS = Pattern.compile(
        "\\b(limit|maximum|minimum|no more than|at least|exactly)\\b", Pattern.CASE_INSENSITIVE);

    int length;
    int wordCount;
    String format;
    boolean hasVariables;
    boolean hasInstructions;
    boolean hasExamples;
    boolean hasConditionals;
    boolean hasConstraints;

    public static ContentCharacteristics analyze(String content, String format) {
        String text = content == null ? "" : content;
        String trimmed = text.trim();
        return new ContentCharacteristics(
            text.length(),
            trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length,
            format,
            VARIABLES.matcher(text).find(),
            INSTRUCTIONS.matcher(text).find(),
            EXAMPLES.matcher(text).find(),
            CONDITIONALS.matcher(text).find(),
            CONSTRAINTS.matcher(text).find());
    }
}
