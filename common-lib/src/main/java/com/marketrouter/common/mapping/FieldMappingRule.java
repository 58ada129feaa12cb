package com.marketrouter.common.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Caller-supplied mapping rule: any column whose full name matches one of
 * {@code sourcePatterns} maps to {@code targetField}. Higher {@code priority} rules are
 * tried first. When a {@code validator} is present, the rule only applies if every
 * sampled non-null value passes it.
 */
public record FieldMappingRule(
    String targetField,
    List<Pattern> sourcePatterns,
    FieldType fieldType,
    int priority,
    Predicate<Object> validator
) {
    public FieldMappingRule {
        Objects.requireNonNull(targetField, "targetField");
        sourcePatterns = List.copyOf(sourcePatterns);
    }

    /** Rule matching any of the given literal names, case-insensitively. */
    public static FieldMappingRule ofNames(String targetField, List<String> names, FieldType type) {
        List<Pattern> patterns = new ArrayList<>(names.size());
        for (String name : names) {
            patterns.add(Pattern.compile(Pattern.quote(name), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return new FieldMappingRule(targetField, patterns, type, 0, null);
    }

    public static FieldMappingRule ofRegex(String targetField, String regex, FieldType type, int priority) {
        return new FieldMappingRule(targetField, List.of(Pattern.compile(regex, Pattern.CASE_INSENSITIVE)),
                                    type, priority, null);
    }

    public boolean matches(String column) {
        for (Pattern p : sourcePatterns) {
            if (p.matcher(column).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean accepts(List<Object> sample) {
        return validator == null || sample.stream().allMatch(validator);
    }
}
