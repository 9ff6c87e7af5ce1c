package com.skilltrace.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

public record PatternTag(String id) implements Comparable<PatternTag> {
    private static final Pattern VALID_ID = Pattern.compile("[a-z0-9_]+");

    public static final PatternTag LIST_COMPREHENSION = new PatternTag("list_comprehension");
    public static final PatternTag DICT_COMPREHENSION = new PatternTag("dict_comprehension");
    public static final PatternTag SET_COMPREHENSION = new PatternTag("set_comprehension");
    public static final PatternTag GENERATOR_EXPRESSION = new PatternTag("generator_expression");
    public static final PatternTag FOR_LOOP = new PatternTag("for_loop");
    public static final PatternTag WHILE_LOOP = new PatternTag("while_loop");
    public static final PatternTag CLASS_DEFINITION = new PatternTag("class_definition");
    public static final PatternTag FUNCTION_DEFINITION = new PatternTag("function_definition");
    public static final PatternTag PROPERTY_DECORATOR = new PatternTag("property_decorator");
    public static final PatternTag TRY_EXCEPT = new PatternTag("try_except");
    public static final PatternTag WITH_STATEMENT = new PatternTag("with_statement");
    public static final PatternTag LAMBDA = new PatternTag("lambda");

    public PatternTag {
        if (id == null || !VALID_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("pattern tag id must match [a-z0-9_]+, got " + id);
        }
    }

    @JsonValue
    @Override
    public String id() {
        return id;
    }

    public String label() {
        return id.replace('_', ' ');
    }

    @Override
    public int compareTo(PatternTag other) {
        return id.compareTo(other.id);
    }
}
