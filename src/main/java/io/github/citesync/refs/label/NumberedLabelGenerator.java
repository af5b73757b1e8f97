package io.github.citesync.refs.label;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Numeric labels built from a template in which {@code $} stands for the number(s),
 * e.g. template {@code "[$]"} gives {@code "[1]"} and {@code "[2,3]"}.
 */
public class NumberedLabelGenerator implements LabelGenerator {
    public static final String PLACEHOLDER = "$";

    private final String template;
    private final String delimiter;

    public NumberedLabelGenerator() {
        this(PLACEHOLDER, ",");
    }

    public NumberedLabelGenerator(String template) {
        this(template, ",");
    }

    public NumberedLabelGenerator(String template, String delimiter) {
        this.template = Objects.requireNonNull(template, "template");
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
        if (!template.contains(PLACEHOLDER)) {
            throw new IllegalArgumentException("Label template must contain '" + PLACEHOLDER + "': " + template);
        }
    }

    @Override
    public String getLabel(int position) {
        return template.replace(PLACEHOLDER, Integer.toString(position));
    }

    @Override
    public String getLabel(List<Integer> positions) {
        if (positions.isEmpty()) {
            return "";
        }
        String numbers = positions.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(delimiter));
        return template.replace(PLACEHOLDER, numbers);
    }

    @Override
    public String toString() {
        return "NumberedLabelGenerator[" + template + "]";
    }
}
