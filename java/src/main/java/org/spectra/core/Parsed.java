package org.spectra.core;

import java.util.List;
import java.util.function.Consumer;

/**
 * Outcome of parsing a single item: either a value or a {@link ParseIssue}.
 */
public final class Parsed<T> {
    private final T value;
    private final ParseIssue issue;

    private Parsed(T value, ParseIssue issue) {
        this.value = value;
        this.issue = issue;
    }

    public static <T> Parsed<T> ok(T value) {
        return new Parsed<>(value, null);
    }

    public static <T> Parsed<T> failed(ParseIssue issue) {
        return new Parsed<>(null, issue);
    }

    public boolean isOk() { return issue == null; }

    public T getValue() {
        if (issue != null) {
            throw new IllegalStateException("No value: " + issue);
        }
        return value;
    }

    public ParseIssue getIssue() { return issue; }

    /**
     * Hand the value to {@code onValue}, or record the issue's message in {@code warnings}.
     */
    public void ifOkOrWarn(Consumer<T> onValue, List<String> warnings) {
        if (issue == null) {
            onValue.accept(value);
        } else {
            warnings.add(issue.getMessage());
        }
    }
}
