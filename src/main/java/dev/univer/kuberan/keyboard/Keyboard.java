package dev.univer.kuberan.keyboard;

import java.util.ArrayList;
import java.util.List;

/** Rows of choices attached to a message. */
public record Keyboard(List<List<Choice>> rows) {

    public Keyboard {
        rows = rows.stream().map(List::copyOf).toList();
    }

    @SafeVarargs
    public static Keyboard of(List<Choice>... rows) {
        return new Keyboard(List.of(rows));
    }

    public List<Choice> choices() {
        List<Choice> all = new ArrayList<>();
        rows.forEach(all::addAll);
        return all;
    }

    public List<String> payloads() {
        return choices().stream().map(Choice::payload).toList();
    }

    /** Splits choices into rows of at most {@code perRow}. */
    static List<List<Choice>> chunk(List<Choice> choices, int perRow) {
        List<List<Choice>> rows = new ArrayList<>();
        for (int i = 0; i < choices.size(); i += perRow) {
            rows.add(choices.subList(i, Math.min(i + perRow, choices.size())));
        }
        return rows;
    }
}
