package com.example.apitest.assertion;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JsonDiffTest {

    @Test
    void equalValuesProduceNoEntries() {
        assertThat(JsonDiff.diff(Map.of("a", 1, "b", List.of(1, 2)), Map.of("a", 1.0, "b", List.of(1, 2)))).isEmpty();
        assertThat(JsonDiff.format(List.of())).isNull();
    }

    @Test
    void reportsAddedRemovedChangedAndTypeEntries() {
        Map<String, Object> expected = Map.of("id", 1, "name", "ada", "tags", List.of("a"), "gone", true);
        Map<String, Object> actual = Map.of("id", "1", "name", "grace", "tags", List.of("a", "b"), "extra", 3);

        List<JsonDiffEntry> entries = JsonDiff.diff(expected, actual);

        assertThat(entries).extracting(JsonDiffEntry::getPath, JsonDiffEntry::getChange).containsExactly(
                tuple("$.gone", JsonDiffEntry.Change.REMOVED),
                tuple("$.extra", JsonDiffEntry.Change.ADDED),
                tuple("$.id", JsonDiffEntry.Change.TYPE),
                tuple("$.name", JsonDiffEntry.Change.CHANGED),
                tuple("$.tags[1]", JsonDiffEntry.Change.ADDED));
    }

    @Test
    void quotesKeysThatAreNotIdentifiers() {
        List<JsonDiffEntry> entries = JsonDiff.diff(Map.of("content-type", "json"), Map.of("content-type", "xml"));

        assertThat(entries.get(0).getPath()).isEqualTo("$['content-type']");
    }

    @Test
    void formatsUnifiedLayout() {
        String text = JsonDiff.format(JsonDiff.diff(Map.of("id", 1, "ok", true), Map.of("id", "1")));

        assertThat(text).isEqualTo("@@ $.ok\n- true\n@@ $.id\n- type: number\n+ type: string");
    }

    @Test
    void capsEntriesAndText() {
        Map<String, Object> expected = new LinkedHashMap<>();
        Map<String, Object> actual = new LinkedHashMap<>();
        for (int i = 0; i < 400; i++) {
            expected.put("key" + i, "expected-value-" + "x".repeat(100));
            actual.put("key" + i, "actual-value-" + "y".repeat(100));
        }

        List<JsonDiffEntry> entries = JsonDiff.diff(expected, actual);
        String text = JsonDiff.format(entries);

        assertThat(entries).hasSize(JsonDiff.MAX_ENTRIES);
        assertThat(text).endsWith("\n… diff truncated");
        assertThat(text.length()).isEqualTo(JsonDiff.MAX_TEXT_CHARACTERS + "\n… diff truncated".length());
    }

    @Test
    void stopsDescendingAtMaxDepth() {
        Object expected = nest(40, "a");
        Object actual = nest(40, "b");

        List<JsonDiffEntry> entries = JsonDiff.diff(expected, actual);

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getChange()).isEqualTo(JsonDiffEntry.Change.CHANGED);
        assertThat(entries.get(0).getPath().split("\\[0]", -1)).hasSize(JsonDiff.MAX_DEPTH + 1);
    }

    private static Object nest(int depth, String leaf) {
        Object current = leaf;
        for (int i = 0; i < depth; i++) {
            List<Object> wrapper = new ArrayList<>();
            wrapper.add(current);
            current = wrapper;
        }
        return current;
    }
}
