package com.example.apitest.assertion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Locale;

@Value
@JsonInclude(JsonInclude.Include.ALWAYS)
public class JsonDiffEntry {
    String path;
    Change change;
    Object expected;
    Object actual;

    public enum Change {
        ADDED, REMOVED, CHANGED, TYPE;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
