package com.example.apitest.assertion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AssertionResult {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    String name;
    String operator;
    boolean passed;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    Object actual;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    Object expected;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String message;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String path;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<JsonDiffEntry> diff;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String diffText;

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
    }
}
