package com.example.apitest.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable execution policy resolved once per run. It is copied verbatim onto the report
 * via {@link #toMap()} so the exact limits a run was governed by stay auditable.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicySnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String DEFAULT_KEY_PREFIX = "default:";

    String id;
    String name;
    Integer maxConcurrency;
    Double perHostQps;
    int priority;
    int retryMaxAttempts;
    RetryBackoff retryBackoff;
    double timeoutSeconds;
    int circuitBreakerThreshold;
    int circuitBreakerWindowSeconds;
    SortedSet<String> tagsInclude;
    SortedSet<String> tagsExclude;
    boolean enabled;

    @Builder(toBuilder = true)
    private PolicySnapshot(String id,
                           String name,
                           Integer maxConcurrency,
                           Double perHostQps,
                           int priority,
                           int retryMaxAttempts,
                           RetryBackoff retryBackoff,
                           double timeoutSeconds,
                           int circuitBreakerThreshold,
                           int circuitBreakerWindowSeconds,
                           Collection<String> tagsInclude,
                           Collection<String> tagsExclude,
                           boolean enabled) {
        if (retryBackoff == null) {
            throw new PolicyValidationException("retry_backoff is required");
        }
        SortedSet<String> include = copyTags(tagsInclude);
        SortedSet<String> exclude = copyTags(tagsExclude);
        SortedSet<String> overlap = new TreeSet<>(include);
        overlap.retainAll(exclude);
        if (!overlap.isEmpty()) {
            throw new PolicyValidationException("tags_include and tags_exclude must be disjoint, both contain " + overlap);
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? "default" : name;
        this.maxConcurrency = maxConcurrency;
        this.perHostQps = perHostQps;
        this.priority = priority;
        this.retryMaxAttempts = retryMaxAttempts;
        this.retryBackoff = retryBackoff;
        this.timeoutSeconds = timeoutSeconds;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        this.circuitBreakerWindowSeconds = circuitBreakerWindowSeconds;
        this.tagsInclude = include;
        this.tagsExclude = exclude;
        this.enabled = enabled;
    }

    /**
     * Key under which runtime state (slots, limiters, breakers) is shared between runs.
     */
    @JsonIgnore
    public String getKey() {
        return id != null ? id : DEFAULT_KEY_PREFIX + name.toLowerCase(Locale.ROOT);
    }

    public boolean admits(Collection<String> tags) {
        Set<String> candidate = tags == null ? Set.of() : new TreeSet<>(tags);
        for (String tag : candidate) {
            if (tagsExclude.contains(tag)) {
                return false;
            }
        }
        if (tagsInclude.isEmpty()) {
            return true;
        }
        return candidate.stream().anyMatch(tagsInclude::contains);
    }

    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() {});
    }

    private static SortedSet<String> copyTags(Collection<String> tags) {
        TreeSet<String> copy = new TreeSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    copy.add(tag.trim());
                }
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }
}
