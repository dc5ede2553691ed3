package com.example.apitest.context;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of a single case or suite run: variables, environment values, secrets, the last
 * captured response and the responses of earlier suite steps keyed by alias.
 */
@Getter
public class ExecutionContext {
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Map<String, Object> environment = new LinkedHashMap<>();
    private final Map<String, Object> secrets = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> stepHistory = new LinkedHashMap<>();
    @Setter
    private Map<String, Object> currentResponse;

    public ExecutionContext() {
    }

    public ExecutionContext(Map<String, Object> variables, Map<String, Object> environment, Map<String, Object> secrets) {
        if (variables != null) {
            this.variables.putAll(variables);
        }
        if (environment != null) {
            this.environment.putAll(environment);
        }
        if (secrets != null) {
            this.secrets.putAll(secrets);
        }
    }

    public void rememberStep(String alias, Map<String, Object> snapshot) {
        stepHistory.put(alias, snapshot);
    }

    public Map<String, Object> getStep(String alias) {
        return stepHistory.get(alias);
    }

    public void putVariables(Map<String, Object> values) {
        if (values != null) {
            variables.putAll(values);
        }
    }

    public Map<String, Object> getSecrets() {
        return Collections.unmodifiableMap(secrets);
    }
}
