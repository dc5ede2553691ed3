package com.example.apitest.policy;

public class PolicyValidationException extends IllegalArgumentException {

    public PolicyValidationException(String message) {
        super(message);
    }
}
