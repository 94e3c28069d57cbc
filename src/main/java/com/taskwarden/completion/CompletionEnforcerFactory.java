package com.taskwarden.completion;

import org.springframework.stereotype.Component;

/**
 * Creates one {@link CompletionEnforcer} per task with the configured attempt budget.
 */
@Component
public class CompletionEnforcerFactory {

    private final CompletionProperties properties;

    public CompletionEnforcerFactory(CompletionProperties properties) {
        this.properties = properties;
    }

    public CompletionEnforcer create(CompletionCallbacks callbacks) {
        return new CompletionEnforcer(callbacks, properties.getMaxContinuationAttempts());
    }
}
