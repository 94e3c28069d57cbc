package com.taskwarden.completion;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskwarden.completion")
public class CompletionProperties {

    private int maxContinuationAttempts = CompletionEnforcer.DEFAULT_MAX_CONTINUATION_ATTEMPTS;

    public int getMaxContinuationAttempts() { return maxContinuationAttempts; }
    public void setMaxContinuationAttempts(int maxContinuationAttempts) {
        this.maxContinuationAttempts = maxContinuationAttempts;
    }
}
