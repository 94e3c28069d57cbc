package com.taskwarden.completion;

/**
 * The agent's "I am done" claim, as reported through its {@code complete_task} tool.
 *
 * @param status                 claimed outcome
 * @param summary                what the agent says it accomplished
 * @param originalRequestSummary the agent's restatement of the request (may be empty)
 * @param remainingWork          what is still open, for partial completions (nullable)
 * @param blocker                why the agent cannot proceed, for blocked completions (nullable)
 */
public record CompletionDeclaration(
    DeclarationStatus status,
    String summary,
    String originalRequestSummary,
    String remainingWork,
    String blocker
) {

    public CompletionDeclaration {
        if (status == null) status = DeclarationStatus.UNKNOWN;
        if (summary == null) summary = "";
        if (originalRequestSummary == null) originalRequestSummary = "";
    }

    public static CompletionDeclaration of(DeclarationStatus status, String summary) {
        return new CompletionDeclaration(status, summary, "", null, null);
    }

    public static CompletionDeclaration unknown() {
        return of(DeclarationStatus.UNKNOWN, "");
    }

    CompletionDeclaration downgradedToPartial(String remaining) {
        return new CompletionDeclaration(DeclarationStatus.PARTIAL, summary, originalRequestSummary, remaining, blocker);
    }
}
