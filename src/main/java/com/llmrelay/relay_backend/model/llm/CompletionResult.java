package com.llmrelay.relay_backend.model.llm;

/**
 * What every provider returns from a non-streaming call.
 * {@code totalTokens} is derived, never supplied.
 */
public class CompletionResult {

    private final String content;
    private final int promptTokens;
    private final int completionTokens;
    private final String resolvedModel;   // actual model used (may differ from the requested alias)

    private CompletionResult(String content, int promptTokens, int completionTokens, String resolvedModel) {
        this.content          = content != null ? content : "";
        this.promptTokens     = Math.max(0, promptTokens);
        this.completionTokens = Math.max(0, completionTokens);
        this.resolvedModel    = resolvedModel;
    }

    public static CompletionResult of(String content, int promptTokens, int completionTokens, String resolvedModel) {
        return new CompletionResult(content, promptTokens, completionTokens, resolvedModel);
    }

    public String getContent()        { return content; }
    public int getPromptTokens()      { return promptTokens; }
    public int getCompletionTokens()  { return completionTokens; }
    public int getTotalTokens()       { return promptTokens + completionTokens; }
    public String getResolvedModel()  { return resolvedModel; }
}
