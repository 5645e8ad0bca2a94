package com.llmrelay.relay_backend.model.llm;

import com.llmrelay.relay_backend.error.ErrorKind;
import com.llmrelay.relay_backend.error.ProviderException;

/**
 * One element of a streamed completion. A stream is zero or more CONTENT chunks
 * followed by exactly one END or ERROR.
 */
public final class StreamChunk {

    public enum Type { CONTENT, END, ERROR }

    private static final StreamChunk END = new StreamChunk(Type.END, null, null);

    private final Type type;
    private final String text;
    private final ProviderException error;

    private StreamChunk(Type type, String text, ProviderException error) {
        this.type  = type;
        this.text  = text;
        this.error = error;
    }

    public static StreamChunk content(String text) { return new StreamChunk(Type.CONTENT, text, null); }
    public static StreamChunk end()                { return END; }
    public static StreamChunk error(ProviderException e) { return new StreamChunk(Type.ERROR, null, e); }

    public Type getType()               { return type; }
    public String getText()             { return text; }
    public ProviderException getError() { return error; }

    public boolean isContent()  { return type == Type.CONTENT; }
    public boolean isTerminal() { return type != Type.CONTENT; }

    public ErrorKind errorKind() {
        return error != null ? error.getKind() : null;
    }

    @Override
    public String toString() {
        return switch (type) {
            case CONTENT -> "CONTENT(" + text + ")";
            case END -> "END";
            case ERROR -> "ERROR(" + error.getKind() + ": " + error.getMessage() + ")";
        };
    }
}
