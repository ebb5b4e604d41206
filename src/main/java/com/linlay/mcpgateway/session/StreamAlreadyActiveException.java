package com.linlay.mcpgateway.session;

public class StreamAlreadyActiveException extends RuntimeException {

    public StreamAlreadyActiveException(String sessionId) {
        super("A stream is already active for session: " + sessionId);
    }
}
