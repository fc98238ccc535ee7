package com.zenz.respkv.frames;

import java.io.IOException;

/**
 * Raised when buffered bytes can never form a valid frame, no matter how much
 * more data arrives. Fatal to the connection that produced them.
 */
public class MalformedFrameException extends IOException {
    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
