package com.zenz.respkv;

import java.io.IOException;

/**
 * The peer closed its side while a partial frame was still buffered.
 */
public class ConnectionResetException extends IOException {
    public ConnectionResetException(String message) {
        super(message);
    }
}
