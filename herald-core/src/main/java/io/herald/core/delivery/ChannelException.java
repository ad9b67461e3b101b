package io.herald.core.delivery;

import java.io.IOException;

public class ChannelException extends IOException {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
