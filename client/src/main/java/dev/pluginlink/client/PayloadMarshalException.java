package dev.pluginlink.client;

import java.io.IOException;

/**
 * A call payload could not be decoded, or its result could not be encoded.
 */
public class PayloadMarshalException extends IOException {

    public PayloadMarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
