package dev.pluginlink.client;

/**
 * Implementation of one plugin method on raw payload bytes.
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * @return the response payload
     * @throws PayloadMarshalException if the payload could not be decoded or the result encoded
     * @throws Exception any other failure, reported to the host as a call error
     */
    byte[] handle(byte[] payload) throws Exception;
}
