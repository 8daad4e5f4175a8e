package dev.pluginlink.transport;

import java.io.IOException;

/**
 * Stream that can finish its sending direction while still receiving.
 */
public interface HalfCloseable {

    void closeSend() throws IOException;
}
