package com.optionsterminal.api.websocket;

import java.io.IOException;

/** Transport for one observer's frames. */
@FunctionalInterface
public interface RelayFrameSink {

    void send(RelayFrame frame) throws IOException;
}
