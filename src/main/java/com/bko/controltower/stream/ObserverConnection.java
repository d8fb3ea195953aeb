package com.bko.controltower.stream;

import java.io.IOException;

/**
 * A subscribed client. Implementations must not block a sender indefinitely.
 */
public interface ObserverConnection {

    String id();

    boolean isOpen();

    void send(String message) throws IOException;

    void close();
}
