package com.delta.requesttimer.schedule.notify;

import java.io.IOException;

/**
 * Unacknowledged point-to-point send of one datagram.
 */
public interface DatagramTransport {
    void send(String host, int port, byte[] payload) throws IOException;
}
