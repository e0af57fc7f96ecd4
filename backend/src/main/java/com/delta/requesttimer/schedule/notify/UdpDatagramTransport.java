package com.delta.requesttimer.schedule.notify;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;

@Component
public class UdpDatagramTransport implements DatagramTransport {

    @Override
    public void send(String host, int port, byte[] payload) throws IOException {
        InetAddress address = InetAddress.getByName(host);
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.send(new DatagramPacket(payload, payload.length, address, port));
        }
    }
}
