package com.questrail.p2p.runtime;

import com.questrail.p2p.api.Message;
import com.questrail.p2p.config.TransportKind;
import com.questrail.p2p.observability.DropReason;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

final class UdpNodeIntegrationTest extends AbstractNodeIntegrationTest
{
    @Override
    protected TransportKind kind() {
        return TransportKind.UDP;
    }

    @Test
    void garbageDatagramIsDroppedAndTheNodeKeepsServing() throws Exception {
        registerPingPong(b);
        a.listen();
        b.listen();

        InetSocketAddress target = b.address().toSocketAddress();
        try (DatagramSocket raw = new DatagramSocket()) {
            byte[] garbage = { 1, 2, 3, 4, 5, 6, 7 };
            raw.send(new DatagramPacket(garbage, garbage.length, target));
        }

        awaitTrue(() -> sinkB.hasDrop(DropReason.DECODE_FAILED), "DECODE_FAILED drop");
        assertEquals(new Pong(4), a.sendAndReceive(b.address(), Message.of("KAD", "PING", new Ping(3)), Pong.class));
    }

    @Test
    void oversizedDatagramIsDropped() throws Exception {
        b.listen();

        InetSocketAddress target = b.address().toSocketAddress();
        try (DatagramSocket raw = new DatagramSocket()) {
            byte[] big = new byte[b.config().maxPackageSize() + 100];
            raw.send(new DatagramPacket(big, big.length, target));
        }

        awaitTrue(() -> sinkB.hasDrop(DropReason.OVERSIZED), "OVERSIZED drop");
    }
}
