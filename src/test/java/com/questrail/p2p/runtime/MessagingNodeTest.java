package com.questrail.p2p.runtime;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.codec.impl.JacksonDeflatePackageCodec;
import com.questrail.p2p.codec.impl.JacksonPayloadCodec;
import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.config.TransportKind;
import com.questrail.p2p.model.Package;
import com.questrail.p2p.model.PackageMetadata;
import com.questrail.p2p.observability.NodeObservabilitySink;
import com.questrail.p2p.observability.NullNodeObservabilitySink;
import com.questrail.p2p.observability.RecordingObservabilitySink;
import com.questrail.p2p.session.ResponseTimeoutException;
import com.questrail.p2p.session.SessionStage;
import com.questrail.p2p.transport.FakeDatagramEndpoint;
import com.questrail.p2p.transport.udp.UdpTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessagingNodeTest
 * -----------------------------------------------------------------------------
 * Node behaviour over a UDP binding whose endpoint is a
 * {@link FakeDatagramEndpoint}; the test plays the remote peer by hand.
 */
final class MessagingNodeTest
{
    private static final int LOCAL_PORT = 4100;
    private static final Address PEER = new Address("127.0.0.1", 6100);

    private final FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint(LOCAL_PORT);
    private final JacksonPayloadCodec payloads = new JacksonPayloadCodec();
    private final JacksonDeflatePackageCodec packages = new JacksonDeflatePackageCodec();

    private MessagingNode node;

    @AfterEach
    void close() {
        if (node != null) {
            node.close();
        }
    }

    private MessagingNode newNode(NodeObservabilitySink sink, int fixedSessionId) {
        NodeConfig config = NodeConfig.builder()
                .withTransportKind(TransportKind.UDP)
                .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                .withResponseTimeout(Duration.ofSeconds(5))
                .build();
        node = MessagingNode.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .withTransportFactory((cfg, context) -> new UdpTransport(cfg, context, endpoint))
                .withSessionIdSource(() -> fixedSessionId)
                .build();
        return node;
    }

    private Package awaitSent() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (endpoint.sent().isEmpty()) {
            if (System.nanoTime() > deadline) {
                fail("nothing was sent");
            }
            Thread.sleep(5);
        }
        return packages.decode(endpoint.sent().get(0).payload());
    }

    @Test
    void requestIsCorrelatedWithTheResponseCarryingItsSession() throws Exception {
        newNode(NullNodeObservabilitySink.INSTANCE, 77).listen();

        CompletableFuture<String> answer = CompletableFuture.supplyAsync(
                () -> node.sendAndReceive(PEER, Message.of("KAD", "FIND", "key"), String.class));

        Package request = awaitSent();
        assertEquals(SessionStage.REQUEST, request.metadata().stage());
        assertEquals(77, request.metadata().sessionId());
        assertEquals(LOCAL_PORT, request.metadata().advertisedPort());

        endpoint.injectDatagram(PEER.toSocketAddress(), packages.encode(new Package(
                payloads.serialize(Message.of("KAD", "FIND", "value")),
                PackageMetadata.response(PEER.port(), 77))));

        assertEquals("value", answer.get(5, TimeUnit.SECONDS));
        assertEquals(0, node.pendingRequests());
    }

    @Test
    void fireAndForgetCarriesAnInactiveSession() throws Exception {
        newNode(NullNodeObservabilitySink.INSTANCE, 12).listen();

        node.send(PEER, Message.of("GOSSIP", "RUMOR", "x"));

        Package sent = awaitSent();
        assertEquals(SessionStage.INACTIVE, sent.metadata().stage());
        assertEquals(12, sent.metadata().sessionId());
        assertEquals(new InetSocketAddress("127.0.0.1", PEER.port()), endpoint.sent().get(0).remote());
    }

    @Test
    void transportFailureOnSendIsReportedNotThrown() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        newNode(sink, 1).listen();
        endpoint.stop();

        assertDoesNotThrow(() -> node.send(PEER, Message.of("GOSSIP", "RUMOR")));
        assertFalse(sink.getErrors().isEmpty());
    }

    @Test
    void transportFailureOnRequestEndsInTimeout() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        newNode(sink, 1).listen();
        endpoint.stop();

        assertThrows(ResponseTimeoutException.class, () ->
                node.sendAndReceive(PEER, Message.of("KAD", "FIND"), String.class, Duration.ofMillis(100)));
        assertFalse(sink.getErrors().isEmpty());
        assertEquals(0, node.pendingRequests());
    }

    @Test
    void addressReportsTheBoundPort() {
        newNode(NullNodeObservabilitySink.INSTANCE, 1);
        assertThrows(IllegalStateException.class, node::address);

        node.listen();

        assertEquals(new Address("127.0.0.1", LOCAL_PORT), node.address());
    }
}
