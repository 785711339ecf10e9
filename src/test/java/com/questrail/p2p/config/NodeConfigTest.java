package com.questrail.p2p.config;

import com.questrail.p2p.codec.impl.JacksonDeflatePackageCodec;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class NodeConfigTest
{
    @Test
    void defaultsDescribeAnEphemeralTcpNode() {
        NodeConfig config = NodeConfig.defaults();

        assertEquals(0, config.bindAddress().getPort());
        assertEquals(0, config.advertisedPort());
        assertEquals(TransportKind.TCP, config.transportKind());
        assertEquals(TransportKind.TCP.defaultMaxPackageSize(), config.maxPackageSize());
        assertEquals(JacksonDeflatePackageCodec.DEFAULT_MAX_INFLATED_SIZE, config.maxInflatedSize());
        assertEquals(NodeConfig.DEFAULT_RESPONSE_TIMEOUT, config.responseTimeout());
    }

    @Test
    void maxPackageSizeFollowsTheTransportKindUnlessOverridden() {
        assertEquals(1024, NodeConfig.builder().withTransportKind(TransportKind.UDP).build().maxPackageSize());
        assertEquals(10240, NodeConfig.builder().withTransportKind(TransportKind.TCP).build().maxPackageSize());
        assertEquals(512, NodeConfig.builder()
                .withTransportKind(TransportKind.UDP)
                .withMaxPackageSize(512)
                .build()
                .maxPackageSize());
    }

    @Test
    void builderCarriesEveryField() {
        NodeConfig config = NodeConfig.builder()
                .withBindAddress(new InetSocketAddress("127.0.0.1", 7000))
                .withAdvertisedPort(7001)
                .withTransportKind(TransportKind.UDP)
                .withMaxInflatedSize(4096)
                .withResponseTimeout(Duration.ofMillis(250))
                .build();

        assertEquals(7000, config.bindAddress().getPort());
        assertEquals(7001, config.advertisedPort());
        assertEquals(TransportKind.UDP, config.transportKind());
        assertEquals(4096, config.maxInflatedSize());
        assertEquals(Duration.ofMillis(250), config.responseTimeout());
    }

    @Test
    void withPortBindsTheWildcardAddress() {
        InetSocketAddress bind = NodeConfig.builder().withPort(7100).build().bindAddress();
        assertEquals(7100, bind.getPort());
        assertTrue(bind.getAddress().isAnyLocalAddress());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeConfig.builder().withAdvertisedPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> NodeConfig.builder().withMaxPackageSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> NodeConfig.builder().withMaxInflatedSize(-1).build());
        assertThrows(IllegalArgumentException.class, () -> NodeConfig.builder().withResponseTimeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class, () -> NodeConfig.builder().withBindAddress(null).build());
    }
}
