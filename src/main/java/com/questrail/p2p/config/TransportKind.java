package com.questrail.p2p.config;

/**
 * Wire binding a node speaks, with its default maximum package size.
 */
public enum TransportKind {
    /** One package per datagram. */
    UDP(1024),
    /** 4-byte length-prefixed frames over cached connections. */
    TCP(10240);

    private final int defaultMaxPackageSize;

    TransportKind(int defaultMaxPackageSize) {
        this.defaultMaxPackageSize = defaultMaxPackageSize;
    }

    public int defaultMaxPackageSize() {
        return defaultMaxPackageSize;
    }
}
