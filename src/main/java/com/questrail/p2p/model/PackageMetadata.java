package com.questrail.p2p.model;

import com.questrail.p2p.session.SessionStage;

import java.util.Objects;

/**
 * Out-of-band data needed to route and correlate a {@link Package}.
 *
 * <ul>
 *   <li>{@code advertisedPort}: the port the sender listens on, which may
 *       differ from the source port of the connection that carried the package</li>
 *   <li>{@code sessionId}: correlation id; required for REQUEST and RESPONSE,
 *       optional for INACTIVE</li>
 *   <li>{@code stage}: REQUEST, RESPONSE or INACTIVE; CONSUMED never travels</li>
 * </ul>
 */
public record PackageMetadata(int advertisedPort, Integer sessionId, SessionStage stage)
{
    public PackageMetadata {
        Objects.requireNonNull(stage, "stage");
        if (advertisedPort < 0 || advertisedPort > 65535) {
            throw new IllegalArgumentException("advertisedPort must be in range 0-65535 (was " + advertisedPort + ")");
        }
        if (stage == SessionStage.CONSUMED) {
            throw new IllegalArgumentException("CONSUMED is not a wire stage");
        }
        if (stage != SessionStage.INACTIVE && sessionId == null) {
            throw new IllegalArgumentException(stage + " metadata requires a session id");
        }
    }

    public static PackageMetadata inactive(int advertisedPort) {
        return new PackageMetadata(advertisedPort, null, SessionStage.INACTIVE);
    }

    public static PackageMetadata inactive(int advertisedPort, int sessionId) {
        return new PackageMetadata(advertisedPort, sessionId, SessionStage.INACTIVE);
    }

    public static PackageMetadata request(int advertisedPort, int sessionId) {
        return new PackageMetadata(advertisedPort, sessionId, SessionStage.REQUEST);
    }

    public static PackageMetadata response(int advertisedPort, int sessionId) {
        return new PackageMetadata(advertisedPort, sessionId, SessionStage.RESPONSE);
    }

    public boolean hasSession() {
        return sessionId != null;
    }
}
