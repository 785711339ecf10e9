package com.questrail.p2p.transport;

import com.questrail.p2p.model.Package;
import com.questrail.p2p.model.PackageMetadata;
import com.questrail.p2p.model.SerializedMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PackageHooksTest
{
    private final PackageHooks hooks = new PackageHooks();

    private static Package pkg(String topic) {
        return new Package(new SerializedMessage(topic, "T", new byte[0]), PackageMetadata.inactive(9000));
    }

    @Test
    void withoutHooksThePackagePassesThroughUnchanged() {
        Package p = pkg("KAD");
        assertSame(p, hooks.applyBeforeSend(p));
        assertSame(p, hooks.applyAfterReceive(p));
    }

    @Test
    void globalHookRunsBeforeTopicHook() {
        List<String> order = new ArrayList<>();
        hooks.setBeforeSend(p -> { order.add("global"); return p; });
        hooks.setBeforeSend("KAD", p -> { order.add("topic"); return p; });

        hooks.applyBeforeSend(pkg("KAD"));

        assertEquals(List.of("global", "topic"), order);
    }

    @Test
    void topicHookOnlyMatchesItsTopic() {
        List<String> seen = new ArrayList<>();
        hooks.setAfterReceive("KAD", p -> { seen.add(p.topic()); return p; });

        hooks.applyAfterReceive(pkg("GOSSIP"));
        hooks.applyAfterReceive(pkg("KAD"));

        assertEquals(List.of("KAD"), seen);
    }

    @Test
    void topicHookSeesTheTopicOfTheReplacedPackage() {
        Package rerouted = pkg("GOSSIP");
        hooks.setBeforeSend(p -> rerouted);
        hooks.setBeforeSend("GOSSIP", p -> p.withMetadata(PackageMetadata.inactive(1)));

        Package out = hooks.applyBeforeSend(pkg("KAD"));

        assertEquals("GOSSIP", out.topic());
        assertEquals(1, out.metadata().advertisedPort());
    }

    @Test
    void beforeSendAndAfterReceiveAreIndependent() {
        hooks.setBeforeSend(p -> pkg("SENT"));

        assertEquals("KAD", hooks.applyAfterReceive(pkg("KAD")).topic());
        assertEquals("SENT", hooks.applyBeforeSend(pkg("KAD")).topic());
    }

    @Test
    void nullClearsAHook() {
        hooks.setAfterReceive(p -> pkg("X"));
        hooks.setAfterReceive("KAD", p -> pkg("Y"));
        hooks.setAfterReceive(null);
        hooks.setAfterReceive("KAD", null);

        assertEquals("KAD", hooks.applyAfterReceive(pkg("KAD")).topic());
    }

    @Test
    void hookReturningNullIsRejected() {
        hooks.setBeforeSend(p -> null);
        assertThrows(NullPointerException.class, () -> hooks.applyBeforeSend(pkg("KAD")));
    }
}
