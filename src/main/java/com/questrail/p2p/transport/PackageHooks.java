package com.questrail.p2p.transport;

import com.questrail.p2p.model.Package;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PackageHooks
 * -----------------------------------------------------------------------------
 * Before-send and after-receive interceptors, each as one global hook plus
 * optional per-topic hooks.
 *
 * <p>The global hook runs first; the topic hook for the (possibly replaced)
 * package's topic runs second. Passing {@code null} clears a hook. Hooks may
 * be changed at any time and take effect for the next package.</p>
 */
public final class PackageHooks
{
    private volatile PackageHook beforeSend;
    private volatile PackageHook afterReceive;
    private final Map<String, PackageHook> beforeSendByTopic = new ConcurrentHashMap<>();
    private final Map<String, PackageHook> afterReceiveByTopic = new ConcurrentHashMap<>();

    public void setBeforeSend(PackageHook hook) {
        this.beforeSend = hook;
    }

    public void setBeforeSend(String topic, PackageHook hook) {
        put(beforeSendByTopic, topic, hook);
    }

    public void setAfterReceive(PackageHook hook) {
        this.afterReceive = hook;
    }

    public void setAfterReceive(String topic, PackageHook hook) {
        put(afterReceiveByTopic, topic, hook);
    }

    public Package applyBeforeSend(Package pkg) {
        return apply(pkg, beforeSend, beforeSendByTopic);
    }

    public Package applyAfterReceive(Package pkg) {
        return apply(pkg, afterReceive, afterReceiveByTopic);
    }

    private static Package apply(Package pkg, PackageHook global, Map<String, PackageHook> byTopic) {
        Package current = pkg;
        if (global != null) {
            current = requireResult(global.intercept(current));
        }
        PackageHook topicHook = byTopic.get(current.topic());
        if (topicHook != null) {
            current = requireResult(topicHook.intercept(current));
        }
        return current;
    }

    private static Package requireResult(Package pkg) {
        return Objects.requireNonNull(pkg, "PackageHook returned null");
    }

    private static void put(Map<String, PackageHook> hooks, String topic, PackageHook hook) {
        Objects.requireNonNull(topic, "topic");
        if (hook == null) {
            hooks.remove(topic);
        } else {
            hooks.put(topic, hook);
        }
    }
}
