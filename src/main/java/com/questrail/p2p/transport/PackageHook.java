package com.questrail.p2p.transport;

import com.questrail.p2p.model.Package;

/**
 * Interceptor run synchronously on a package just before it is encoded, or
 * just after it is decoded. May return the package unchanged or a replacement.
 */
@FunctionalInterface
public interface PackageHook
{
    Package intercept(Package pkg);
}
