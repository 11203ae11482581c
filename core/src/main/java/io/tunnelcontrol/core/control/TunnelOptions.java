package io.tunnelcontrol.core.control;

import java.util.List;

/**
 * Server-wide defaults applied to every API-initiated connect.
 *
 * @param allowedApps applications to capture; empty captures everything but ourselves
 * @param blockQuic   degrade UDP to push clients off HTTP/3
 */
public record TunnelOptions(List<String> allowedApps, boolean blockQuic) {

    public static final TunnelOptions DEFAULT = new TunnelOptions(List.of(), false);

    public TunnelOptions {
        allowedApps = allowedApps == null ? List.of() : List.copyOf(allowedApps);
    }
}
