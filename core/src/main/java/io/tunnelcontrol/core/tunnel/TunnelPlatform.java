package io.tunnelcontrol.core.tunnel;

/** Creates the virtual network interface the relay reads from and writes to. */
public interface TunnelPlatform {

    /**
     * Establishes an interface matching {@code spec}.
     *
     * @return the interface, or {@code null} when the platform refused (e.g. permission missing)
     * @throws io.tunnelcontrol.core.error.PlatformException on platform failure
     */
    InterfaceHandle establish(InterfaceSpec spec);
}
