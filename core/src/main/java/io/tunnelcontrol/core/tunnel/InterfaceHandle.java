package io.tunnelcontrol.core.tunnel;

/** An established virtual interface. Closing it tears the interface down. */
public interface InterfaceHandle extends AutoCloseable {

    /** Platform identifier of the interface, for logging. */
    String name();

    @Override
    void close();
}
