package com.mimecast.lodestar.dns;

import java.util.Objects;

/**
 * SRV record.
 * <p>Target is kept as returned by DNS, possibly with a trailing dot.
 */
public final class SrvRecord {

    private final int priority;
    private final int weight;
    private final String target;
    private final int port;

    /**
     * Constructs a new SrvRecord instance.
     *
     * @param priority Priority, lower is preferred.
     * @param weight   Weight.
     * @param target   Target host.
     * @param port     Target port.
     */
    public SrvRecord(int priority, int weight, String target, int port) {
        if (priority < 0 || priority > 0xFFFF) {
            throw new IllegalArgumentException("Invalid SRV priority: " + priority);
        }
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Invalid SRV port: " + port);
        }
        this.priority = priority;
        this.weight = weight;
        this.target = Objects.requireNonNull(target, "target");
        this.port = port;
    }

    public int getPriority() {
        return priority;
    }

    public int getWeight() {
        return weight;
    }

    public String getTarget() {
        return target;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SrvRecord)) return false;
        SrvRecord that = (SrvRecord) o;
        return priority == that.priority && weight == that.weight && port == that.port && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, weight, target, port);
    }

    @Override
    public String toString() {
        return priority + " " + weight + " " + port + " " + target;
    }
}
