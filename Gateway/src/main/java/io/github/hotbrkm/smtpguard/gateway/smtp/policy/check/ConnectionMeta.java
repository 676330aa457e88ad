package io.github.hotbrkm.smtpguard.gateway.smtp.policy.check;

import io.github.hotbrkm.smtpguard.gateway.smtp.util.IpAddressUtil;

import java.net.InetAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * What is known about the connecting client.
 * <p>
 * The reverse DNS name is resolved on first use and then kept for the lifetime of this object.
 * </p>
 */
public final class ConnectionMeta {

    private final SocketAddress remoteAddress;
    private final String heloHostname;
    private final Supplier<ReverseDnsName> reverseDnsSource;
    private volatile ReverseDnsName reverseDns;

    private ConnectionMeta(SocketAddress remoteAddress, String heloHostname, Supplier<ReverseDnsName> reverseDnsSource) {
        this.remoteAddress = remoteAddress;
        this.heloHostname = heloHostname;
        this.reverseDnsSource = Objects.requireNonNull(reverseDnsSource);
    }

    public static ConnectionMeta of(SocketAddress remoteAddress, String heloHostname, ReverseDnsName reverseDns) {
        ReverseDnsName value = reverseDns == null ? ReverseDnsName.notAttempted() : reverseDns;
        return new ConnectionMeta(remoteAddress, heloHostname, () -> value);
    }

    public static ConnectionMeta lazy(SocketAddress remoteAddress, String heloHostname, Supplier<ReverseDnsName> reverseDns) {
        return new ConnectionMeta(remoteAddress, heloHostname, reverseDns);
    }

    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    /**
     * Client IP, or empty when the transport is not IP based.
     */
    public Optional<InetAddress> ipAddress() {
        return IpAddressUtil.ipAddressOf(remoteAddress);
    }

    /**
     * Hostname claimed in HELO/EHLO. May be null if the client never sent one.
     */
    public String heloHostname() {
        return heloHostname;
    }

    public ReverseDnsName reverseDns() {
        ReverseDnsName value = reverseDns;
        if (value == null) {
            synchronized (this) {
                value = reverseDns;
                if (value == null) {
                    value = reverseDnsSource.get();
                    if (value == null) {
                        value = ReverseDnsName.notAttempted();
                    }
                    reverseDns = value;
                }
            }
        }
        return value;
    }
}
