package net.spookly.stateprox.session;

import java.net.InetSocketAddress;
import java.util.Optional;

import io.netty.util.NetUtil;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * IP literal plus port identifying one backend. Hosts are stored in canonical form
 * (dotted quad or compressed lowercase IPv6), so equal addresses always compare equal.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BackendAddress {
    private static final int MAX_PORT_DIGITS = 5;

    private final String host;
    private final int port;
    @EqualsAndHashCode.Exclude
    private final boolean ipv6;

    /**
     * Build an address from an IP literal (IPv6 with or without brackets) and a port.
     *
     * @throws IllegalArgumentException when the host is not an IP literal or the port is out of range
     */
    public static BackendAddress of(String host, int port) {
        BackendAddress address = create(host, port);
        if (address == null) {
            throw new IllegalArgumentException("backend address must be an IP literal with port 1-65535: "
                    + host + ":" + port);
        }
        return address;
    }

    /**
     * Parse {@code a.b.c.d:port} or {@code [v6]:port}. Never throws; malformed text yields empty.
     */
    public static Optional<BackendAddress> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String host;
        String portText;
        if (text.charAt(0) == '[') {
            int close = text.indexOf("]:");
            if (close < 0) {
                return Optional.empty();
            }
            host = text.substring(1, close);
            portText = text.substring(close + 2);
            if (!NetUtil.isValidIpV6Address(host)) {
                return Optional.empty();
            }
        } else {
            int colon = text.lastIndexOf(':');
            if (colon <= 0) {
                return Optional.empty();
            }
            host = text.substring(0, colon);
            portText = text.substring(colon + 1);
            if (!NetUtil.isValidIpV4Address(host)) {
                return Optional.empty();
            }
        }
        int port = parsePort(portText);
        if (port < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(create(host, port));
    }

    /**
     * Canonical {@code host:port} text, brackets around IPv6 hosts.
     */
    @Override
    public String toString() {
        if (ipv6) {
            return "[" + host + "]:" + port;
        }
        return host + ":" + port;
    }

    /**
     * Socket address for connecting to this backend; built from the literal, no DNS lookup.
     */
    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(NetUtil.createInetAddressFromIpAddressString(host), port);
    }

    private static BackendAddress create(String host, int port) {
        if (host == null || host.isEmpty() || port < 1 || port > 65535) {
            return null;
        }
        byte[] bytes = NetUtil.createByteArrayFromIpAddressString(host);
        if (bytes == null) {
            return null;
        }
        return new BackendAddress(NetUtil.bytesToIpAddress(bytes), port, bytes.length == 16);
    }

    private static int parsePort(String portText) {
        if (portText.isEmpty() || portText.length() > MAX_PORT_DIGITS) {
            return -1;
        }
        // encode never writes a leading zero
        if (portText.length() > 1 && portText.charAt(0) == '0') {
            return -1;
        }
        int port = 0;
        for (int i = 0; i < portText.length(); i++) {
            char c = portText.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            port = port * 10 + (c - '0');
        }
        return port;
    }
}
