package com.fieldlink.config;

import lombok.Value;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Bind address taken from the schema's {@code listen} entry: {@code host:port}, {@code [v6-host]:port} or {@code :port}.
 */
@Value
public class ListenAddress {
    String host;
    int port;

    /**
     * Parse a listen string.
     *
     * @param listen listen entry
     * @return parsed address
     * @throws ConfigException when the value is not {@code host:port}
     */
    public static ListenAddress parse(String listen) {
        if (listen == null || listen.isBlank()) {
            throw new ConfigException("listen address is empty");
        }
        String trimmed = listen.trim();
        int colonIdx = trimmed.lastIndexOf(':');
        if (colonIdx == -1 || colonIdx < trimmed.lastIndexOf(']')) {
            throw new ConfigException("listen address must be host:port, got `" + listen + "`");
        }

        String host = trimmed.substring(0, colonIdx);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try {
            port = Integer.parseInt(trimmed.substring(colonIdx + 1));
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid port in listen address `" + listen + "`", e);
        }
        if (port < 0 || port > 65535) {
            throw new ConfigException("port out of range in listen address `" + listen + "`");
        }
        return new ListenAddress(host.isEmpty() ? null : host, port);
    }

    /**
     * Resolve the host part.
     *
     * @return the bind address, or null to bind all interfaces
     */
    public InetAddress toInetAddress() {
        if (host == null) {
            return null;
        }
        try {
            return InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new ConfigException("cannot resolve listen host `" + host + "`", e);
        }
    }

    @Override
    public String toString() {
        return (host == null ? "" : host) + ":" + port;
    }
}
