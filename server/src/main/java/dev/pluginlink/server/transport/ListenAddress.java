package dev.pluginlink.server.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Path;

/**
 * Address the host listens on: {@code tcp://host:port}, plain {@code host:port}, or
 * {@code unix:///path/to/socket}.
 */
public sealed interface ListenAddress permits ListenAddress.Tcp, ListenAddress.Unix {

    String TCP_SCHEME = "tcp://";

    String UNIX_SCHEME = "unix://";

    static ListenAddress parse(String address) throws InvalidAddressException {
        if (address == null || address.isBlank()) {
            throw new InvalidAddressException("invalid server address: empty");
        }
        String value = address.trim();
        if (value.startsWith(UNIX_SCHEME)) {
            String path = value.substring(UNIX_SCHEME.length());
            if (path.isEmpty()) {
                throw new InvalidAddressException("invalid server address, missing socket path: " + address);
            }
            return new Unix(Path.of(path));
        }
        int schemeEnd = value.indexOf("://");
        if (schemeEnd >= 0) {
            if (!value.startsWith(TCP_SCHEME)) {
                throw new InvalidAddressException("unsupported address scheme: " + value.substring(0, schemeEnd));
            }
            value = value.substring(TCP_SCHEME.length());
        }
        int colon = value.lastIndexOf(':');
        if (colon < 0) {
            throw new InvalidAddressException("invalid server address, expected host:port: " + address);
        }
        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("invalid port in server address: " + address);
        }
        if (port < 0 || port > 65535) {
            throw new InvalidAddressException("port out of range in server address: " + address);
        }
        return new Tcp(host.isEmpty() ? "0.0.0.0" : host, port);
    }

    /**
     * Opens a blocking server channel bound to this address.
     */
    ServerSocketChannel bind() throws IOException;

    record Tcp(String host, int port) implements ListenAddress {

        @Override
        public ServerSocketChannel bind() throws IOException {
            ServerSocketChannel channel = ServerSocketChannel.open();
            try {
                channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
                return channel.bind(new InetSocketAddress(host, port));
            } catch (IOException e) {
                channel.close();
                throw e;
            }
        }

        @Override
        public String toString() {
            return TCP_SCHEME + host + ":" + port;
        }
    }

    /**
     * Unix domain socket. The socket file is created on bind and must not exist yet.
     */
    record Unix(Path path) implements ListenAddress {

        @Override
        public ServerSocketChannel bind() throws IOException {
            ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            try {
                return channel.bind(UnixDomainSocketAddress.of(path));
            } catch (IOException e) {
                channel.close();
                throw e;
            }
        }

        @Override
        public String toString() {
            return UNIX_SCHEME + path;
        }
    }
}
