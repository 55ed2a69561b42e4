package conveyor.dal;

/**
 * Network address of the daemon in {@code scheme:host:port} notation.
 * <p>Two schemes are recognised: {@code tcp:host:port} and {@code pipe:path}.
 * Only TCP addresses can be served by the HTTP gateway.</p>
 *
 * @since 13/10/2025
 */
public record ServiceAddress(String scheme, String host, int port, String path) {
    public static final String TCP = "tcp";
    public static final String PIPE = "pipe";

    /**
     * Parse an address string
     * @param value address such as {@code tcp:127.0.0.1:9999} or {@code pipe:/tmp/conveyord.socket}
     * @return parsed address
     * @throws ConfigurationException if the scheme is unknown or a component is missing/invalid
     */
    public static ServiceAddress parse(String value) throws ConfigurationException {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Service address cannot be empty");
        }

        String[] split = value.trim().split(":", 2);
        String scheme = split[0];

        if (PIPE.equals(scheme)) {
            if (split.length != 2 || split[1].isEmpty()) {
                throw new ConfigurationException("Missing pipe path in address '" + value + "'");
            }
            return new ServiceAddress(PIPE, null, 0, split[1]);
        }

        if (!TCP.equals(scheme)) {
            throw new ConfigurationException("Unknown protocol '" + scheme + "' in address '" + value + "'");
        }
        if (split.length != 2) {
            throw new ConfigurationException("Missing host in address '" + value + "'");
        }

        String[] hostPort = split[1].split(":", 2);
        if (hostPort.length != 2) {
            throw new ConfigurationException("Missing port in address '" + value + "'");
        }
        String host = hostPort[0];
        if (host.isEmpty()) {
            throw new ConfigurationException("Missing host in address '" + value + "'");
        }

        int port;
        try {
            port = Integer.parseInt(hostPort[1]);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port '" + hostPort[1] + "' in address '" + value + "'", e);
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port must be between 1 and 65535 in address '" + value + "'");
        }

        return new ServiceAddress(TCP, host, port, null);
    }

    public boolean isTcp() {
        return TCP.equals(scheme);
    }

    @Override
    public String toString() {
        return isTcp() ? String.format("tcp:%s:%d", host, port) : "pipe:" + path;
    }
}
