package com.questrail.chat.protocol.config;

import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for one chat client run.
 *
 * <p>This is everything the command-line boundary supplies: server address,
 * transport selection, datagram acknowledgment settings (inside the timing
 * policy) and the verbose-logging flag.</p>
 */
public record ChatClientConfig(
    String host,
    int port,
    TransportKind transport,
    ChatTimingPolicy timingPolicy,
    boolean verbose
) {
    public static final int DEFAULT_PORT = 4567;

    public ChatClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Resolves {@link #host()} and {@link #port()}.
     */
    public InetSocketAddress serverAddress() {
        return new InetSocketAddress(host, port);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private TransportKind transport = TransportKind.TCP;
        private ChatTimingPolicy timingPolicy = ChatTimingPolicy.defaults();
        private boolean verbose;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withTimingPolicy(ChatTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public ChatClientConfig build() {
            return new ChatClientConfig(host, port, transport, timingPolicy, verbose);
        }
    }
}
