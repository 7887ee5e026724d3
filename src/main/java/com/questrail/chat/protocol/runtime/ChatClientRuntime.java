package com.questrail.chat.protocol.runtime;

import com.questrail.chat.api.ChatClient;
import com.questrail.chat.api.SessionOutput;
import com.questrail.chat.api.SessionPhase;
import com.questrail.chat.protocol.ChatSessionController;
import com.questrail.chat.protocol.codec.impl.DefaultDatagramFrameCodec;
import com.questrail.chat.protocol.codec.impl.DefaultStreamFrameCodec;
import com.questrail.chat.protocol.config.ChatClientConfig;
import com.questrail.chat.protocol.internal.events.SessionCommandEvent;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.internal.exec.DelegatingIntentExecutor;
import com.questrail.chat.protocol.internal.exec.SessionDriver;
import com.questrail.chat.protocol.internal.exec.TimedSessionIntentExecutor;
import com.questrail.chat.protocol.internal.exec.TransportIntentExecutor;
import com.questrail.chat.protocol.internal.reliability.ReliabilityEngine;
import com.questrail.chat.protocol.internal.shutdown.ShutdownCoordinator;
import com.questrail.chat.protocol.internal.state.SessionReducer;
import com.questrail.chat.protocol.internal.state.SessionState;
import com.questrail.chat.protocol.internal.time.MonotonicClock;
import com.questrail.chat.protocol.internal.time.MonotonicScheduler;
import com.questrail.chat.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.chat.protocol.internal.time.SystemMonotonicClock;
import com.questrail.chat.protocol.internal.time.SystemWallClock;
import com.questrail.chat.protocol.model.TerminationCause;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.observability.Slf4jChatObservabilitySink;
import com.questrail.chat.protocol.observability.Slf4jSessionOutput;
import com.questrail.chat.protocol.transport.DatagramEndpoint;
import com.questrail.chat.protocol.transport.ProtocolTransport;
import com.questrail.chat.protocol.transport.StreamEndpoint;
import com.questrail.chat.protocol.transport.tcp.TcpProtocolTransport;
import com.questrail.chat.protocol.transport.tcp.netty.NettyTcpStreamEndpoint;
import com.questrail.chat.protocol.transport.udp.UdpProtocolTransport;
import com.questrail.chat.protocol.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * ChatClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one chat session.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   ChatClient command ─┐
 *                       ├─→ ChatSessionController ─→ TimedSessionIntentExecutor
 *   SessionDriver ──────┘          ▲                      └─→ TransportIntentExecutor
 *        ▲                         │ reply timeouts            ├─→ ProtocolTransport
 *        └── transport.events() ───┘                           ├─→ SessionOutput
 *                                                              └─→ ShutdownCoordinator
 * </pre>
 *
 * <p>The transport is selected by {@link ChatClientConfig#transport()}. The
 * datagram transport reads session context from the controller, a cycle closed
 * through {@link DelegatingIntentExecutor}.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()            → transport up (≤ connectTimeout), receive task running
 *   runtime.leave() / fault    → bounded shutdown; receive task and timers stop
 *   runtime.awaitTermination() → termination cause
 * </pre>
 */
public final class ChatClientRuntime implements ChatClient
{
    private final ChatClientConfig config;
    private final ChatSessionController controller;
    private final ProtocolTransport transport;
    private final SessionDriver driver;
    private final ShutdownCoordinator shutdown;
    private final ScheduledThreadPoolExecutor schedulerExecutor;
    private final Supplier<Instant> wallClock;

    private ChatClientRuntime(ChatClientConfig config,
                              ChatSessionController controller,
                              ProtocolTransport transport,
                              SessionDriver driver,
                              ShutdownCoordinator shutdown,
                              ScheduledThreadPoolExecutor schedulerExecutor,
                              Supplier<Instant> wallClock)
    {
        this.config = config;
        this.controller = controller;
        this.transport = transport;
        this.driver = driver;
        this.shutdown = shutdown;
        this.schedulerExecutor = schedulerExecutor;
        this.wallClock = wallClock;
    }

    /**
     * Brings the transport up and starts the receive task.
     *
     * @throws ChatClientStartException if the transport is not up within
     *         {@code connectTimeout}; all resources are released first
     */
    public void start() {
        Duration connectTimeout = config.timingPolicy().connectTimeout();
        try {
            transport.start().get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release();
            throw new ChatClientStartException("interrupted while connecting", e);
        } catch (ExecutionException e) {
            release();
            throw new ChatClientStartException("could not connect to " + config.host() + ":" + config.port()
                    + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            release();
            throw new ChatClientStartException("no connection to " + config.host() + ":" + config.port()
                    + " within " + connectTimeout.toMillis() + " ms", e);
        }
        driver.start();
    }

    /**
     * Leaves the session (if still live) and waits for the shutdown sequence.
     */
    public void stop() throws InterruptedException {
        leave();
        awaitTermination(config.timingPolicy().shutdownBudget().plusSeconds(1));
    }

    // -------------------------------------------------------------------------
    // ChatClient
    // -------------------------------------------------------------------------

    @Override
    public void authenticate(String username, String secret, String displayName) {
        controller.submit(new SessionCommandEvent.Authenticate(wallClock.get(), username, secret, displayName));
    }

    @Override
    public void join(String channel) {
        controller.submit(new SessionCommandEvent.Join(wallClock.get(), channel));
    }

    @Override
    public void sendMessage(String content) {
        controller.submit(new SessionCommandEvent.SendMessage(wallClock.get(), content));
    }

    @Override
    public void rename(String displayName) {
        controller.submit(new SessionCommandEvent.Rename(wallClock.get(), displayName));
    }

    @Override
    public void leave() {
        controller.submit(new SessionCommandEvent.Leave(wallClock.get()));
    }

    @Override
    public SessionPhase phase() {
        return controller.state().phase();
    }

    @Override
    public Optional<String> channel() {
        return controller.state().confirmedChannel();
    }

    @Override
    public Optional<String> displayName() {
        return controller.state().displayName();
    }

    @Override
    public Optional<TerminationCause> awaitTermination(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(shutdown.termination().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("shutdown sequence failed", e.getCause());
        }
    }

    /**
     * Current session snapshot.
     */
    public SessionState state() {
        return controller.state();
    }

    ProtocolTransport transport() {
        return transport;
    }

    private void release() {
        driver.stop();
        transport.disconnect();
        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChatClientConfig config;
        private SessionOutput output;
        private ChatObservabilitySink observabilitySink;
        private DatagramEndpoint datagramEndpoint;
        private StreamEndpoint streamEndpoint;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;

        public Builder withConfig(ChatClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSessionOutput(SessionOutput output) {
            this.output = output;
            return this;
        }

        public Builder withObservabilitySink(ChatObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty UDP endpoint.
         */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.datagramEndpoint = endpoint;
            return this;
        }

        /**
         * Replaces the Netty TCP endpoint.
         */
        public Builder withStreamEndpoint(StreamEndpoint endpoint) {
            this.streamEndpoint = endpoint;
            return this;
        }

        /**
         * Clock and scheduler used for every timeout. Both or neither.
         */
        public Builder withTime(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public ChatClientRuntime build() {
            Objects.requireNonNull(config, "config");

            ChatTimingPolicy timing = config.timingPolicy();
            Supplier<Instant> wallClock = SystemWallClock.INSTANCE::now;
            SessionOutput effectiveOutput = output != null ? output : new Slf4jSessionOutput();
            ChatObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jChatObservabilitySink(config.verbose());

            // 1. Time
            MonotonicClock effectiveClock;
            MonotonicScheduler effectiveScheduler;
            ScheduledThreadPoolExecutor schedulerExec = null;
            if (scheduler != null) {
                effectiveClock = Objects.requireNonNull(clock, "clock");
                effectiveScheduler = scheduler;
            } else {
                effectiveClock = SystemMonotonicClock.INSTANCE;
                schedulerExec = new ScheduledThreadPoolExecutor(1, r -> {
                    Thread t = new Thread(r, "chat-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                schedulerExec.setRemoveOnCancelPolicy(true);
                schedulerExec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, effectiveClock);
            }

            // 2. Controller, with its executor installed once the transport exists
            DelegatingIntentExecutor executor = new DelegatingIntentExecutor();
            ChatSessionController controller = new ChatSessionController(
                    SessionState.initial(wallClock.get()),
                    new SessionReducer(),
                    executor,
                    sink,
                    wallClock);

            // 3. Transport
            InetSocketAddress server = config.serverAddress();
            ProtocolTransport transport;
            switch (config.transport()) {
                case UDP -> {
                    DatagramEndpoint endpoint = datagramEndpoint != null
                            ? datagramEndpoint
                            : new NettyUdpDatagramEndpoint();
                    DefaultDatagramFrameCodec codec = new DefaultDatagramFrameCodec();
                    ReliabilityEngine reliability = new ReliabilityEngine(
                            endpoint, codec, server, controller,
                            effectiveClock, effectiveScheduler, timing, sink, wallClock);
                    transport = new UdpProtocolTransport(endpoint, codec, reliability, sink, wallClock);
                }
                case TCP -> {
                    StreamEndpoint endpoint = streamEndpoint != null
                            ? streamEndpoint
                            : new NettyTcpStreamEndpoint(server, timing.connectTimeout());
                    transport = new TcpProtocolTransport(endpoint, new DefaultStreamFrameCodec(), sink, wallClock);
                }
                default -> throw new IllegalStateException("unsupported transport " + config.transport());
            }

            // 4. Inbound receive task
            SessionDriver driver = new SessionDriver(transport.events(), controller::submit, sink, wallClock);

            // 5. Shutdown; stops the receive task and the timers when done
            ScheduledThreadPoolExecutor ownedExec = schedulerExec;
            ShutdownCoordinator shutdown = new ShutdownCoordinator(
                    transport, effectiveOutput, effectiveClock, effectiveScheduler, timing, sink, wallClock,
                    () -> {
                        driver.stop();
                        if (ownedExec != null) {
                            ownedExec.shutdown();
                        }
                    });

            // 6. Executors
            TransportIntentExecutor transportExecutor =
                    new TransportIntentExecutor(transport, effectiveOutput, shutdown, sink, wallClock);
            executor.setDelegate(new TimedSessionIntentExecutor(
                    transportExecutor, controller::submit, effectiveClock, effectiveScheduler, wallClock, timing));

            return new ChatClientRuntime(config, controller, transport, driver, shutdown, schedulerExec, wallClock);
        }
    }
}
