package it.unimib.datai.runinator.console.discovery;

import it.unimib.datai.runinator.common.model.WebServiceAnnouncement;
import it.unimib.datai.runinator.console.ConsoleException;
import it.unimib.datai.runinator.console.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Receives gossip datagrams on a UDP socket and feeds decoded announcements to a {@link DiscoveryRegistry}.
 *
 * <p>A dedicated thread waits for the socket to become readable, drains every pending datagram, and hands
 * the whole batch to the event loop, where the registry is updated and the active URL recomputed once.
 * A bind failure is reported once through the error channel and leaves the listener inert.</p>
 */
public final class GossipListener implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GossipListener.class);
    private static final int MAX_DATAGRAM_BYTES = 65507;
    private static final long SELECT_TIMEOUT_MS = 500;

    private final DiscoveryRegistry registry;
    private final AnnouncementDecoder decoder;
    private final Executor loop;
    private final Consumer<ConsoleException> errors;
    private final Clock clock;
    private final ByteBuffer buffer = ByteBuffer.allocate(MAX_DATAGRAM_BYTES);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DatagramChannel channel;
    private Selector selector;
    private Thread thread;

    public GossipListener(DiscoveryRegistry registry, Executor loop, Consumer<ConsoleException> errors) {
        this(registry, new AnnouncementDecoder(), loop, errors, Clock.systemUTC());
    }

    GossipListener(DiscoveryRegistry registry,
                   AnnouncementDecoder decoder,
                   Executor loop,
                   Consumer<ConsoleException> errors,
                   Clock clock) {
        this.registry = registry;
        this.decoder = decoder;
        this.loop = loop;
        this.errors = errors;
        this.clock = clock;
    }

    /**
     * Binds the gossip socket and starts receiving.
     *
     * @return {@code false} when the socket could not be bound; the failure has been reported
     */
    public boolean start(String bindAddress, int port) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Gossip listener already started");
        }
        InetAddress host = resolveBindAddress(bindAddress);
        try {
            channel = DatagramChannel.open(host.getAddress().length == 4
                    ? StandardProtocolFamily.INET
                    : StandardProtocolFamily.INET6);
            channel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            channel.setOption(StandardSocketOptions.SO_BROADCAST, true);
            channel.bind(new InetSocketAddress(host, port));
            channel.configureBlocking(false);
            selector = Selector.open();
            channel.register(selector, SelectionKey.OP_READ);
        } catch (IOException | RuntimeException e) {
            closeQuietly();
            String message = "Failed to bind gossip socket on " + host.getHostAddress() + ":" + port
                    + ": " + e.getMessage();
            log.error(message);
            ConsoleException failure = new ConsoleException(FailureKind.DISCOVERY_BIND, message, e);
            loop.execute(() -> errors.accept(failure));
            return false;
        }

        running.set(true);
        thread = new Thread(this::run, "runinator-gossip-listener");
        thread.setDaemon(true);
        thread.start();
        log.info("Listening for Runinator gossip on {}", localAddress());
        return true;
    }

    public boolean isListening() {
        return running.get();
    }

    /**
     * Bound local address, or {@code null} when not listening.
     */
    public InetSocketAddress localAddress() {
        try {
            return channel == null ? null : (InetSocketAddress) channel.getLocalAddress();
        } catch (IOException e) {
            return null;
        }
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (selector != null) {
            selector.wakeup();
        }
        if (thread != null) {
            try {
                thread.join(SELECT_TIMEOUT_MS * 2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeQuietly();
    }

    private void run() {
        try {
            while (running.get()) {
                if (selector.select(SELECT_TIMEOUT_MS) == 0) {
                    continue;
                }
                selector.selectedKeys().clear();
                receivePass();
            }
        } catch (ClosedSelectorException e) {
            log.debug("Gossip selector closed");
        } catch (IOException e) {
            if (running.get()) {
                log.error("Gossip listener stopped receiving", e);
            }
        }
    }

    void receivePass() throws IOException {
        Instant now = clock.instant();
        List<WebServiceAnnouncement> batch = new ArrayList<>();
        while (true) {
            SocketAddress sender = receive();
            if (sender == null) {
                break;
            }
            byte[] payload = new byte[buffer.remaining()];
            buffer.get(payload);
            String senderHost = sender instanceof InetSocketAddress isa && isa.getAddress() != null
                    ? isa.getAddress().getHostAddress()
                    : null;
            decoder.decode(payload, senderHost, now).ifPresentOrElse(
                    batch::add,
                    () -> log.debug("Ignoring gossip datagram from {} ({} bytes)", sender, payload.length));
        }
        if (!batch.isEmpty()) {
            loop.execute(() -> registry.registerAll(batch));
        }
    }

    private SocketAddress receive() throws IOException {
        buffer.clear();
        SocketAddress sender = channel.receive(buffer);
        buffer.flip();
        return sender;
    }

    private static InetAddress resolveBindAddress(String bindAddress) {
        if (bindAddress == null || bindAddress.isBlank()) {
            return InetAddress.getLoopbackAddress();
        }
        try {
            return InetAddress.getByName(bindAddress.trim());
        } catch (UnknownHostException e) {
            log.warn("Unknown gossip bind address '{}', falling back to loopback", bindAddress);
            return InetAddress.getLoopbackAddress();
        }
    }

    private void closeQuietly() {
        try {
            if (selector != null) {
                selector.close();
            }
        } catch (IOException e) {
            log.debug("Failed to close gossip selector", e);
        }
        try {
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            log.debug("Failed to close gossip channel", e);
        }
    }
}
