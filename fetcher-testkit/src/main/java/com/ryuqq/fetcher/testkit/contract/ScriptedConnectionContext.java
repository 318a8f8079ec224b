package com.ryuqq.fetcher.testkit.contract;

import com.ryuqq.fetcher.core.spi.ConnectionContext;
import com.ryuqq.fetcher.core.spi.HttpRequestSpec;
import com.ryuqq.fetcher.core.spi.RawResponse;
import com.ryuqq.fetcher.core.spi.TransportException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of ConnectionContext backed by a {@link ScriptedHttpServer}.
 *
 * <p>Tracks its own lifecycle so tests can assert who closed it and how often.
 * Requests after close fail with {@link IllegalStateException}.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class ScriptedConnectionContext implements ConnectionContext {

    private final ScriptedHttpServer server;
    private final AtomicBoolean closed;
    private final AtomicInteger closeCalls;

    /**
     * Creates an open context talking to the given server.
     *
     * @param server scripted server
     */
    public ScriptedConnectionContext(ScriptedHttpServer server) {
        if (server == null) {
            throw new IllegalArgumentException("server cannot be null");
        }
        this.server = server;
        this.closed = new AtomicBoolean();
        this.closeCalls = new AtomicInteger();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public RawResponse get(HttpRequestSpec request) throws TransportException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (closed.get()) {
            throw new IllegalStateException("connection context is closed");
        }
        return server.handle(request);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void close() {
        closeCalls.incrementAndGet();
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getCloseCalls() {
        return closeCalls.get();
    }
}
