package com.ryuqq.fetcher.testkit.contract;

import com.ryuqq.fetcher.core.spi.ConnectionContextFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConnectionContextFactory opening {@link ScriptedConnectionContext}s on one shared server.
 *
 * <p>Keeps every context it opened so tests can check that ad-hoc and batch contexts
 * were closed.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class ScriptedConnectionContextFactory implements ConnectionContextFactory {

    private final ScriptedHttpServer server;
    private final List<ScriptedConnectionContext> opened;

    /**
     * Creates a factory for the given server.
     *
     * @param server scripted server
     */
    public ScriptedConnectionContextFactory(ScriptedHttpServer server) {
        if (server == null) {
            throw new IllegalArgumentException("server cannot be null");
        }
        this.server = server;
        this.opened = new CopyOnWriteArrayList<>();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ScriptedConnectionContext open() {
        ScriptedConnectionContext context = new ScriptedConnectionContext(server);
        opened.add(context);
        return context;
    }

    /**
     * Returns the contexts opened so far, in order.
     *
     * @return snapshot of opened contexts
     */
    public List<ScriptedConnectionContext> opened() {
        return new ArrayList<>(opened);
    }

    /**
     * Whether every context opened so far has been closed.
     *
     * @return true if no opened context is still open
     */
    public boolean allClosed() {
        return opened.stream().allMatch(ScriptedConnectionContext::isClosed);
    }

    /**
     * Forgets opened contexts.
     */
    public void clear() {
        opened.clear();
    }
}
