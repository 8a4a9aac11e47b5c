package com.wangbin.hostkeeper.core.connection.manager;

import com.wangbin.hostkeeper.common.exception.ErrorKind;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.manager.ConfigResolver;
import com.wangbin.hostkeeper.core.config.manager.DefinitionLoader;
import com.wangbin.hostkeeper.core.connection.adapter.AbstractConnectionAdapter;
import com.wangbin.hostkeeper.core.connection.adapter.ConnectionAdapter;
import com.wangbin.hostkeeper.core.connection.factory.ConnectionFactory;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private static final String HOST = "web-1";

    @TempDir
    Path configDir;

    private final List<FakeAdapter> created = new CopyOnWriteArrayList<>();
    private volatile boolean reachable = true;
    private volatile CommandResponse nextResponse = CommandResponse.ok("ok");
    private volatile boolean failTransport;
    private volatile boolean timeOut;

    private ConnectionManager connectionManager;

    @BeforeEach
    void setUp() {
        KeeperProperties properties = new KeeperProperties();
        properties.getConfig().setDirectory(configDir.toString());
        properties.getConfig().setWriteDefaults(false);
        properties.getConnection().setSessionPoolSize(1);

        DefinitionLoader loader = new DefinitionLoader(properties);
        ConfigResolver resolver = new ConfigResolver(properties, loader, event -> { });
        resolver.apply(loader.parse(null, null, """
                hosts:
                  web-1:
                    address: 10.0.0.1
                    connectors:
                      fake:
                        settings:
                          command_timeout: "200"
                """), "test");

        ConnectionFactory factory = new ConnectionFactory();
        factory.register("fake", config -> {
            FakeAdapter adapter = new FakeAdapter(config);
            created.add(adapter);
            return adapter;
        });
        connectionManager = new ConnectionManager(factory, resolver, properties);
    }

    @Test
    void idleSessionIsReused() {
        ConnectionAdapter first;
        try (Session session = connectionManager.acquireSession(HOST)) {
            first = session.getAdapter();
            assertEquals("ok", connectionManager.execute(session, "true", 1000).stdout());
        }
        assertEquals(1, connectionManager.getIdleSessionCount(HOST));

        try (Session session = connectionManager.acquireSession(HOST)) {
            assertSame(first, session.getAdapter());
        }
        assertEquals(1, created.size());
    }

    @Test
    void transportFailureDiscardsSession() {
        failTransport = true;
        try (Session session = connectionManager.acquireSession(HOST)) {
            KeeperException e = assertThrows(KeeperException.class,
                    () -> connectionManager.execute(session, "true", 1000));
            assertTrue(e.is(ErrorKind.CONNECTION));
            assertTrue(session.isBroken());
        }
        assertEquals(0, connectionManager.getIdleSessionCount(HOST));
        assertFalse(created.get(0).isConnected());

        failTransport = false;
        try (Session session = connectionManager.acquireSession(HOST)) {
            assertNotSame(created.get(0), session.getAdapter());
        }
    }

    @Test
    void timeoutIsOwnKindAndDiscardsSession() {
        timeOut = true;
        try (Session session = connectionManager.acquireSession(HOST)) {
            KeeperException e = assertThrows(KeeperException.class,
                    () -> connectionManager.execute(session, "sleep 60", 100));
            assertTrue(e.is(ErrorKind.TIMEOUT));
            assertTrue(session.isBroken());
        }
        assertEquals(0, connectionManager.getIdleSessionCount(HOST));
    }

    @Test
    void nonZeroExitIsExecutionErrorAndKeepsSession() {
        nextResponse = new CommandResponse("", "permission denied", 1);
        try (Session session = connectionManager.acquireSession(HOST)) {
            KeeperException e = assertThrows(KeeperException.class,
                    () -> connectionManager.execute(session, "cat /root/x", 1000));
            assertTrue(e.is(ErrorKind.EXECUTION));
            assertTrue(e.getMessage().contains("permission denied"));
            assertFalse(session.isBroken());
        }
        assertEquals(1, connectionManager.getIdleSessionCount(HOST));
    }

    @Test
    void connectFailureReleasesPermit() {
        reachable = false;
        KeeperException e = assertThrows(KeeperException.class, () -> connectionManager.acquireSession(HOST));
        assertTrue(e.is(ErrorKind.CONNECTION));

        reachable = true;
        try (Session session = connectionManager.acquireSession(HOST)) {
            assertTrue(session.getAdapter().isConnected());
        }
    }

    @Test
    void exhaustedPoolTimesOut() {
        try (Session held = connectionManager.acquireSession(HOST)) {
            KeeperException e = assertThrows(KeeperException.class, () -> connectionManager.acquireSession(HOST));
            assertTrue(e.is(ErrorKind.CONNECTION));
            assertFalse(held.isClosed());
        }
    }

    @Test
    void invalidateClosesIdleAndReturnedSessions() {
        Session held = connectionManager.acquireSession(HOST);
        FakeAdapter adapter = created.get(0);

        connectionManager.invalidate(HOST);
        assertTrue(adapter.isConnected());

        held.close();
        assertFalse(adapter.isConnected());

        try (Session session = connectionManager.acquireSession(HOST)) {
            assertNotSame(adapter, session.getAdapter());
        }
    }

    @Test
    void closedSessionCannotExecute() {
        Session session = connectionManager.acquireSession(HOST);
        session.close();
        session.close();

        KeeperException e = assertThrows(KeeperException.class,
                () -> connectionManager.execute(session, "true", 1000));
        assertTrue(e.is(ErrorKind.CONNECTION));
    }

    @Test
    void unknownHostIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> connectionManager.acquireSession("missing"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    private class FakeAdapter extends AbstractConnectionAdapter {

        FakeAdapter(ConnectionConfig config) {
            super(config);
        }

        @Override
        protected void doConnect() {
            if (!reachable) {
                throw KeeperException.connectionException("No route to host", config.getHostId());
            }
        }

        @Override
        protected void doDisconnect() {
        }

        @Override
        protected CommandResponse doExecute(String command, long timeoutMillis) throws IOException {
            if (failTransport) {
                throw new IOException("Connection reset");
            }
            if (timeOut) {
                throw KeeperException.timeoutException(config.getHostId(), timeoutMillis);
            }
            return nextResponse;
        }
    }
}
