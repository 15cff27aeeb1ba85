package com.mygraph.repository;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.mygraph.config.EnvConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionAdapterTest {

    @AfterEach
    void tearDown() {
        ConnectionAdapter.closeShared();
    }

    @Test
    void clientIsCreatedOnFirstUseOnly() {
        AtomicInteger created = new AtomicInteger();
        InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
        ConnectionAdapter adapter = new ConnectionAdapter(() -> {
            created.incrementAndGet();
            return client;
        });

        assertFalse(adapter.isInitialized());
        assertEquals(0, created.get());

        assertSame(client, adapter.getClient());
        assertSame(client, adapter.getClient());
        assertEquals(1, created.get());
        assertTrue(adapter.isInitialized());
    }

    @Test
    void concurrentFirstUseCreatesOneClient() throws Exception {
        AtomicInteger created = new AtomicInteger();
        ConnectionAdapter adapter = new ConnectionAdapter(() -> {
            created.incrementAndGet();
            return new InMemoryGraphStoreClient();
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<GraphStoreClient>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return adapter.getClient();
                }));
            }
            start.countDown();
            GraphStoreClient first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<GraphStoreClient> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, created.get());
    }

    @Test
    void nullClientFromFactoryIsReported() {
        ConnectionAdapter adapter = new ConnectionAdapter(() -> null);

        assertThrows(IllegalStateException.class, adapter::getClient);
        assertFalse(adapter.isInitialized());
    }

    @Test
    void missingUriFailsOnFirstUse() {
        ConnectionAdapter adapter = new ConnectionAdapter(new Neo4jClientFactory("", null, null, null));

        IllegalStateException e = assertThrows(IllegalStateException.class, adapter::getClient);
        assertTrue(e.getMessage().contains("NEO4J_URI"));
    }

    @Test
    void factoryBuildsNeo4jClientWithoutConnecting() {
        Neo4jClientFactory factory = new Neo4jClientFactory("bolt://localhost:17687", null, null, null);

        GraphStoreClient client = factory.get();
        try {
            assertTrue(client instanceof Neo4jGraphStoreClient);
        } finally {
            client.close();
        }
    }

    @Test
    void categoryAnchorIsCreatedOnceAndCached() throws Exception {
        InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
        ConnectionAdapter adapter = new ConnectionAdapter(() -> client);

        StoreNode people = adapter.category("Person");
        StoreNode again = adapter.category("Person");
        StoreNode pets = adapter.category("Pet");

        assertSame(people, again);
        assertNotEquals(people.getId(), pets.getId());
        assertEquals("Person", people.getProperties().get("category"));
        assertEquals(2, client.indexEntryCount(ConnectionAdapter.CATEGORY_INDEX));
    }

    @Test
    void categoryAnchorIsReusedByNewAdapter() throws Exception {
        InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
        StoreNode first = new ConnectionAdapter(() -> client).category("Person");

        StoreNode second = new ConnectionAdapter(() -> client).category("Person");

        assertEquals(first.getId(), second.getId());
        assertEquals(1, client.indexEntryCount(ConnectionAdapter.CATEGORY_INDEX));
    }

    @Test
    void closeReleasesClientAndAllowsReconnect() {
        AtomicInteger created = new AtomicInteger();
        List<InMemoryGraphStoreClient> clients = new ArrayList<>();
        ConnectionAdapter adapter = new ConnectionAdapter(() -> {
            created.incrementAndGet();
            InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
            clients.add(client);
            return client;
        });

        adapter.close();
        assertEquals(0, created.get());

        adapter.getClient();
        adapter.close();
        assertTrue(clients.get(0).isClosed());
        assertFalse(adapter.isInitialized());

        assertNotSame(clients.get(0), adapter.getClient());
        assertEquals(2, created.get());
    }

    @Test
    void indexHandlesFollowCurrentClient() throws Exception {
        List<InMemoryGraphStoreClient> clients = new ArrayList<>();
        ConnectionAdapter adapter = new ConnectionAdapter(() -> {
            InMemoryGraphStoreClient client = new InMemoryGraphStoreClient();
            clients.add(client);
            return client;
        });

        IndexHandle first = adapter.index("Person");
        assertSame(first, adapter.index("Person"));
        adapter.close();
        IndexHandle second = adapter.index("Person");

        assertNotSame(first, second);
        assertEquals(1, clients.get(0).getIndexCreations());
        assertEquals(1, clients.get(1).getIndexCreations());
    }

    @Test
    void sharedAdapterIsCreatedOnceWithoutConnecting() {
        ConnectionAdapter shared = ConnectionAdapter.shared();

        assertSame(shared, ConnectionAdapter.shared());
        assertFalse(shared.isInitialized());
    }

    @Test
    void closeSharedDiscardsInstance() {
        ConnectionAdapter first = ConnectionAdapter.shared();

        ConnectionAdapter.closeShared();
        ConnectionAdapter second = ConnectionAdapter.shared();

        assertNotSame(first, second);
        assertFalse(second.isInitialized());
        assertDoesNotThrow(ConnectionAdapter::closeShared);
        assertDoesNotThrow(ConnectionAdapter::closeShared);
    }

    @Test
    void environmentFactoryDefaultsUri() {
        assumeTrue(EnvConfig.get("NEO4J_URI") == null, "NEO4J_URI is set");

        Neo4jClientFactory factory = Neo4jClientFactory.fromEnvironment();

        assertEquals(Neo4jClientFactory.DEFAULT_URI, factory.getUri());
    }
}
