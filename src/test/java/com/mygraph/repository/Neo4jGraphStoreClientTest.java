package com.mygraph.repository;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreClientTest {

    @Mock private Driver driver;
    @Mock private Session session;
    @Mock private Result result;
    @Mock private Record record;
    @Mock private Value nodeValue;
    @Mock private Value relValue;
    @Mock private Node node;
    @Mock private Relationship relationship;

    private Neo4jGraphStoreClient client;
    private final StoreNode category = new StoreNode("4:db:1", Map.of("category", "Person"));
    private final StoreNode jim = new StoreNode("4:db:2", Map.of("name", "Jim"));

    @BeforeEach
    void setUp() {
        lenient().when(driver.session()).thenReturn(session);
        client = new Neo4jGraphStoreClient(driver);
    }

    private void stubNode(String id, Map<String, Object> props) {
        when(nodeValue.asNode()).thenReturn(node);
        when(node.elementId()).thenReturn(id);
        when(node.asMap()).thenReturn(props);
    }

    private void stubRelationship(String id, String type, String startId, String endId) {
        when(relValue.asRelationship()).thenReturn(relationship);
        when(relationship.elementId()).thenReturn(id);
        when(relationship.type()).thenReturn(type);
        when(relationship.startNodeElementId()).thenReturn(startId);
        when(relationship.endNodeElementId()).thenReturn(endId);
    }

    @Test
    void createNodeLinksToCategoryInOneStatement() throws Exception {
        when(session.run(anyString(), anyMap())).thenReturn(result);
        when(result.hasNext()).thenReturn(true);
        when(result.next()).thenReturn(record);
        when(record.get("n")).thenReturn(nodeValue);
        when(record.get("r")).thenReturn(relValue);
        stubNode("4:db:2", Map.of("name", "Jim", "age", 30L));
        stubRelationship("5:db:9", "PERSON", "4:db:1", "4:db:2");

        CreatedNode created = client.createNode("Person", Map.of("name", "Jim", "age", 30), category, "PERSON");

        assertEquals("4:db:2", created.getNode().getId());
        assertEquals(30L, created.getNode().getProperties().get("age"));
        assertEquals("5:db:9", created.getCategoryRelationship().getId());
        assertEquals("4:db:1", created.getCategoryRelationship().getStartNodeId());

        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(session).run(cypher.capture(), anyMap());
        assertTrue(cypher.getValue().contains("CREATE (n:`Person` $props)"));
        assertTrue(cypher.getValue().contains("CREATE (c)-[r:`PERSON`]->(n)"));
        verify(session).close();
    }

    @Test
    void createNodeFailsWhenCategoryIsMissing() {
        when(session.run(anyString(), anyMap())).thenReturn(result);
        when(result.hasNext()).thenReturn(false);

        IOException e = assertThrows(IOException.class,
            () -> client.createNode("Person", Map.of(), category, "PERSON"));
        assertTrue(e.getMessage().contains("4:db:1"));
    }

    @Test
    void driverErrorsAreWrappedInIOException() {
        ServiceUnavailableException cause = new ServiceUnavailableException("connection refused");
        when(session.run(anyString(), anyMap())).thenThrow(cause);

        IOException e = assertThrows(IOException.class,
            () -> client.createNode("Person", Map.of(), category, "PERSON"));
        assertSame(cause, e.getCause());
        verify(session).close();
    }

    @Test
    void deleteSendsRelationshipsAndNodesTogether() throws Exception {
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        StoreRelationship rel = new StoreRelationship("5:db:9", "PERSON", "4:db:1", "4:db:2");

        client.delete(List.of(rel, jim));

        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(session).run(cypher.capture(), any(Value.class));
        assertTrue(cypher.getValue().indexOf("DELETE r") < cypher.getValue().indexOf("DELETE n"));
        verify(result).consume();
    }

    @Test
    void deleteOfNothingDoesNotTouchDriver() throws Exception {
        client.delete(Collections.emptyList());

        verifyNoInteractions(driver);
    }

    @Test
    void deleteFailureIsWrapped() {
        when(session.run(anyString(), any(Value.class)))
            .thenThrow(new ServiceUnavailableException("gone"));

        assertThrows(IOException.class, () -> client.delete(jim));
    }

    @Test
    void indexHandlesAreCachedAndSchemaEnsuredOnce() throws Exception {
        when(session.run(anyString())).thenReturn(result);

        IndexHandle first = client.getOrCreateIndex("Person");
        IndexHandle second = client.getOrCreateIndex("Person");
        IndexHandle pets = client.getOrCreateIndex("Pet");

        assertSame(first, second);
        assertNotSame(first, pets);
        assertEquals("Pet", pets.getName());
        verify(session, times(2)).run(anyString());
    }

    @Test
    void relatedNodesAreMappedFromRows() throws Exception {
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        when(result.hasNext()).thenReturn(true, false);
        when(result.next()).thenReturn(record);
        when(record.get("b")).thenReturn(nodeValue);
        stubNode("4:db:3", Map.of("name", "Bob"));

        List<StoreNode> nodes = client.getRelatedNodes(jim, Direction.OUTGOING, "FRIEND");

        assertEquals(1, nodes.size());
        assertEquals("4:db:3", nodes.get(0).getId());
        assertEquals("Bob", nodes.get(0).getProperties().get("name"));
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(session).run(cypher.capture(), any(Value.class));
        assertTrue(cypher.getValue().startsWith("MATCH (a)-[r:`FRIEND`]->(b)"));
    }

    @Test
    void hasRelationshipWithIsFalseForNoRows() throws Exception {
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        when(result.hasNext()).thenReturn(false);

        assertFalse(client.hasRelationshipWith(jim, category, Direction.INCOMING, "PERSON"));
    }

    @Test
    void getOrCreateRelationshipMerges() throws Exception {
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        when(result.hasNext()).thenReturn(true);
        when(result.next()).thenReturn(record);
        when(record.get("r")).thenReturn(relValue);
        stubRelationship("5:db:10", "FRIEND", "4:db:2", "4:db:3");
        StoreNode bob = new StoreNode("4:db:3", Map.of("name", "Bob"));

        StoreRelationship rel = client.getOrCreateRelationship(jim, "FRIEND", bob);

        assertEquals("FRIEND", rel.getType());
        assertEquals("4:db:3", rel.getEndNodeId());
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(session).run(cypher.capture(), any(Value.class));
        assertTrue(cypher.getValue().contains("MERGE (a)-[r:`FRIEND`]->(b)"));
    }

    @Test
    void setPropertiesOnMissingNodeFails() {
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        when(result.hasNext()).thenReturn(false);

        IOException e = assertThrows(IOException.class, () -> client.setProperties(jim, Map.of("name", "Jim")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void namedDatabaseIsUsedForSessions() throws Exception {
        Neo4jGraphStoreClient scoped = new Neo4jGraphStoreClient(driver, "people");
        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.run(anyString(), any(Value.class))).thenReturn(result);
        when(result.hasNext()).thenReturn(false);

        scoped.getRelationships(jim);

        verify(driver).session(any(SessionConfig.class));
        verify(driver, never()).session();
    }

    @Test
    void closeClosesDriver() {
        client.close();

        verify(driver).close();
    }

    @Test
    void patternsFollowDirection() {
        assertEquals("(a)-[r:`KNOWS`]->(b)", Neo4jGraphStoreClient.pattern("a", "r", "KNOWS", Direction.OUTGOING, "b"));
        assertEquals("(a)<-[r:`KNOWS`]-(b)", Neo4jGraphStoreClient.pattern("a", "r", "KNOWS", Direction.INCOMING, "b"));
        assertEquals("(a)-[r:`KNOWS`]-(b)", Neo4jGraphStoreClient.pattern("a", "r", "KNOWS", Direction.EITHER, "b"));
    }

    @Test
    void identifiersAreBacktickQuoted() {
        assertEquals("`Person`", Neo4jGraphStoreClient.quote("Person"));
        assertEquals("`we``ird`", Neo4jGraphStoreClient.quote("we`ird"));
    }
}
