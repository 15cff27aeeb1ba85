package com.mygraph.repository;

import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Neo4j 上的二级索引实现。
 * 每个索引项是一个 (:OgmIndexEntry {index, key, value})-[:INDEXES]->(node)；
 * 唯一索引项额外带 slot 属性，由唯一约束保证 MERGE 的原子性。
 */
public class Neo4jIndexHandle implements IndexHandle {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jIndexHandle.class);

    private static final String ENTRY = Neo4jGraphStoreClient.INDEX_ENTRY_LABEL;
    private static final String INDEXES = Neo4jGraphStoreClient.INDEXES_RELATION;

    private final Neo4jGraphStoreClient client;
    private final String name;

    Neo4jIndexHandle(Neo4jGraphStoreClient client, String name) {
        this.client = client;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void add(String key, Object value, StoreNode node) throws IOException {
        String cypher = "MATCH (n) WHERE elementId(n) = $nodeId "
            + "CREATE (e:" + ENTRY + " {index: $index, key: $key, value: $value})-[:" + INDEXES + "]->(n)";
        try (Session session = client.openSession()) {
            session.run(cypher, Values.parameters(
                "nodeId", node.getId(), "index", name, "key", key, "value", value)).consume();
            logger.debug("Indexed {}={} -> {} in index {}", key, value, node.getId(), name);
        } catch (Exception e) {
            logger.error("Failed to add index entry in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to add index entry: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean addIfAbsent(String key, Object value, StoreNode node) throws IOException {
        String cypher = "MATCH (n) WHERE elementId(n) = $nodeId "
            + "MERGE (e:" + ENTRY + " {slot: $slot}) "
            + "ON CREATE SET e.index = $index, e.key = $key, e.value = $value, e.owner = $nodeId "
            + "WITH e, n, e.owner = $nodeId AS claimed "
            + "FOREACH (ignored IN CASE WHEN claimed THEN [1] ELSE [] END | MERGE (e)-[:" + INDEXES + "]->(n)) "
            + "RETURN claimed";
        try (Session session = client.openSession()) {
            Result result = session.run(cypher, Values.parameters(
                "nodeId", node.getId(), "slot", slotOf(name, key, value),
                "index", name, "key", key, "value", value));
            if (!result.hasNext()) {
                throw new IOException("node " + node.getId() + " not found");
            }
            boolean claimed = result.next().get("claimed").asBoolean();
            if (!claimed) {
                logger.debug("Unique index entry {}={} in index {} already taken", key, value, name);
            }
            return claimed;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to add unique index entry in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to add unique index entry: " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(StoreEntity entity) throws IOException {
        String cypher = "MATCH (e:" + ENTRY + " {index: $index})-[:" + INDEXES + "]->(n) "
            + "WHERE elementId(n) = $nodeId DETACH DELETE e";
        try (Session session = client.openSession()) {
            session.run(cypher, Values.parameters("index", name, "nodeId", entity.getId())).consume();
            logger.debug("Removed index entries of {} from index {}", entity.getId(), name);
        } catch (Exception e) {
            logger.error("Failed to remove index entries in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to remove index entries: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoreNode> query(IndexQuery query) throws IOException {
        if (query.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, Object> params = new HashMap<>();
        String cypher = toCypher(query, params);
        try (Session session = client.openSession()) {
            Result result = session.run(cypher, params);
            List<StoreNode> nodes = new ArrayList<>();
            while (result.hasNext()) {
                nodes.add(Neo4jGraphStoreClient.toStoreNode(result.next().get("n").asNode()));
            }
            logger.debug("Index {} query [{}] matched {} nodes", name, query, nodes.size());
            return nodes;
        } catch (Exception e) {
            logger.error("Failed to query index in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to query index: " + e.getMessage(), e);
        }
    }

    @Override
    public StoreNode getOrCreate(String key, Object value, Map<String, Object> properties) throws IOException {
        String cypher = "MERGE (e:" + ENTRY + " {slot: $slot}) "
            + "ON CREATE SET e.index = $index, e.key = $key, e.value = $value "
            + "MERGE (e)-[:" + INDEXES + "]->(n) "
            + "ON CREATE SET n = $props "
            + "RETURN n";
        try (Session session = client.openSession()) {
            Result result = session.run(cypher, Values.parameters(
                "slot", slotOf(name, key, value), "index", name, "key", key, "value", value,
                "props", properties != null ? properties : Collections.emptyMap()));
            StoreNode node = Neo4jGraphStoreClient.toStoreNode(result.single().get("n").asNode());
            logger.debug("Resolved {}={} in index {} to node {}", key, value, name, node.getId());
            return node;
        } catch (Exception e) {
            logger.error("Failed to get or create indexed node in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to get or create indexed node: " + e.getMessage(), e);
        }
    }

    /**
     * 每个条件对应一个 MATCH，全部命中同一个 n 即为 AND
     */
    String toCypher(IndexQuery query, Map<String, Object> params) {
        StringBuilder cypher = new StringBuilder();
        params.put("index", name);
        List<IndexQuery.Term> terms = query.getTerms();
        for (int i = 0; i < terms.size(); i++) {
            IndexQuery.Term term = terms.get(i);
            cypher.append("MATCH (e").append(i).append(':').append(ENTRY)
                .append(" {index: $index, key: $k").append(i).append(", value: $v").append(i).append("})-[:")
                .append(INDEXES).append("]->(n) ");
            params.put("k" + i, term.getKey());
            params.put("v" + i, normalize(term.getValue()));
        }
        cypher.append("RETURN DISTINCT n");
        return cypher.toString();
    }

    /**
     * 唯一索引项的槽位键，值带类型前缀以区分 "1" 和 1
     */
    static String slotOf(String index, String key, Object value) {
        Object normalized = normalize(value);
        String tag;
        if (normalized instanceof Long) {
            tag = "i";
        } else if (normalized instanceof Double) {
            tag = "f";
        } else if (normalized instanceof Boolean) {
            tag = "b";
        } else {
            tag = "s";
        }
        return index + "|" + key + "|" + tag + ":" + normalized;
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }
}
