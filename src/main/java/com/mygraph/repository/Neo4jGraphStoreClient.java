package com.mygraph.repository;

import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Values;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * 基于 Neo4j Java Driver 的图存储客户端（Cypher over Bolt）。
 * 节点和关系以 elementId 作为远端 ID。
 */
public class Neo4jGraphStoreClient implements GraphStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jGraphStoreClient.class);

    static final String INDEX_ENTRY_LABEL = "OgmIndexEntry";
    static final String INDEXES_RELATION = "INDEXES";

    private final Driver driver;
    private final String database;
    private final Map<String, Neo4jIndexHandle> indexes = new HashMap<>();
    private volatile boolean schemaEnsured;

    public Neo4jGraphStoreClient(Driver driver) {
        this(driver, null);
    }

    public Neo4jGraphStoreClient(Driver driver, String database) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.database = database;
    }

    Session openSession() {
        if (database == null || database.isEmpty()) {
            return driver.session();
        }
        return driver.session(SessionConfig.forDatabase(database));
    }

    @Override
    public CreatedNode createNode(String label, Map<String, Object> properties,
                                  StoreNode category, String relationType) throws IOException {
        StringBuilder cypher = new StringBuilder();
        cypher.append("MATCH (c) WHERE elementId(c) = $categoryId ");
        cypher.append("CREATE (n");
        if (label != null && !label.isEmpty()) {
            cypher.append(':').append(quote(label));
        }
        cypher.append(" $props) ");
        cypher.append("CREATE (c)-[r:").append(quote(relationType)).append("]->(n) ");
        cypher.append("RETURN n, r");

        Map<String, Object> params = new HashMap<>();
        params.put("categoryId", category.getId());
        params.put("props", properties != null ? properties : Collections.emptyMap());

        try (Session session = openSession()) {
            Result result = session.run(cypher.toString(), params);
            if (!result.hasNext()) {
                throw new IOException("category node " + category.getId() + " not found");
            }
            Record record = result.next();
            StoreNode node = toStoreNode(record.get("n").asNode());
            StoreRelationship rel = toStoreRelationship(record.get("r").asRelationship());
            logger.debug("Created node {} with label {} under category {}", node.getId(), label, category.getId());
            return new CreatedNode(node, rel);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to create node in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to create node: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(Collection<? extends StoreEntity> entities) throws IOException {
        List<String> relationshipIds = new ArrayList<>();
        List<String> nodeIds = new ArrayList<>();
        for (StoreEntity entity : entities) {
            if (entity instanceof StoreRelationship) {
                relationshipIds.add(entity.getId());
            } else {
                nodeIds.add(entity.getId());
            }
        }
        if (relationshipIds.isEmpty() && nodeIds.isEmpty()) {
            return;
        }

        // 单条语句，关系和节点在同一个事务里删除
        String cypher = "OPTIONAL MATCH ()-[r]->() WHERE elementId(r) IN $relationshipIds "
            + "DELETE r "
            + "WITH count(*) AS ignored "
            + "OPTIONAL MATCH (n) WHERE elementId(n) IN $nodeIds "
            + "DELETE n";

        try (Session session = openSession()) {
            session.run(cypher, Values.parameters("relationshipIds", relationshipIds, "nodeIds", nodeIds)).consume();
            logger.debug("Deleted {} relationships and {} nodes from Neo4j", relationshipIds.size(), nodeIds.size());
        } catch (Exception e) {
            logger.error("Failed to delete entities from Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to delete entities: " + e.getMessage(), e);
        }
    }

    @Override
    public void setProperties(StoreNode node, Map<String, Object> properties) throws IOException {
        String cypher = "MATCH (n) WHERE elementId(n) = $id SET n = $props RETURN elementId(n) AS id";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("id", node.getId(), "props", properties));
            if (!result.hasNext()) {
                throw new IOException("node " + node.getId() + " not found");
            }
            result.consume();
            logger.debug("Replaced properties of node {}", node.getId());
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to update node properties in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to update node properties: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> getProperties(StoreNode node) throws IOException {
        String cypher = "MATCH (n) WHERE elementId(n) = $id RETURN n";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("id", node.getId()));
            if (!result.hasNext()) {
                throw new IOException("node " + node.getId() + " not found");
            }
            return toStoreNode(result.next().get("n").asNode()).getProperties();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to read node properties from Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to read node properties: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized IndexHandle getOrCreateIndex(String name) throws IOException {
        ensureIndexSchema();
        return indexes.computeIfAbsent(name, n -> new Neo4jIndexHandle(this, n));
    }

    /**
     * 唯一索引依赖 slot 上的唯一约束，MERGE 才能在并发下保持原子
     */
    private void ensureIndexSchema() throws IOException {
        if (schemaEnsured) {
            return;
        }
        try (Session session = openSession()) {
            session.run("CREATE CONSTRAINT ogm_index_entry_slot IF NOT EXISTS "
                + "FOR (e:" + INDEX_ENTRY_LABEL + ") REQUIRE e.slot IS UNIQUE").consume();
            session.run("CREATE INDEX ogm_index_entry_lookup IF NOT EXISTS "
                + "FOR (e:" + INDEX_ENTRY_LABEL + ") ON (e.index, e.key, e.value)").consume();
            schemaEnsured = true;
            logger.info("Index entry constraints ensured in Neo4j");
        } catch (Exception e) {
            logger.error("Failed to create index entry constraints in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to create index entry constraints: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoreNode> getRelatedNodes(StoreNode node, Direction direction, String relationType) throws IOException {
        String cypher = "MATCH " + pattern("a", "r", relationType, direction, "b")
            + " WHERE elementId(a) = $id RETURN DISTINCT b";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("id", node.getId()));
            List<StoreNode> nodes = new ArrayList<>();
            while (result.hasNext()) {
                nodes.add(toStoreNode(result.next().get("b").asNode()));
            }
            logger.debug("Loaded {} nodes related to {} via {} ({})", nodes.size(), node.getId(), relationType, direction);
            return nodes;
        } catch (Exception e) {
            logger.error("Failed to load related nodes from Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to load related nodes: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasRelationshipWith(StoreNode node, StoreNode other, Direction direction, String relationType) throws IOException {
        return !getRelationshipsWith(node, other, direction, relationType).isEmpty();
    }

    @Override
    public List<StoreRelationship> getRelationshipsWith(StoreNode node, StoreNode other, Direction direction,
                                                        String relationType) throws IOException {
        String cypher = "MATCH " + pattern("a", "r", relationType, direction, "b")
            + " WHERE elementId(a) = $id AND elementId(b) = $otherId RETURN DISTINCT r";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("id", node.getId(), "otherId", other.getId()));
            List<StoreRelationship> rels = new ArrayList<>();
            while (result.hasNext()) {
                rels.add(toStoreRelationship(result.next().get("r").asRelationship()));
            }
            return rels;
        } catch (Exception e) {
            logger.error("Failed to query relationships from Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to query relationships: " + e.getMessage(), e);
        }
    }

    @Override
    public StoreRelationship getOrCreateRelationship(StoreNode start, String relationType, StoreNode end) throws IOException {
        String cypher = "MATCH (a) WHERE elementId(a) = $startId "
            + "MATCH (b) WHERE elementId(b) = $endId "
            + "MERGE (a)-[r:" + quote(relationType) + "]->(b) "
            + "RETURN r";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("startId", start.getId(), "endId", end.getId()));
            if (!result.hasNext()) {
                throw new IOException("cannot relate " + start.getId() + " to " + end.getId() + ": node not found");
            }
            StoreRelationship rel = toStoreRelationship(result.next().get("r").asRelationship());
            logger.debug("Ensured relationship {} of type {}", rel.getId(), relationType);
            return rel;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to create relationship in Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to create relationship: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoreRelationship> getRelationships(StoreNode node) throws IOException {
        String cypher = "MATCH (n)-[r]-() WHERE elementId(n) = $id RETURN DISTINCT r";
        try (Session session = openSession()) {
            Result result = session.run(cypher, Values.parameters("id", node.getId()));
            List<StoreRelationship> rels = new ArrayList<>();
            while (result.hasNext()) {
                rels.add(toStoreRelationship(result.next().get("r").asRelationship()));
            }
            return rels;
        } catch (Exception e) {
            logger.error("Failed to list relationships from Neo4j: {}", e.getMessage(), e);
            throw new IOException("Failed to list relationships: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        driver.close();
        logger.info("Neo4j driver closed");
    }

    static String pattern(String from, String rel, String relationType, Direction direction, String to) {
        String body = "[" + rel + ":" + quote(relationType) + "]";
        switch (direction) {
            case OUTGOING:
                return "(" + from + ")-" + body + "->(" + to + ")";
            case INCOMING:
                return "(" + from + ")<-" + body + "-(" + to + ")";
            default:
                return "(" + from + ")-" + body + "-(" + to + ")";
        }
    }

    /**
     * 标签和关系类型无法参数化，用反引号转义
     */
    static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    static StoreNode toStoreNode(Node node) {
        // asMap 已把 INTEGER 转成 Long、FLOAT 转成 Double
        return new StoreNode(node.elementId(), new LinkedHashMap<>(node.asMap()));
    }

    static StoreRelationship toStoreRelationship(Relationship rel) {
        return new StoreRelationship(rel.elementId(), rel.type(), rel.startNodeElementId(), rel.endNodeElementId());
    }
}
