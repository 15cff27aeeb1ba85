package com.mygraph.repository;

import com.mygraph.config.EnvConfig;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 创建 {@link Neo4jGraphStoreClient}。
 * 作为 {@link ConnectionAdapter} 的延迟工厂使用，只有 get() 时才建立连接。
 */
public class Neo4jClientFactory implements Supplier<GraphStoreClient> {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jClientFactory.class);

    public static final String DEFAULT_URI = "bolt://localhost:7687";

    private final String uri;
    private final String user;
    private final String password;
    private final String database;

    public Neo4jClientFactory(String uri, String user, String password, String database) {
        this.uri = uri;
        this.user = user;
        this.password = password;
        this.database = database;
    }

    /**
     * 从 .env 文件或环境变量读取 NEO4J_URI / NEO4J_USER / NEO4J_PASSWORD / NEO4J_DATABASE
     */
    public static Neo4jClientFactory fromEnvironment() {
        return new Neo4jClientFactory(
            EnvConfig.get("NEO4J_URI", DEFAULT_URI),
            EnvConfig.get("NEO4J_USER"),
            EnvConfig.get("NEO4J_PASSWORD"),
            EnvConfig.get("NEO4J_DATABASE"));
    }

    @Override
    public GraphStoreClient get() {
        if (uri == null || uri.isEmpty()) {
            throw new IllegalStateException("Neo4j URI is not configured. Please set NEO4J_URI environment variable or neo4j.uri");
        }
        AuthToken auth;
        if (user == null || user.isEmpty()) {
            logger.warn("Neo4j user is not configured, connecting to {} without authentication", uri);
            auth = AuthTokens.none();
        } else {
            auth = AuthTokens.basic(user, password != null ? password : "");
        }
        Driver driver = GraphDatabase.driver(uri, auth);
        logger.info("Neo4j driver created. URI: {}, User: {}, Database: {}", uri, user, database != null ? database : "<default>");
        return new Neo4jGraphStoreClient(driver, database);
    }

    public String getUri() {
        return uri;
    }

    public String getUser() {
        return user;
    }

    public String getDatabase() {
        return database;
    }
}
