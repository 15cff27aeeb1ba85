package com.mygraph.config;

import com.mygraph.meta.Loader;
import com.mygraph.meta.Validator;
import com.mygraph.model.SchemaDefinitionException;
import com.mygraph.model.SchemaRegistry;
import com.mygraph.repository.ConnectionAdapter;
import com.mygraph.repository.Neo4jClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class Neo4jConfig {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jConfig.class);

    /**
     * 连接在第一次访问存储时才建立，启动时不连 Neo4j
     */
    @Bean(destroyMethod = "close")
    public ConnectionAdapter connectionAdapter(Config config) {
        String uri = config.getNeo4jUri();
        if (uri == null || uri.isEmpty()) {
            logger.warn("Neo4j URI is not configured. Please set NEO4J_URI environment variable or neo4j.uri property");
        }
        logger.info("Neo4j connection adapter configured. URI: {}, User: {}", uri, config.getNeo4jUser());
        return new ConnectionAdapter(new Neo4jClientFactory(uri, config.getNeo4jUser(),
            config.getNeo4jPassword(), config.getNeo4jDatabase()));
    }

    @Bean
    public SchemaRegistry schemaRegistry(ConnectionAdapter connectionAdapter) {
        return new SchemaRegistry(connectionAdapter);
    }

    /**
     * 配置了 schema.file.path 时，启动时加载并注册 schema 文件中的全部类型
     */
    @Bean
    @ConditionalOnProperty(name = "schema.file.path")
    public Loader schemaLoader(Config config, SchemaRegistry registry) {
        String filePath = config.getSchemaFilePath();
        Loader loader = new Loader(filePath);
        try {
            loader.load();
            loader.registerAll(registry);
            logger.info("Schema loaded successfully from {}: {} node types", filePath, loader.listObjectTypes().size());
        } catch (IOException | Validator.ValidationException | SchemaDefinitionException e) {
            logger.error("Failed to load schema from: {}", filePath, e);
            throw new IllegalStateException("Failed to load schema: " + e.getMessage(), e);
        }
        return loader;
    }
}
