package com.mygraph.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import jakarta.annotation.PostConstruct;

@Configuration
@DependsOn(EnvConfig.BEAN_NAME)
public class Config {
    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.user:neo4j}")
    private String neo4jUser;

    @Value("${neo4j.password:}")
    private String neo4jPassword;

    @Value("${neo4j.database:}")
    private String neo4jDatabase;

    @Value("${schema.file.path:}")
    private String schemaFilePath;

    @PostConstruct
    public void init() {
        // .env 文件或环境变量中的 Neo4j 配置优先
        String envUri = EnvConfig.get("NEO4J_URI");
        if (envUri != null && !envUri.isEmpty()) {
            this.neo4jUri = envUri;
        }

        String envUser = EnvConfig.get("NEO4J_USER");
        if (envUser != null && !envUser.isEmpty()) {
            this.neo4jUser = envUser;
        }

        String envPassword = EnvConfig.get("NEO4J_PASSWORD");
        if (envPassword != null && !envPassword.isEmpty()) {
            this.neo4jPassword = envPassword;
        }

        String envDatabase = EnvConfig.get("NEO4J_DATABASE");
        if (envDatabase != null && !envDatabase.isEmpty()) {
            this.neo4jDatabase = envDatabase;
        }
    }

    public String getNeo4jUri() {
        return neo4jUri;
    }

    public String getNeo4jUser() {
        return neo4jUser;
    }

    public String getNeo4jPassword() {
        return neo4jPassword;
    }

    public String getNeo4jDatabase() {
        return neo4jDatabase;
    }

    public String getSchemaFilePath() {
        return schemaFilePath;
    }
}
