package com.mygraph.meta;

import com.mygraph.model.NodeType;
import com.mygraph.model.NodeTypeDefinition;
import com.mygraph.model.PropertyDescriptor;
import com.mygraph.model.PropertyKind;
import com.mygraph.model.RelationshipDefinition;
import com.mygraph.model.SchemaDefinitionException;
import com.mygraph.model.SchemaRegistry;
import com.mygraph.model.ZeroOrOneRelationshipManager;
import com.mygraph.repository.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 加载 YAML schema 文件，并把其中的类型注册到 {@link SchemaRegistry}
 */
public class Loader {
    private static final Logger logger = LoggerFactory.getLogger(Loader.class);

    private final Parser parser;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private SchemaDocument schema;

    public Loader(String filePath) {
        this.parser = new Parser(filePath);
    }

    public void load() throws IOException, Validator.ValidationException {
        load(Collections.emptySet());
    }

    /**
     * @param knownTypes 关系可以引用的、已注册的类型
     */
    public void load(Set<String> knownTypes) throws IOException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            SchemaDocument parsedSchema = parser.parse();
            Validator schemaValidator = new Validator(parsedSchema, knownTypes);
            schemaValidator.validate();
            this.schema = parsedSchema;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SchemaDocument getSchema() {
        lock.readLock().lock();
        try {
            return schema;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ObjectType getObjectType(String name) throws NotFoundException {
        lock.readLock().lock();
        try {
            if (schema != null && schema.getNodeTypes() != null) {
                for (ObjectType ot : schema.getNodeTypes()) {
                    if (ot.getName().equals(name)) {
                        return ot;
                    }
                }
            }
            throw new NotFoundException("node type '" + name + "' not found");
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ObjectType> listObjectTypes() {
        lock.readLock().lock();
        try {
            if (schema == null || schema.getNodeTypes() == null) {
                return new ArrayList<>();
            }
            return new ArrayList<>(schema.getNodeTypes());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按文件中的顺序注册全部类型
     */
    public List<NodeType> registerAll(SchemaRegistry registry) throws SchemaDefinitionException, IOException {
        List<NodeType> registered = new ArrayList<>();
        for (ObjectType ot : listObjectTypes()) {
            registered.add(registry.register(toDefinition(ot)));
        }
        logger.info("Registered {} node types from schema version {}", registered.size(),
            getSchema() != null ? getSchema().getVersion() : null);
        return registered;
    }

    static NodeTypeDefinition toDefinition(ObjectType ot) {
        NodeTypeDefinition definition = NodeTypeDefinition.named(ot.getName());
        if (ot.getProperties() != null) {
            for (Property prop : ot.getProperties()) {
                definition.property(PropertyDescriptor.builder(prop.getName(), PropertyKind.fromDataType(prop.getDataType()))
                    .index(prop.isIndex())
                    .uniqueIndex(prop.isUniqueIndex())
                    .blank(prop.isBlank()));
            }
        }
        if (ot.getRelationships() != null) {
            for (LinkType rel : ot.getRelationships()) {
                RelationshipDefinition relDef = new RelationshipDefinition(rel.getRelationType(),
                    Direction.valueOf(rel.getDirection().toUpperCase(Locale.ROOT)), rel.getTargetType(),
                    "zero_or_one".equals(rel.getCardinality()) ? ZeroOrOneRelationshipManager::new : null);
                definition.relationship(rel.getName(), relDef);
            }
        }
        return definition;
    }

    public static class NotFoundException extends Exception {
        public NotFoundException(String message) {
            super(message);
        }
    }
}
