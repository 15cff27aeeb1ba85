package com.mygraph.model;

import com.mygraph.repository.ConnectionAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 类型名到 {@link NodeType} 的注册表。
 * 每个类型只注册一次，注册时取得（或创建）该类型专属的索引。
 */
public class SchemaRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SchemaRegistry.class);
    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_]*$");

    private final ConnectionAdapter connectionAdapter;
    private final Map<String, NodeType> types = new ConcurrentHashMap<>();

    public SchemaRegistry(ConnectionAdapter connectionAdapter) {
        this.connectionAdapter = Objects.requireNonNull(connectionAdapter, "connectionAdapter");
    }

    public NodeType register(NodeTypeDefinition definition) throws SchemaDefinitionException, IOException {
        String typeName = definition.getName();
        if (!isValidName(typeName)) {
            throw new SchemaDefinitionException("invalid type name '" + typeName + "'");
        }
        if (ConnectionAdapter.CATEGORY_INDEX.equals(typeName)) {
            throw new SchemaDefinitionException("type name '" + typeName + "' is reserved for category anchors");
        }
        if (types.containsKey(typeName)) {
            throw new SchemaDefinitionException("type '" + typeName + "' is already registered");
        }

        List<PropertyDescriptor> properties = definition.buildProperties();
        Set<String> memberNames = new HashSet<>();
        for (PropertyDescriptor descriptor : properties) {
            if (!memberNames.add(descriptor.getName())) {
                throw new SchemaDefinitionException("duplicate property name '" + descriptor.getName()
                    + "' in type '" + typeName + "'");
            }
        }

        for (String relName : definition.getRelationshipNames()) {
            if (!isValidName(relName)) {
                throw new SchemaDefinitionException("type '" + typeName + "': invalid relationship name '" + relName + "'");
            }
            if (!memberNames.add(relName)) {
                throw new SchemaDefinitionException(typeName + " already has attribute " + relName);
            }
            RelationshipDefinition rel = definition.getRelationships().get(relName);
            if (!isValidName(rel.getRelationType())) {
                throw new SchemaDefinitionException("type '" + typeName + "'.relationship '" + relName
                    + "': invalid relation type '" + rel.getRelationType() + "'");
            }
        }

        connectionAdapter.index(typeName);
        NodeType type = new NodeType(typeName, properties, definition.getRelationships(),
            definition.getFactory(), this);
        if (types.putIfAbsent(typeName, type) != null) {
            throw new SchemaDefinitionException("type '" + typeName + "' is already registered");
        }
        logger.info("Registered node type {} with {} properties and {} relationships",
            typeName, properties.size(), definition.getRelationships().size());
        return type;
    }

    public NodeType getType(String typeName) throws NoSuchTypeException {
        NodeType type = types.get(typeName);
        if (type == null) {
            throw new NoSuchTypeException("node type '" + typeName + "' is not registered");
        }
        return type;
    }

    public Optional<NodeType> findType(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    public Collection<NodeType> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    public ConnectionAdapter getConnectionAdapter() {
        return connectionAdapter;
    }

    static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }
}
