package com.mygraph.model;

import com.mygraph.repository.GraphStoreClient;
import com.mygraph.repository.IndexHandle;
import com.mygraph.repository.StoreNode;

import java.io.IOException;
import java.util.*;

/**
 * 已注册类型的 schema 条目：属性声明、关系声明、专属索引句柄。
 * 由 {@link SchemaRegistry} 创建，之后不再变化。
 */
public final class NodeType {
    private final String name;
    private final Map<String, PropertyDescriptor> properties;
    private final Map<String, RelationshipDefinition> relationships;
    private final NodeFactory factory;
    private final SchemaRegistry registry;
    private final NodeIndex index;

    NodeType(String name, List<PropertyDescriptor> properties, Map<String, RelationshipDefinition> relationships,
             NodeFactory factory, SchemaRegistry registry) {
        this.name = name;
        Map<String, PropertyDescriptor> props = new LinkedHashMap<>();
        for (PropertyDescriptor descriptor : properties) {
            props.put(descriptor.getName(), descriptor);
        }
        this.properties = Collections.unmodifiableMap(props);
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
        this.factory = factory;
        this.registry = registry;
        this.index = new NodeIndex(this);
    }

    public String getName() {
        return name;
    }

    /**
     * 存储端节点标签
     */
    public String getLabel() {
        return name.replaceAll("[^\\p{L}\\p{N}_]", "");
    }

    /**
     * 类别锚点到实例的关系类型
     */
    public String getCategoryRelationType() {
        return name.toUpperCase(Locale.ROOT);
    }

    public Collection<PropertyDescriptor> getProperties() {
        return properties.values();
    }

    public PropertyDescriptor getProperty(String propertyName) throws NoSuchPropertyException {
        PropertyDescriptor descriptor = properties.get(propertyName);
        if (descriptor == null) {
            throw new NoSuchPropertyException(name, propertyName);
        }
        return descriptor;
    }

    public Optional<PropertyDescriptor> findProperty(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    public Map<String, RelationshipDefinition> getRelationships() {
        return relationships;
    }

    /**
     * 该类型的专属索引，每次经由连接适配器解析，跟随当前客户端
     */
    public IndexHandle getIndexHandle() throws IOException {
        return registry.getConnectionAdapter().index(name);
    }

    /**
     * 基于索引的类型化查询入口
     */
    public NodeIndex getIndex() {
        return index;
    }

    public SchemaRegistry getRegistry() {
        return registry;
    }

    GraphStoreClient getClient() {
        return registry.getConnectionAdapter().getClient();
    }

    StoreNode category() throws IOException {
        return registry.getConnectionAdapter().category(name);
    }

    /**
     * 新建一个未保存的实例
     */
    public MappedNode create(Map<String, Object> properties) throws NoSuchPropertyException, InvalidTypeException {
        return factory.create(this, properties != null ? properties : Collections.emptyMap());
    }

    public MappedNode create() throws NoSuchPropertyException, InvalidTypeException {
        return create(Collections.emptyMap());
    }

    /**
     * 用存储端节点的属性重建实例，并绑定远端 ID
     */
    public MappedNode rehydrate(StoreNode node) throws NoSuchPropertyException, InvalidTypeException {
        MappedNode mapped = create(node.getProperties());
        mapped.attach(node);
        return mapped;
    }

    @Override
    public String toString() {
        return "NodeType{" + name + ", properties=" + properties.values() + "}";
    }
}
