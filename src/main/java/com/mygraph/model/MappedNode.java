package com.mygraph.model;

import com.mygraph.repository.CreatedNode;
import com.mygraph.repository.GraphStoreClient;
import com.mygraph.repository.IndexHandle;
import com.mygraph.repository.StoreEntity;
import com.mygraph.repository.StoreNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * 类型化、经过 schema 校验的图节点对象。
 * <p>
 * 状态：未保存（无远端 ID）-> save -> 已保存 -> save -> 已保存；已保存 -> delete -> 已删除。
 * 已删除的对象不应再用于存储操作。
 * <p>
 * 属性只能通过 {@link #set(String, Object)} 修改，每次都会重新校验；校验失败不会修改任何属性。
 */
public class MappedNode {
    private static final Logger logger = LoggerFactory.getLogger(MappedNode.class);

    private final NodeType type;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, RelationshipManager> relationships = new LinkedHashMap<>();
    private StoreNode node;

    public MappedNode(NodeType type, Map<String, Object> properties) throws NoSuchPropertyException, InvalidTypeException {
        this.type = Objects.requireNonNull(type, "type");
        if (properties != null) {
            // 先全部校验再赋值
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                type.getProperty(entry.getKey()).validate(entry.getValue());
            }
            this.properties.putAll(properties);
        }
        for (Map.Entry<String, RelationshipDefinition> entry : type.getRelationships().entrySet()) {
            relationships.put(entry.getKey(), entry.getValue().buildManager(this, entry.getKey()));
        }
    }

    public NodeType getType() {
        return type;
    }

    public String getTypeName() {
        return type.getName();
    }

    /**
     * 远端 ID，未保存时为 null
     */
    public String getId() {
        return node != null ? node.getId() : null;
    }

    public boolean isPersisted() {
        return node != null;
    }

    StoreNode getNode() {
        return node;
    }

    StoreNode requireNode() throws NodeNotPersistedException {
        if (node == null) {
            throw new NodeNotPersistedException(type.getName() + " node has not been saved");
        }
        return node;
    }

    void attach(StoreNode storeNode) {
        this.node = storeNode;
    }

    public Object get(String name) throws NoSuchPropertyException {
        type.getProperty(name);
        return properties.get(name);
    }

    public void set(String name, Object value) throws NoSuchPropertyException, InvalidTypeException {
        type.getProperty(name).validate(value);
        properties.put(name, value);
    }

    /**
     * 当前属性的只读快照
     */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public RelationshipManager related(String name) {
        RelationshipManager manager = relationships.get(name);
        if (manager == null) {
            throw new IllegalArgumentException(type.getName() + " has no relationship named '" + name + "'");
        }
        return manager;
    }

    /**
     * 按具体的管理器类型取关系，例如 {@link ZeroOrOneRelationshipManager}
     */
    public <M extends RelationshipManager> M related(String name, Class<M> managerType) {
        RelationshipManager manager = related(name);
        if (!managerType.isInstance(manager)) {
            throw new IllegalArgumentException("relationship '" + name + "' of " + type.getName()
                + " is managed by " + manager.getClass().getSimpleName());
        }
        return managerType.cast(manager);
    }

    public Map<String, RelationshipManager> getRelationships() {
        return Collections.unmodifiableMap(relationships);
    }

    public MappedNode save() throws IOException, NotUniqueException {
        Map<String, Object> props = getProperties();
        if (node != null) {
            GraphStoreClient client = type.getClient();
            client.setProperties(node, props);
            type.getIndexHandle().remove(node);
            try {
                updateIndex(props);
            } catch (NotUniqueException e) {
                // 属性已覆盖、旧索引项已删除，这里不做回滚
                logger.warn("Unique conflict while updating {} {}: index entries of the node are incomplete",
                    type.getName(), node.getId());
                throw e;
            }
            logger.debug("Updated {} {}", type.getName(), node.getId());
        } else {
            create(props);
        }
        return this;
    }

    private void create(Map<String, Object> props) throws IOException, NotUniqueException {
        GraphStoreClient client = type.getClient();
        CreatedNode created = client.createNode(type.getLabel(), props, type.category(), type.getCategoryRelationType());
        if (created == null || created.getNode() == null) {
            throw new IOException("Failed to create new " + type.getName());
        }
        node = created.getNode();

        try {
            updateIndex(props);
        } catch (NotUniqueException | IOException e) {
            rollbackCreate(created, e);
            throw e;
        }
        logger.debug("Created {} {}", type.getName(), node.getId());
    }

    /**
     * 索引项清理和节点删除各自独立执行，任何一步失败都作为 suppressed 挂到原异常上
     */
    private void rollbackCreate(CreatedNode created, Exception cause) {
        StoreNode createdNode = created.getNode();
        node = null;
        try {
            type.getIndexHandle().remove(createdNode);
        } catch (IOException e) {
            logger.error("Failed to remove index entries of {} {} during rollback: {}",
                type.getName(), createdNode.getId(), e.getMessage(), e);
            cause.addSuppressed(e);
        }

        List<StoreEntity> toDelete = new ArrayList<>();
        if (created.getCategoryRelationship() != null) {
            toDelete.add(created.getCategoryRelationship());
        }
        toDelete.add(createdNode);
        try {
            type.getClient().delete(toDelete);
            logger.debug("Rolled back creation of {} {}", type.getName(), createdNode.getId());
        } catch (IOException e) {
            logger.error("Failed to roll back creation of {} {}: {}", type.getName(), createdNode.getId(), e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    /**
     * 唯一索引做条件写入，普通索引直接写入；遇到冲突立即停止
     */
    private void updateIndex(Map<String, Object> props) throws IOException, NotUniqueException {
        IndexHandle index = type.getIndexHandle();
        for (PropertyDescriptor descriptor : type.getProperties()) {
            Object value = props.get(descriptor.getName());
            if (value == null || !descriptor.isIndexed()) {
                continue;
            }
            if (descriptor.isUniqueIndex()) {
                if (!index.addIfAbsent(descriptor.getName(), value, node)) {
                    throw new NotUniqueException(type.getName(), descriptor.getName(), value);
                }
            } else {
                index.add(descriptor.getName(), value, node);
            }
        }
    }

    /**
     * 删除节点本身和所有关联关系。删除后远端 ID 清空。
     */
    public boolean delete() throws IOException, NodeNotPersistedException {
        StoreNode current = requireNode();
        GraphStoreClient client = type.getClient();
        type.getIndexHandle().remove(current);
        List<StoreEntity> toDelete = new ArrayList<>(client.getRelationships(current));
        toDelete.add(current);
        client.delete(toDelete);
        for (RelationshipManager manager : relationships.values()) {
            manager.invalidate();
        }
        node = null;
        logger.debug("Deleted {} {} and {} relationships", type.getName(), current.getId(), toDelete.size() - 1);
        return true;
    }

    /**
     * 从存储端重新读取属性
     */
    public MappedNode refresh() throws IOException, NodeNotPersistedException, NoSuchPropertyException, InvalidTypeException {
        StoreNode current = requireNode();
        Map<String, Object> stored = type.getClient().getProperties(current);
        for (Map.Entry<String, Object> entry : stored.entrySet()) {
            type.getProperty(entry.getKey()).validate(entry.getValue());
        }
        properties.clear();
        properties.putAll(stored);
        return this;
    }

    @Override
    public String toString() {
        return type.getName() + "{id=" + getId() + ", " + properties + "}";
    }
}
