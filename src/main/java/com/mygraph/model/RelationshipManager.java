package com.mygraph.model;

import com.mygraph.repository.Direction;
import com.mygraph.repository.GraphStoreClient;
import com.mygraph.repository.StoreNode;
import com.mygraph.repository.StoreRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * 某个节点上一种关系的管理器。
 * 延迟加载关联节点并按远端 ID 缓存；缓存只在 relate / unrelate / invalidate 时变化，
 * 不会自动发现其它客户端在存储端做的修改。
 * <p>
 * origin 是非拥有的反向引用，管理器的生命周期与 origin 相同。
 */
public class RelationshipManager {
    private static final Logger logger = LoggerFactory.getLogger(RelationshipManager.class);

    protected final MappedNode origin;
    protected final String name;
    protected final RelationshipDefinition definition;
    private final Map<String, MappedNode> related = new LinkedHashMap<>();

    public RelationshipManager(MappedNode origin, String name, RelationshipDefinition definition) {
        this.origin = origin;
        this.name = name;
        this.definition = definition;
    }

    public String getName() {
        return name;
    }

    public RelationshipDefinition getDefinition() {
        return definition;
    }

    public Direction getDirection() {
        return definition.getDirection();
    }

    public String getRelationType() {
        return definition.getRelationType();
    }

    protected GraphStoreClient client() {
        return origin.getType().getClient();
    }

    protected NodeType targetType() throws NoSuchTypeException {
        return origin.getType().getRegistry().getType(definition.getTargetType());
    }

    /**
     * 所有关联节点。缓存为空时从存储端加载；存储端没有关系时返回空列表且不填充缓存。
     */
    public List<MappedNode> all() throws IOException, OgmException {
        if (related.isEmpty()) {
            StoreNode originNode = origin.requireNode();
            List<StoreNode> nodes = client().getRelatedNodes(originNode, getDirection(), getRelationType());
            if (nodes == null || nodes.isEmpty()) {
                return new ArrayList<>();
            }
            NodeType target = targetType();
            for (StoreNode storeNode : nodes) {
                related.put(storeNode.getId(), target.rehydrate(storeNode));
            }
            logger.debug("Loaded {} {} nodes for {}.{}", nodes.size(), target.getName(), origin.getTypeName(), name);
        }
        return new ArrayList<>(related.values());
    }

    /**
     * 先查缓存，缓存未命中再询问存储端（不填充缓存）。
     * 缓存命中时直接返回 true，即使该关系已被其它客户端删除。
     */
    public boolean isRelated(MappedNode obj) throws IOException, NodeNotPersistedException {
        StoreNode other = obj.requireNode();
        if (related.containsKey(other.getId())) {
            return true;
        }
        return client().hasRelationshipWith(origin.requireNode(), other, getDirection(), getRelationType());
    }

    /**
     * 关联目标必须是声明的目标类型，并且已保存
     */
    protected StoreNode checkTarget(MappedNode obj) throws TypeMismatchException, NodeNotPersistedException {
        if (!definition.getTargetType().equals(obj.getTypeName())) {
            throw new TypeMismatchException("Expecting object of type " + definition.getTargetType()
                + " but got " + obj.getTypeName());
        }
        StoreNode other = obj.getNode();
        if (other == null) {
            throw new NodeNotPersistedException("Can't create relationship to unsaved node");
        }
        return other;
    }

    public void relate(MappedNode obj) throws IOException, OgmException {
        StoreNode other = checkTarget(obj);
        StoreNode originNode = origin.requireNode();
        if (getDirection() == Direction.INCOMING) {
            client().getOrCreateRelationship(other, getRelationType(), originNode);
        } else {
            client().getOrCreateRelationship(originNode, getRelationType(), other);
        }
        related.put(other.getId(), obj);
    }

    /**
     * 删除与 obj 之间的关系；没有关系时什么都不做，多于一条时报错
     */
    public void unrelate(MappedNode obj) throws IOException, NodeNotPersistedException, MultipleRelationshipsException {
        StoreNode other = obj.requireNode();
        related.remove(other.getId());
        List<StoreRelationship> rels = client().getRelationshipsWith(origin.requireNode(), other,
            getDirection(), getRelationType());
        if (rels == null || rels.isEmpty()) {
            return;
        }
        if (rels.size() > 1) {
            throw new MultipleRelationshipsException("Expected single relationship got " + rels);
        }
        client().delete(rels.get(0));
    }

    /**
     * 丢弃缓存，下一次 all() 重新加载
     */
    public void invalidate() {
        related.clear();
    }

    @Override
    public String toString() {
        return origin.getTypeName() + "." + name + " (" + definition + ")";
    }
}
