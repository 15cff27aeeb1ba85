package com.mygraph.repository;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 图存储客户端接口。
 * 节点、关系和索引的基本操作；单个操作至少具备节点级原子性。
 */
public interface GraphStoreClient extends AutoCloseable {
    /**
     * 创建节点，并创建 category -[relationType]-> node 的类别关系
     */
    CreatedNode createNode(String label, Map<String, Object> properties,
                           StoreNode category, String relationType) throws IOException;

    /**
     * 删除实体；关系先于节点删除
     */
    void delete(Collection<? extends StoreEntity> entities) throws IOException;

    default void delete(StoreEntity... entities) throws IOException {
        delete(Arrays.asList(entities));
    }

    /**
     * 用给定属性整体替换节点属性
     */
    void setProperties(StoreNode node, Map<String, Object> properties) throws IOException;

    Map<String, Object> getProperties(StoreNode node) throws IOException;

    IndexHandle getOrCreateIndex(String name) throws IOException;

    List<StoreNode> getRelatedNodes(StoreNode node, Direction direction, String relationType) throws IOException;

    boolean hasRelationshipWith(StoreNode node, StoreNode other, Direction direction, String relationType) throws IOException;

    List<StoreRelationship> getRelationshipsWith(StoreNode node, StoreNode other, Direction direction, String relationType) throws IOException;

    /**
     * start -[relationType]-> end，已存在则直接返回
     */
    StoreRelationship getOrCreateRelationship(StoreNode start, String relationType, StoreNode end) throws IOException;

    /**
     * 节点的全部关联关系（任意方向、任意类型）
     */
    List<StoreRelationship> getRelationships(StoreNode node) throws IOException;

    @Override
    void close();
}
