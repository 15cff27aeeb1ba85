package com.mygraph.repository;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * 存储端的具名二级索引句柄
 */
public interface IndexHandle {
    String getName();

    /**
     * 无条件写入索引项
     */
    void add(String key, Object value, StoreNode node) throws IOException;

    /**
     * 条件写入：(key, value) 尚无索引项时写入并返回 true；
     * 已被其它节点占用时不做任何修改并返回 false。必须由存储端保证原子性。
     */
    boolean addIfAbsent(String key, Object value, StoreNode node) throws IOException;

    /**
     * 删除该节点在本索引中的全部索引项
     */
    void remove(StoreEntity entity) throws IOException;

    List<StoreNode> query(IndexQuery query) throws IOException;

    /**
     * 按 (key, value) 查找节点，不存在则以 properties 创建并登记，幂等
     */
    StoreNode getOrCreate(String key, Object value, Map<String, Object> properties) throws IOException;
}
