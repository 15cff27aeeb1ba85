package com.mygraph.repository;

/**
 * 存储端实体（节点或关系），以远端 ID 标识
 */
public interface StoreEntity {
    String getId();
}
