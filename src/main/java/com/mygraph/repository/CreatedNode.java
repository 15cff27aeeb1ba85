package com.mygraph.repository;

/**
 * createNode 的结果：新节点以及把它挂到类别锚点上的关系
 */
public class CreatedNode {
    private final StoreNode node;
    private final StoreRelationship categoryRelationship;

    public CreatedNode(StoreNode node, StoreRelationship categoryRelationship) {
        this.node = node;
        this.categoryRelationship = categoryRelationship;
    }

    public StoreNode getNode() {
        return node;
    }

    public StoreRelationship getCategoryRelationship() {
        return categoryRelationship;
    }
}
