package com.mygraph.repository;

import java.util.Objects;

/**
 * 存储端关系
 */
public class StoreRelationship implements StoreEntity {
    private final String id;
    private final String type;
    private final String startNodeId;
    private final String endNodeId;

    public StoreRelationship(String id, String type, String startNodeId, String endNodeId) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = type;
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public String getEndNodeId() {
        return endNodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreRelationship)) {
            return false;
        }
        return id.equals(((StoreRelationship) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "StoreRelationship{" + id + ", " + startNodeId + "-[:" + type + "]->" + endNodeId + "}";
    }
}
