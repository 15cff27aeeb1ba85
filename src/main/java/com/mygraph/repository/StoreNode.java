package com.mygraph.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 存储端节点：远端 ID 加上读取时的属性快照
 */
public class StoreNode implements StoreEntity {
    private final String id;
    private final Map<String, Object> properties;

    public StoreNode(String id, Map<String, Object> properties) {
        this.id = Objects.requireNonNull(id, "id");
        this.properties = properties != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
            : Collections.emptyMap();
    }

    @Override
    public String getId() {
        return id;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreNode)) {
            return false;
        }
        return id.equals(((StoreNode) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "StoreNode{" + id + "}";
    }
}
