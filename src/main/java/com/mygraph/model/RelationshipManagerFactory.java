package com.mygraph.model;

/**
 * 关系管理器的构造方式（manager flavor）
 */
@FunctionalInterface
public interface RelationshipManagerFactory {
    RelationshipManager create(MappedNode origin, String name, RelationshipDefinition definition);
}
