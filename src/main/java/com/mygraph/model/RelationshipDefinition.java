package com.mygraph.model;

import com.mygraph.repository.Direction;

import java.util.Objects;

/**
 * 类型级别的关系声明：关系类型、方向、目标类型、管理器实现。不可变。
 */
public final class RelationshipDefinition {
    private final String relationType;
    private final Direction direction;
    private final String targetType;
    private final RelationshipManagerFactory managerFactory;

    public RelationshipDefinition(String relationType, Direction direction, String targetType,
                                  RelationshipManagerFactory managerFactory) {
        this.relationType = Objects.requireNonNull(relationType, "relationType");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.targetType = Objects.requireNonNull(targetType, "targetType");
        this.managerFactory = managerFactory != null ? managerFactory : RelationshipManager::new;
    }

    public static RelationshipDefinition outgoing(String relationType, String targetType) {
        return new RelationshipDefinition(relationType, Direction.OUTGOING, targetType, null);
    }

    public static RelationshipDefinition incoming(String relationType, String targetType) {
        return new RelationshipDefinition(relationType, Direction.INCOMING, targetType, null);
    }

    public static RelationshipDefinition either(String relationType, String targetType) {
        return new RelationshipDefinition(relationType, Direction.EITHER, targetType, null);
    }

    public RelationshipDefinition withManager(RelationshipManagerFactory factory) {
        return new RelationshipDefinition(relationType, direction, targetType, factory);
    }

    public String getRelationType() {
        return relationType;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getTargetType() {
        return targetType;
    }

    public RelationshipManagerFactory getManagerFactory() {
        return managerFactory;
    }

    RelationshipManager buildManager(MappedNode origin, String name) {
        return managerFactory.create(origin, name, this);
    }

    @Override
    public String toString() {
        return direction + " " + relationType + " -> " + targetType;
    }
}
