package com.mygraph.model;

import java.util.Map;

/**
 * 构造某个类型的 MappedNode 实例，允许使用 MappedNode 的子类
 */
@FunctionalInterface
public interface NodeFactory {
    MappedNode create(NodeType type, Map<String, Object> properties)
        throws NoSuchPropertyException, InvalidTypeException;
}
