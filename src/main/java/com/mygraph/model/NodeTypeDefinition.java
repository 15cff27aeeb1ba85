package com.mygraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 待注册的类型声明，交给 {@link SchemaRegistry#register(NodeTypeDefinition)}
 */
public class NodeTypeDefinition {
    private final String name;
    private final List<DescriptorSource> properties = new ArrayList<>();
    private final Map<String, RelationshipDefinition> relationships = new LinkedHashMap<>();
    private final List<String> relationshipNames = new ArrayList<>();
    private NodeFactory factory = MappedNode::new;

    private NodeTypeDefinition(String name) {
        this.name = name;
    }

    public static NodeTypeDefinition named(String name) {
        return new NodeTypeDefinition(name);
    }

    public NodeTypeDefinition property(PropertyDescriptor descriptor) {
        properties.add(() -> descriptor);
        return this;
    }

    /**
     * 延迟到 register 时再 build，声明错误在注册时抛出
     */
    public NodeTypeDefinition property(PropertyDescriptor.Builder builder) {
        properties.add(builder::build);
        return this;
    }

    public NodeTypeDefinition relationship(String name, RelationshipDefinition definition) {
        relationshipNames.add(name);
        relationships.put(name, definition);
        return this;
    }

    public NodeTypeDefinition factory(NodeFactory factory) {
        this.factory = factory;
        return this;
    }

    public String getName() {
        return name;
    }

    List<PropertyDescriptor> buildProperties() throws SchemaDefinitionException {
        List<PropertyDescriptor> all = new ArrayList<>();
        for (DescriptorSource source : properties) {
            all.add(source.get());
        }
        return all;
    }

    /**
     * 按声明顺序的关系名，包括重复声明的名字
     */
    List<String> getRelationshipNames() {
        return Collections.unmodifiableList(relationshipNames);
    }

    Map<String, RelationshipDefinition> getRelationships() {
        return Collections.unmodifiableMap(relationships);
    }

    NodeFactory getFactory() {
        return factory;
    }

    @FunctionalInterface
    private interface DescriptorSource {
        PropertyDescriptor get() throws SchemaDefinitionException;
    }
}
