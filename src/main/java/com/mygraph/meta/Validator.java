package com.mygraph.meta;

import com.mygraph.model.PropertyKind;

import java.util.*;
import java.util.regex.Pattern;

/**
 * schema 文件的结构与引用校验。
 * 属性层面的互斥规则（unique_index / index / blank）同样在这里提前报告。
 */
public class Validator {
    private final SchemaDocument schema;
    private final Set<String> knownTypes;
    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_]*$");
    private static final Set<String> VALID_DIRECTIONS = Set.of("outgoing", "incoming", "either");
    private static final Set<String> VALID_CARDINALITIES = Set.of("many", "zero_or_one");

    public Validator(SchemaDocument schema) {
        this(schema, Collections.emptySet());
    }

    /**
     * @param knownTypes 已在注册表中的类型，可以作为关系的目标类型
     */
    public Validator(SchemaDocument schema, Set<String> knownTypes) {
        this.schema = schema;
        this.knownTypes = knownTypes;
    }

    public void validate() throws ValidationException {
        validateSyntax();
        validateSemantics();
    }

    private void validateSyntax() throws ValidationException {
        if (schema.getVersion() == null || schema.getVersion().isEmpty()) {
            throw new ValidationException("version is required");
        }

        Set<String> typeNames = new HashSet<>();
        List<ObjectType> nodeTypes = schema.getNodeTypes();
        if (nodeTypes == null) {
            return;
        }
        for (int i = 0; i < nodeTypes.size(); i++) {
            ObjectType ot = nodeTypes.get(i);
            if (ot.getName() == null || ot.getName().isEmpty()) {
                throw new ValidationException("node_types[" + i + "]: name is required");
            }
            if (!isValidName(ot.getName())) {
                throw new ValidationException("node_types[" + i + "]: invalid name format '" + ot.getName() + "'");
            }
            if (!typeNames.add(ot.getName())) {
                throw new ValidationException("duplicate node type name: " + ot.getName());
            }

            // 属性与关系共用一个命名空间
            Set<String> memberNames = new HashSet<>();
            List<Property> properties = ot.getProperties();
            if (properties != null) {
                for (int j = 0; j < properties.size(); j++) {
                    validateProperty(ot.getName(), j, properties.get(j), memberNames);
                }
            }

            List<LinkType> relationships = ot.getRelationships();
            if (relationships != null) {
                for (int j = 0; j < relationships.size(); j++) {
                    validateRelationship(ot.getName(), j, relationships.get(j), memberNames);
                }
            }
        }
    }

    private void validateProperty(String typeName, int position, Property prop, Set<String> memberNames) throws ValidationException {
        String where = "node_types[" + typeName + "].properties[" + position + "]";
        if (prop.getName() == null || prop.getName().isEmpty()) {
            throw new ValidationException(where + ": name is required");
        }
        if (!isValidName(prop.getName())) {
            throw new ValidationException(where + ": invalid name format '" + prop.getName() + "'");
        }
        if (!memberNames.add(prop.getName())) {
            throw new ValidationException("duplicate property name '" + prop.getName() + "' in node type '" + typeName + "'");
        }
        if (PropertyKind.fromDataType(prop.getDataType()) == null) {
            throw new ValidationException("node_types[" + typeName + "].properties[" + prop.getName()
                + "]: invalid data_type '" + prop.getDataType() + "'");
        }
        if (prop.isUniqueIndex() && prop.isIndex()) {
            throw new ValidationException("node_types[" + typeName + "].properties[" + prop.getName()
                + "]: unique_index and index are mutually exclusive");
        }
        if (prop.isUniqueIndex() && prop.isBlank()) {
            throw new ValidationException("node_types[" + typeName + "].properties[" + prop.getName()
                + "]: unique_index properties cannot be blank");
        }
    }

    private void validateRelationship(String typeName, int position, LinkType rel, Set<String> memberNames) throws ValidationException {
        String where = "node_types[" + typeName + "].relationships[" + position + "]";
        if (rel.getName() == null || rel.getName().isEmpty()) {
            throw new ValidationException(where + ": name is required");
        }
        if (!isValidName(rel.getName())) {
            throw new ValidationException(where + ": invalid name format '" + rel.getName() + "'");
        }
        if (!memberNames.add(rel.getName())) {
            throw new ValidationException("node type '" + typeName + "' already has a member named '" + rel.getName() + "'");
        }
        if (rel.getRelationType() == null || !isValidName(rel.getRelationType())) {
            throw new ValidationException("node_types[" + typeName + "].relationships[" + rel.getName()
                + "]: invalid relation_type '" + rel.getRelationType() + "'");
        }
        if (rel.getTargetType() == null || rel.getTargetType().isEmpty()) {
            throw new ValidationException("node_types[" + typeName + "].relationships[" + rel.getName()
                + "]: target_type is required");
        }
        if (rel.getDirection() == null || !VALID_DIRECTIONS.contains(rel.getDirection())) {
            throw new ValidationException("node_types[" + typeName + "].relationships[" + rel.getName()
                + "]: invalid direction '" + rel.getDirection() + "'");
        }
        if (rel.getCardinality() == null || !VALID_CARDINALITIES.contains(rel.getCardinality())) {
            throw new ValidationException("node_types[" + typeName + "].relationships[" + rel.getName()
                + "]: invalid cardinality '" + rel.getCardinality() + "'");
        }
    }

    private void validateSemantics() throws ValidationException {
        Set<String> declared = new HashSet<>(knownTypes);
        if (schema.getNodeTypes() == null) {
            return;
        }
        for (ObjectType ot : schema.getNodeTypes()) {
            declared.add(ot.getName());
        }

        // 关系的目标类型必须存在
        for (ObjectType ot : schema.getNodeTypes()) {
            if (ot.getRelationships() == null) {
                continue;
            }
            for (LinkType rel : ot.getRelationships()) {
                if (!declared.contains(rel.getTargetType())) {
                    throw new ValidationException("node_type '" + ot.getName() + "'.relationship '" + rel.getName()
                        + "': target_type '" + rel.getTargetType() + "' does not exist");
                }
            }
        }
    }

    private boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        return NAME_PATTERN.matcher(name).matches();
    }

    public static class ValidationException extends Exception {
        public ValidationException(String message) {
            super(message);
        }
    }
}
