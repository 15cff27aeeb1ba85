package com.mygraph.model;

import java.util.Objects;

/**
 * 类型上声明的一个属性：名称、值类型、索引方式、是否允许为空。
 * 只能通过 {@link Builder} 创建，创建后不可变。
 */
public final class PropertyDescriptor {
    private final String name;
    private final PropertyKind kind;
    private final Indexing indexing;
    private final boolean blank;

    private PropertyDescriptor(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.indexing = builder.uniqueIndex ? Indexing.UNIQUE_INDEX
            : builder.index ? Indexing.INDEX : Indexing.NONE;
        this.blank = builder.blank;
    }

    public static Builder builder(String name, PropertyKind kind) {
        return new Builder(name, kind);
    }

    public static Builder string(String name) {
        return new Builder(name, PropertyKind.STRING);
    }

    public static Builder integer(String name) {
        return new Builder(name, PropertyKind.INTEGER);
    }

    public String getName() {
        return name;
    }

    public PropertyKind getKind() {
        return kind;
    }

    public Indexing getIndexing() {
        return indexing;
    }

    public boolean isBlank() {
        return blank;
    }

    public boolean isIndexed() {
        return indexing != Indexing.NONE;
    }

    public boolean isUniqueIndex() {
        return indexing == Indexing.UNIQUE_INDEX;
    }

    /**
     * 值的运行时类型必须与 kind 一致，null 不合法
     */
    public void validate(Object value) throws InvalidTypeException {
        if (!kind.accepts(value)) {
            String actual = value == null ? "null" : value.getClass().getSimpleName();
            throw new InvalidTypeException("property '" + name + "' expects " + kind.getDataType()
                + " but got " + actual + " (" + value + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyDescriptor)) {
            return false;
        }
        PropertyDescriptor that = (PropertyDescriptor) o;
        return blank == that.blank && name.equals(that.name) && kind == that.kind && indexing == that.indexing;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, indexing, blank);
    }

    @Override
    public String toString() {
        return name + ":" + kind.getDataType() + (isIndexed() ? "[" + indexing + "]" : "");
    }

    public static final class Builder {
        private final String name;
        private final PropertyKind kind;
        private boolean index;
        private boolean uniqueIndex;
        private boolean blank;

        private Builder(String name, PropertyKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder index() {
            this.index = true;
            return this;
        }

        public Builder uniqueIndex() {
            this.uniqueIndex = true;
            return this;
        }

        public Builder blank() {
            this.blank = true;
            return this;
        }

        public Builder index(boolean index) {
            this.index = index;
            return this;
        }

        public Builder uniqueIndex(boolean uniqueIndex) {
            this.uniqueIndex = uniqueIndex;
            return this;
        }

        public Builder blank(boolean blank) {
            this.blank = blank;
            return this;
        }

        public PropertyDescriptor build() throws SchemaDefinitionException {
            if (!SchemaRegistry.isValidName(name)) {
                throw new SchemaDefinitionException("invalid property name '" + name + "'");
            }
            if (kind == null) {
                throw new SchemaDefinitionException("property '" + name + "': kind is required");
            }
            if (uniqueIndex && index) {
                throw new SchemaDefinitionException("property '" + name + "': unique_index and index are mutually exclusive");
            }
            if (uniqueIndex && blank) {
                throw new SchemaDefinitionException("property '" + name + "': uniquely indexed properties cannot also be blank");
            }
            return new PropertyDescriptor(this);
        }
    }
}
