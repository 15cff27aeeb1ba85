package com.mygraph.model;

/**
 * 属性的值类型，以及各自接受的 Java 运行时类型（不做转换）
 */
public enum PropertyKind {
    STRING("string", String.class),
    INTEGER("int", Integer.class, Long.class),
    FLOAT("float", Float.class, Double.class),
    BOOLEAN("bool", Boolean.class);

    private final String dataType;
    private final Class<?>[] acceptedTypes;

    PropertyKind(String dataType, Class<?>... acceptedTypes) {
        this.dataType = dataType;
        this.acceptedTypes = acceptedTypes;
    }

    /**
     * schema 文件里使用的 data_type 名称
     */
    public String getDataType() {
        return dataType;
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        for (Class<?> type : acceptedTypes) {
            if (type == value.getClass()) {
                return true;
            }
        }
        return false;
    }

    public static PropertyKind fromDataType(String dataType) {
        if (dataType == null) {
            return null;
        }
        // integer / long 作为 int 的别名
        switch (dataType) {
            case "integer":
            case "long":
                return INTEGER;
            case "double":
                return FLOAT;
            case "boolean":
                return BOOLEAN;
            default:
                for (PropertyKind kind : values()) {
                    if (kind.dataType.equals(dataType)) {
                        return kind;
                    }
                }
                return null;
        }
    }
}
