package com.mygraph.model;

/**
 * 唯一索引属性的值已被同类型的其它节点占用
 */
public class NotUniqueException extends OgmException {
    private final String property;
    private final Object value;

    public NotUniqueException(String typeName, String property, Object value) {
        super("value '" + value + "' of " + typeName + "." + property + " is not unique");
        this.property = property;
        this.value = value;
    }

    public String getProperty() {
        return property;
    }

    public Object getValue() {
        return value;
    }
}
