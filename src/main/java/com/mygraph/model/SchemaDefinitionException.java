package com.mygraph.model;

/**
 * 类型或属性声明不合法（注册时抛出）
 */
public class SchemaDefinitionException extends OgmException {
    public SchemaDefinitionException(String message) {
        super(message);
    }
}
