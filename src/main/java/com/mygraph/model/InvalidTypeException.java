package com.mygraph.model;

/**
 * 属性值的运行时类型与声明的 kind 不符
 */
public class InvalidTypeException extends OgmException {
    public InvalidTypeException(String message) {
        super(message);
    }
}
