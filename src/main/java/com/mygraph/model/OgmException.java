package com.mygraph.model;

/**
 * 映射层错误的基类
 */
public class OgmException extends Exception {
    public OgmException(String message) {
        super(message);
    }

    public OgmException(String message, Throwable cause) {
        super(message, cause);
    }
}
