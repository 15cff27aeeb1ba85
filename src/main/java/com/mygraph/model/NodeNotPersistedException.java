package com.mygraph.model;

/**
 * 需要远端 ID 的操作作用在了未保存或已删除的节点上
 */
public class NodeNotPersistedException extends OgmException {
    public NodeNotPersistedException(String message) {
        super(message);
    }
}
