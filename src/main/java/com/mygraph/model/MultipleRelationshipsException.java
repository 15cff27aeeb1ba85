package com.mygraph.model;

/**
 * 两个节点之间存在多条同类型同方向的关系，无法确定删除哪一条
 */
public class MultipleRelationshipsException extends OgmException {
    public MultipleRelationshipsException(String message) {
        super(message);
    }
}
