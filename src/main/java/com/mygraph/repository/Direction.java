package com.mygraph.repository;

/**
 * 关系遍历方向（相对于起点节点）
 */
public enum Direction {
    OUTGOING,
    INCOMING,
    EITHER
}
