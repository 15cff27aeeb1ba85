package com.mygraph.model;

public enum Indexing {
    NONE,
    INDEX,
    UNIQUE_INDEX
}
