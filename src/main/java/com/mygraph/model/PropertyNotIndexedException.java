package com.mygraph.model;

public class PropertyNotIndexedException extends OgmException {
    private final String property;

    public PropertyNotIndexedException(String typeName, String property) {
        super("property '" + property + "' of " + typeName + " is not indexed");
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
