package com.mygraph.model;

public class NoSuchPropertyException extends OgmException {
    private final String property;

    public NoSuchPropertyException(String typeName, String property) {
        super("'" + property + "' is not a property of " + typeName);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
