package com.mygraph.model;

public class NoSuchTypeException extends OgmException {
    public NoSuchTypeException(String message) {
        super(message);
    }
}
