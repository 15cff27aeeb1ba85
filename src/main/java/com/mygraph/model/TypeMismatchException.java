package com.mygraph.model;

public class TypeMismatchException extends OgmException {
    public TypeMismatchException(String message) {
        super(message);
    }
}
