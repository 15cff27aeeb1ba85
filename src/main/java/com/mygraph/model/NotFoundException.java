package com.mygraph.model;

public class NotFoundException extends OgmException {
    public NotFoundException(String message) {
        super(message);
    }
}
