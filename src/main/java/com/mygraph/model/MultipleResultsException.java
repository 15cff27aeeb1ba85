package com.mygraph.model;

public class MultipleResultsException extends OgmException {
    public MultipleResultsException(String message) {
        super(message);
    }
}
