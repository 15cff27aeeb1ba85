package com.mygraph.model;

public class CardinalityViolationException extends OgmException {
    public CardinalityViolationException(String message) {
        super(message);
    }
}
