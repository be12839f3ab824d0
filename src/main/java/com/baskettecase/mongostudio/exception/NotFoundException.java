package com.baskettecase.mongostudio.exception;

/**
 * Nothing is stored under the requested name: a connection profile unless stated otherwise.
 */
public class NotFoundException extends MongoStudioException {

    private final String name;

    public NotFoundException(String name) {
        this("Connection profile", name);
    }

    public NotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
