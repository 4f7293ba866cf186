package com.gbskill.engine.service;

/** A create call reused a business key (skill id, dataset or template code). */
public class DuplicateResourceException extends RuntimeException {

    private final String resource;
    private final String key;

    public DuplicateResourceException(String resource, String key) {
        super(resource + " already exists: " + key);
        this.resource = resource;
        this.key = key;
    }

    public String getResource() { return resource; }
    public String getKey()      { return key; }
}
