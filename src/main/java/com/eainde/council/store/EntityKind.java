package com.eainde.council.store;

/** Top-level record kinds. Entities reference each other by id only. */
public enum EntityKind {
    APPLICATION("applications"),
    DECISION("decisions"),
    OBSERVATION("observations"),
    TEAM("teams"),
    OUTCOME("outcomes");

    private final String collection;

    EntityKind(String collection) {
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }
}
