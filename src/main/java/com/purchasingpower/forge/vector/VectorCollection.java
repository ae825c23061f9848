package com.purchasingpower.forge.vector;

public enum VectorCollection {
    DOCUMENTS("documents"),
    CONVERSATIONS("conversations");

    private final String storeName;

    VectorCollection(String storeName) {
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
