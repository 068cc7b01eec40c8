package com.transitbot.model;

public enum DataType {
    SIMULATED("simulated"),
    REAL("real");

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
