package com.bootstrap.shared.model;

/**
 * 佈建目標供應商
 */
public enum Provider {

    STRIPE("stripe"),
    CLOUDFLARE("cloudflare");

    private final String label;

    Provider(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
