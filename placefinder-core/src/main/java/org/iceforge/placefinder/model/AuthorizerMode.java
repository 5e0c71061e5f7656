package org.iceforge.placefinder.model;

/**
 * Inbound authorization of a gateway.
 */
public enum AuthorizerMode {
    /** No inbound authorization. Development and demos only. */
    NONE(false),
    CUSTOM_JWT(true),
    AWS_IAM(true);

    private final boolean productionReady;

    AuthorizerMode(boolean productionReady) {
        this.productionReady = productionReady;
    }

    public boolean productionReady() {
        return productionReady;
    }
}
