package org.iceforge.placefinder.model;

public enum NetworkMode {
    PUBLIC
}
