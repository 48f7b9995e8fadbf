package ai.apigraph.io;

import java.util.Objects;
import java.util.Optional;

import ai.apigraph.runtime.ObjectSpace;

/**
 * A loaded program image and the package it names as its root, if any.
 */
public record ProgramImage(ObjectSpace space, String packageName) {

    public ProgramImage {
        Objects.requireNonNull(space, "space");
    }

    public Optional<String> rootPackage() {
        return Optional.ofNullable(packageName);
    }
}
