package io.covenantc.core.model;

import java.util.Objects;

/**
 * Read-only environment threaded through every guard, rule and production function during one
 * compilation pass.
 *
 * @param network        network identifier the templates are built for (e.g. {@code "signet"})
 * @param availableFunds funds available to the contract, in the network's smallest unit
 * @param path           slash-separated location of the contract in the compilation tree,
 *                       {@code "/"} for the root contract
 */
public record CompilationContext(String network, long availableFunds, String path) {

    /** Root path of a compilation tree. */
    public static final String ROOT = "/";

    /** Validates fields. */
    public CompilationContext {
        Objects.requireNonNull(network, "network must not be null");
        if (availableFunds < 0) {
            throw new IllegalArgumentException("availableFunds must not be negative, got: " + availableFunds);
        }
        path = path == null || path.isBlank() ? ROOT : path;
    }

    /** Creates a root context for the given network and funds. */
    public static CompilationContext root(String network, long availableFunds) {
        return new CompilationContext(network, availableFunds, ROOT);
    }

    /**
     * Returns a context for a nested contract located under this one.
     *
     * @param child path segment of the nested contract, must not contain {@code '/'}
     */
    public CompilationContext derive(String child) {
        if (child == null || child.isBlank() || child.contains("/")) {
            throw new IllegalArgumentException("invalid path segment: '" + child + "'");
        }
        return new CompilationContext(network, availableFunds, path.endsWith("/") ? path + child : path + "/" + child);
    }

    /** Returns a copy of this context with a different amount of available funds. */
    public CompilationContext withFunds(long funds) {
        return new CompilationContext(network, funds, path);
    }
}
