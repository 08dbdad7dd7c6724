package com.roomgate.gateway.session;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Namespaces of one gateway process, created lazily on first use.
 */
public class NamespaceRegistry {
    private final GatewayContext context;
    private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();

    public NamespaceRegistry(GatewayContext context) {
        this.context = context;
    }

    /**
     * Returns the namespace, creating it and subscribing it to its broker topic if absent.
     *
     * @param name Namespace path; normalized to start with "/" and have no trailing "/"
     */
    public Namespace of(String name) {
        Namespace namespace = namespaces.computeIfAbsent(normalize(name), n -> new Namespace(n, context));
        namespace.bindBroker();
        return namespace;
    }

    public Optional<Namespace> get(String name) {
        return Optional.ofNullable(namespaces.get(normalize(name)));
    }

    public Collection<Namespace> all() {
        return List.copyOf(namespaces.values());
    }

    /**
     * Closes and forgets every namespace.
     */
    public void clear() {
        for (Namespace namespace : all()) {
            namespace.close();
            namespaces.remove(namespace.getName(), namespace);
        }
    }

    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "/";
        }
        String normalized = name.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
