package com.roomgate.gateway.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Map;

/**
 * Addressing and metadata captured when a client connects, before the protocol upgrade.
 */
@Value
@Builder(toBuilder = true)
public class HandshakeInfo {
    /**
     * Target namespace path resolved from the upgrade URI.
     */
    @Builder.Default
    String namespace = "/";

    @Singular("queryParam")
    Map<String, String> queryParams;

    /**
     * Header names are expected lower-case.
     */
    @Singular("header")
    Map<String, String> headers;

    @Nullable
    String remoteAddress;

    @Builder.Default
    long issuedAt = System.currentTimeMillis();

    @Nullable
    public String query(String name) {
        return queryParams.get(name);
    }

    @Nullable
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
