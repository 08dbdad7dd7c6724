package com.roomgate.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.roomgate.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * JSON codec for envelopes travelling over a distributed broker.
 */
public final class EnvelopeCodec {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    private EnvelopeCodec() {
    }

    public static String encode(MessageEnvelope envelope) {
        return JsonUtils.writeValueAsString(envelope);
    }

    /**
     * Decodes a broker payload.
     *
     * @param json raw message body
     * @return envelope, or null when the body is not JSON or fails {@link MessageEnvelope#isValid}
     */
    @Nullable
    public static MessageEnvelope decode(@Nullable String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode tree = JsonUtils.mapper().readTree(json);
            if (!MessageEnvelope.isValid(tree)) {
                log.debug("Dropping foreign or malformed broker payload: {}", json);
                return null;
            }
            return JsonUtils.mapper().treeToValue(tree, MessageEnvelope.class);
        } catch (Exception e) {
            log.debug("Failed to decode broker payload: {}", e.getMessage());
            return null;
        }
    }
}
