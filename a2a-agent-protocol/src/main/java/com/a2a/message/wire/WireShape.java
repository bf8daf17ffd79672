package com.a2a.message.wire;

/**
 * Request envelopes accepted by the gateway.
 */
public enum WireShape {

    /** OpenAI-style {@code {"model":..,"messages":[{"role","content"}]}}. */
    CHAT_COMPLETIONS,

    /** {@code {"jsonrpc":"2.0","id":..,"method":"message/send","params":{"message":{..}}}}. */
    JSON_RPC,

    /** Flat A2A envelope {@code {"method":"message/send","params":{"message":{..}}}}. */
    A2A
}
