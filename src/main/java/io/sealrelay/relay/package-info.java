/**
 * Relay server.
 *
 * <p>{@link io.sealrelay.relay.RelayService} is transport-agnostic: it talks to connected recipients only
 * through {@link io.sealrelay.relay.PushChannel}. {@link io.sealrelay.relay.RelayHttpServer} binds it to
 * HTTP with a Server-Sent Events channel per recipient. The relay never sees plaintext; envelopes are
 * stored and forwarded as opaque JSON.
 */
package io.sealrelay.relay;
