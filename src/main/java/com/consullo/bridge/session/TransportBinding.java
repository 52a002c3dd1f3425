package com.consullo.bridge.session;

import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * Handle of the chat transport attached to a session (e.g. a channel of a chat server).
 *
 * @param transport transport name (e.g. "discord")
 * @param channelId transport-specific channel identifier
 * @param connectedAt time the binding was made
 * @since 1.0
 */
public record TransportBinding(String transport, String channelId, Instant connectedAt) {

  public TransportBinding {
    Validate.notBlank(transport, "transport must not be blank");
    Validate.notBlank(channelId, "channelId must not be blank");
    Validate.notNull(connectedAt, "connectedAt must not be null");
  }
}
