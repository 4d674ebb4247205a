package com.quick.trio.trio;

import java.util.Set;

/**
 * An event together with who receives it: one seat, or every connected seat
 * except {@code excluded}.
 */
public record OutboundMessage(String recipientId, Set<String> excluded, TrioEvent event) {

    public static OutboundMessage broadcast(TrioEvent event) {
        return new OutboundMessage(null, Set.of(), event);
    }

    public static OutboundMessage broadcastExcept(Set<String> excluded, TrioEvent event) {
        return new OutboundMessage(null, Set.copyOf(excluded), event);
    }

    public static OutboundMessage toPlayer(String playerId, TrioEvent event) {
        return new OutboundMessage(playerId, Set.of(), event);
    }

    public boolean isPrivate() {
        return recipientId != null;
    }
}
