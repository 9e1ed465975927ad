package io.sealrelay.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one live push channel per identity id.
 */
public final class ConnectionRegistry {
    private final ConcurrentHashMap<String, PushChannel> channels = new ConcurrentHashMap<>();

    /**
     * Closes the client's current channel with {@code reason}, then installs {@code channel} in its slot.
     * Returns the channel that was closed.
     */
    public Optional<PushChannel> attach(PushChannel channel, String reason) {
        PushChannel previous = channels.get(channel.clientId());
        if (previous == channel) {
            return Optional.empty();
        }
        if (previous != null) {
            previous.close(reason);
        }
        channels.put(channel.clientId(), channel);
        return Optional.ofNullable(previous);
    }

    /**
     * Removes the entry only if it still points at {@code channel}; a newer channel for the same client
     * stays registered.
     */
    public boolean detach(PushChannel channel) {
        return channels.remove(channel.clientId(), channel);
    }

    public Optional<PushChannel> find(String clientId) {
        return Optional.ofNullable(channels.get(clientId));
    }

    public int size() {
        return channels.size();
    }

    public void closeAll(String reason) {
        List<PushChannel> live = new ArrayList<>(channels.values());
        channels.clear();
        for (PushChannel channel : live) {
            channel.close(reason);
        }
    }
}
