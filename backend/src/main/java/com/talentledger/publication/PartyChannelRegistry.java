package com.talentledger.publication;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One multicast sink per party address with live subscribers. A channel is created on first subscribe and dropped
 * when the last subscriber leaves; emissions to addresses without subscribers are no-ops.
 * <p>
 * Subscriber counts are kept by the registry and only changed inside {@code compute}, so a subscriber arriving while
 * the previous one leaves can never end up on a channel that is no longer registered.
 */
@Slf4j
@Component
public class PartyChannelRegistry {

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    public Flux<PublicationEvent> stream(String address) {
        String key = address.toLowerCase();
        return Flux.defer(() -> join(key).sink.asFlux())
                .doFinally(signal -> leave(key));
    }

    /**
     * Emissions on one channel are serialized; the sink rejects concurrent producers otherwise.
     *
     * @return true when at least one subscriber was offered the event
     */
    public boolean emit(PublicationEvent event) {
        Channel channel = channels.get(event.channel());
        if (channel == null) {
            return false;
        }
        Sinks.EmitResult result;
        synchronized (channel) {
            result = channel.sink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.debug("Dropped {} for {}: {}", event.type(), event.channel(), result);
            return false;
        }
        return true;
    }

    public int subscriberCount(String address) {
        Channel channel = channels.get(address.toLowerCase());
        return channel == null ? 0 : channel.sink.currentSubscriberCount();
    }

    int channelCount() {
        return channels.size();
    }

    private Channel join(String key) {
        return channels.compute(key, (k, channel) -> {
            Channel joined = channel == null ? new Channel() : channel;
            joined.members++;
            return joined;
        });
    }

    private void leave(String key) {
        channels.computeIfPresent(key, (k, channel) -> --channel.members == 0 ? null : channel);
    }

    private static final class Channel {
        private final Sinks.Many<PublicationEvent> sink = Sinks.many().multicast().directBestEffort();
        private int members;
    }
}
