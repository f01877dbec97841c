package io.graphqlsse.server.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Computes the channels an event is published on and the channels a subscription listens on.
 *
 * <p>Channel names follow {@code <prefix><eventType>} (global) and
 * {@code <prefix><eventType>.<routingKey>} (specific).
 */
public final class ChannelRouter {

    public static final String DEFAULT_PREFIX = "graphql:";

    private static final Pattern EVENT_TYPE = Pattern.compile("[_A-Za-z][_0-9A-Za-z]*");

    private final String prefix;
    private final Map<String, ChannelKeying> keyings;
    private final List<ChannelContributor> contributors;

    public ChannelRouter() {
        this(builder());
    }

    private ChannelRouter(Builder builder) {
        this.prefix = builder.prefix;
        this.keyings = Map.copyOf(builder.keyings);
        this.contributors = List.copyOf(builder.contributors);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ChannelRouter}. Comment events are keyed by {@code context.post_id} unless
     * overridden.
     */
    public static final class Builder {
        private String prefix = DEFAULT_PREFIX;
        private final Map<String, ChannelKeying> keyings = new HashMap<>();
        private final List<ChannelContributor> contributors = new ArrayList<>();

        private Builder() {
            ChannelKeying byPost = ChannelKeying.contextField("post_id");
            keyings.put("commentAdded", byPost);
            keyings.put("commentUpdated", byPost);
            keyings.put("commentDeleted", byPost);
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder keying(String eventType, ChannelKeying keying) {
            keyings.put(Objects.requireNonNull(eventType, "eventType"), Objects.requireNonNull(keying, "keying"));
            return this;
        }

        public Builder contributor(ChannelContributor contributor) {
            contributors.add(Objects.requireNonNull(contributor, "contributor"));
            return this;
        }

        public ChannelRouter build() {
            return new ChannelRouter(this);
        }
    }

    /**
     * Chooses the routing key of an event. Returning empty falls back to the subject id.
     */
    @FunctionalInterface
    public interface ChannelKeying {

        Optional<String> routingKey(String eventType, String subjectId, Map<String, Object> payload);

        /**
         * Keys by {@code payload.context.<field>}, or by a top-level {@code payload.<field>}.
         */
        static ChannelKeying contextField(String field) {
            return (eventType, subjectId, payload) -> {
                Object context = payload.get("context");
                Object value = context instanceof Map<?, ?> map ? map.get(field) : null;
                if (value == null) value = payload.get(field);
                return Optional.ofNullable(value).flatMap(ArgumentValues::scalarText).filter(s -> !s.isEmpty());
            };
        }
    }

    /**
     * Adds extra channels for an event.
     */
    @FunctionalInterface
    public interface ChannelContributor {
        Collection<String> channels(String eventType, String subjectId, Map<String, Object> payload);
    }

    /**
     * Routing decision for one event.
     *
     * @param routingKey key of the specific channel
     * @param channels global channel first, then the specific channel, then contributed ones
     */
    public record Routing(String routingKey, Set<String> channels) {}

    public Routing route(String eventType, String subjectId, Map<String, Object> payload) {
        Map<String, Object> body = payload == null ? Map.of() : payload;
        ChannelKeying keying = keyings.get(eventType);
        String key = keying == null ? subjectId : keying.routingKey(eventType, subjectId, body).orElse(subjectId);

        Set<String> channels = new LinkedHashSet<>();
        channels.add(globalChannel(eventType));
        channels.add(specificChannel(eventType, key));
        for (ChannelContributor contributor : contributors) {
            Collection<String> extra = contributor.channels(eventType, subjectId, body);
            if (extra != null) channels.addAll(extra);
        }
        return new Routing(key, Collections.unmodifiableSet(channels));
    }

    public Set<String> channelsFor(String eventType, String subjectId, Map<String, Object> payload) {
        return route(eventType, subjectId, payload).channels();
    }

    public String prefix() {
        return prefix;
    }

    public String globalChannel(String eventType) {
        return prefix + eventType;
    }

    public String specificChannel(String eventType, String routingKey) {
        return prefix + eventType + "." + routingKey;
    }

    /**
     * Channels a subscription listens on under the push model: the specific channel of every
     * event type its field maps to when it carries an id filter, else their global channels.
     * An id filter without a scalar value yields no channel.
     */
    public Set<String> channelsFor(RegisteredSubscription subscription, SubscriptionMatcher matcher) {
        Set<String> out = new LinkedHashSet<>();
        Optional<String> field = subscription.rootField().map(f -> f.getName());
        if (field.isEmpty()) return out;
        Optional<SubscriptionMatcher.Filter> filter = matcher.filterOf(subscription);
        for (String eventType : matcher.eventTypesFor(field.get())) {
            if (filter.isEmpty()) {
                out.add(globalChannel(eventType));
            } else {
                filter.get().value().ifPresent(key -> out.add(specificChannel(eventType, key)));
            }
        }
        return out;
    }

    /**
     * Split a channel into event type and optional key.
     *
     * @throws IllegalArgumentException if the channel does not carry this router's prefix
     */
    public Channel parseChannel(String channel) {
        if (channel == null || !channel.startsWith(prefix)) {
            throw new IllegalArgumentException("Invalid channel format: " + channel);
        }
        String rest = channel.substring(prefix.length());
        int dot = rest.indexOf('.');
        if (dot < 0) return new Channel(rest, Optional.empty());
        return new Channel(rest.substring(0, dot), Optional.of(rest.substring(dot + 1)));
    }

    public boolean isValidChannel(String channel) {
        if (channel == null || !channel.startsWith(prefix)) return false;
        Channel parsed = parseChannel(channel);
        return EVENT_TYPE.matcher(parsed.eventType()).matches()
                && parsed.key().map(k -> !k.isEmpty()).orElse(true);
    }

    /**
     * Channel form of an argument value; null renders as {@code null}.
     */
    public static Optional<String> renderArgument(Object value) {
        if (value == null) return Optional.of("null");
        return ArgumentValues.scalarText(value);
    }

    /**
     * A parsed channel name.
     */
    public record Channel(String eventType, Optional<String> key) {
        public boolean isGlobal() {
            return key.isEmpty();
        }
    }
}
