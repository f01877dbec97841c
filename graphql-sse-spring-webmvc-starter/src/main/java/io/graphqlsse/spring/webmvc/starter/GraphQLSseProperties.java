package io.graphqlsse.spring.webmvc.starter;

import io.graphqlsse.server.core.ChannelRouter;
import io.graphqlsse.server.core.GraphQLSseHandler;
import io.graphqlsse.server.core.MaintenanceTask;
import io.graphqlsse.server.core.TokenService;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from {@code graphql-sse.*}.
 */
@ConfigurationProperties(prefix = "graphql-sse")
public class GraphQLSseProperties {

    /** Backend for reservations, documents and the event log. */
    public enum Storage {
        MEMORY,
        LMDB
    }

    /** Servlet mapping of the stream endpoint. */
    private String path = "/graphql/stream";

    private Storage storage = Storage.MEMORY;

    /** Environment directory when {@code storage=lmdb}. */
    private Path lmdbDirectory = Path.of("data", "graphql-sse");

    private String channelPrefix = ChannelRouter.DEFAULT_PREFIX;
    private Duration reservationTtl = TokenService.DEFAULT_TTL;
    private Duration ephemeralReservationTtl = TokenService.DEFAULT_EPHEMERAL_TTL;
    private Duration keepAliveInterval = Duration.ofSeconds(15);
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration executionTimeout = Duration.ofSeconds(10);

    /** Unlimited when unset. */
    private Duration maxStreamDuration;

    private int batchSize = GraphQLSseHandler.DEFAULT_BATCH_SIZE;
    private boolean revokeOnDisconnect;
    private final Maintenance maintenance = new Maintenance();

    public static class Maintenance {
        private boolean enabled = true;
        private Duration interval = MaintenanceTask.DEFAULT_INTERVAL;
        private Duration eventRetention = MaintenanceTask.DEFAULT_EVENT_RETENTION;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getEventRetention() {
            return eventRetention;
        }

        public void setEventRetention(Duration eventRetention) {
            this.eventRetention = eventRetention;
        }
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Path getLmdbDirectory() {
        return lmdbDirectory;
    }

    public void setLmdbDirectory(Path lmdbDirectory) {
        this.lmdbDirectory = lmdbDirectory;
    }

    public String getChannelPrefix() {
        return channelPrefix;
    }

    public void setChannelPrefix(String channelPrefix) {
        this.channelPrefix = channelPrefix;
    }

    public Duration getReservationTtl() {
        return reservationTtl;
    }

    public void setReservationTtl(Duration reservationTtl) {
        this.reservationTtl = reservationTtl;
    }

    public Duration getEphemeralReservationTtl() {
        return ephemeralReservationTtl;
    }

    public void setEphemeralReservationTtl(Duration ephemeralReservationTtl) {
        this.ephemeralReservationTtl = ephemeralReservationTtl;
    }

    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    public void setKeepAliveInterval(Duration keepAliveInterval) {
        this.keepAliveInterval = keepAliveInterval;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Duration getMaxStreamDuration() {
        return maxStreamDuration;
    }

    public void setMaxStreamDuration(Duration maxStreamDuration) {
        this.maxStreamDuration = maxStreamDuration;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isRevokeOnDisconnect() {
        return revokeOnDisconnect;
    }

    public void setRevokeOnDisconnect(boolean revokeOnDisconnect) {
        this.revokeOnDisconnect = revokeOnDisconnect;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }
}
