package io.graphqlsse.spring.webmvc.starter;

import graphql.schema.GraphQLSchema;
import io.graphqlsse.json.jackson.JacksonJsonCodec;
import io.graphqlsse.json.spi.JsonCodec;
import io.graphqlsse.server.core.ChannelRouter;
import io.graphqlsse.server.core.GraphQLJavaExecutionBridge;
import io.graphqlsse.server.core.GraphQLSseHandler;
import io.graphqlsse.server.core.InMemoryConnectionStore;
import io.graphqlsse.server.core.InMemoryEventLog;
import io.graphqlsse.server.core.MaintenanceTask;
import io.graphqlsse.server.core.SubscriptionMatcher;
import io.graphqlsse.server.core.lmdb.LmdbSubscriptionStorage;
import io.graphqlsse.server.spi.ConnectionStore;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventLog;
import io.graphqlsse.server.spi.ExecutionBridge;
import io.graphqlsse.servlet.GraphQLSseServlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for GraphQL subscriptions over SSE with Spring WebMVC.
 *
 * <p>Registers a {@link GraphQLSseServlet} at {@code graphql-sse.path} backed by a
 * {@link GraphQLSseHandler}. Every bean can be overridden by defining your own. An
 * {@link ExecutionBridge} is required: define one, or a {@link GraphQLSchema} bean from which a
 * {@link GraphQLJavaExecutionBridge} is created.
 *
 * <p>The handler reads an {@link EventBroker} bean when one exists (push model), otherwise an
 * {@link EventLog} bean, otherwise the LMDB store's own log or an in-memory log (poll model).
 * Producers emit through {@link GraphQLSseHandler#emitter()}.
 */
@AutoConfiguration
@ConditionalOnClass({GraphQLSseHandler.class, GraphQLSseServlet.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(GraphQLSseProperties.class)
public class GraphQLSseAutoConfiguration {
    private static final Logger LOG = LoggerFactory.getLogger(GraphQLSseAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec graphQLSseJsonCodec() {
        return new JacksonJsonCodec();
    }

    /**
     * In-memory store by default; an LMDB environment when {@code graphql-sse.storage=lmdb}.
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionStore graphQLSseConnectionStore(GraphQLSseProperties properties, JsonCodec json) {
        if (properties.getStorage() == GraphQLSseProperties.Storage.LMDB) {
            return new LmdbSubscriptionStorage(properties.getLmdbDirectory(), json);
        }
        return new InMemoryConnectionStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionMatcher graphQLSseSubscriptionMatcher() {
        return new SubscriptionMatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelRouter graphQLSseChannelRouter(GraphQLSseProperties properties) {
        return ChannelRouter.builder().prefix(properties.getChannelPrefix()).build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(GraphQLSchema.class)
    public ExecutionBridge graphQLSseExecutionBridge(GraphQLSchema schema) {
        return new GraphQLJavaExecutionBridge(schema);
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphQLSseHandler graphQLSseHandler(GraphQLSseProperties properties,
                                               ConnectionStore store,
                                               ObjectProvider<ExecutionBridge> bridge,
                                               ObjectProvider<EventBroker> brokers,
                                               ObjectProvider<EventLog> logs,
                                               JsonCodec json,
                                               SubscriptionMatcher matcher,
                                               ChannelRouter router) {
        ExecutionBridge executionBridge = bridge.getIfUnique();
        if (executionBridge == null) {
            throw new IllegalStateException(
                    "GraphQL SSE needs a single ExecutionBridge bean, or a GraphQLSchema bean to create one from");
        }
        GraphQLSseHandler.Builder builder = GraphQLSseHandler.builder(store)
                .executionBridge(executionBridge)
                .jsonCodec(json)
                .matcher(matcher)
                .channelRouter(router)
                .reservationTtl(properties.getReservationTtl())
                .ephemeralReservationTtl(properties.getEphemeralReservationTtl())
                .keepAliveInterval(properties.getKeepAliveInterval())
                .pollInterval(properties.getPollInterval())
                .executionTimeout(properties.getExecutionTimeout())
                .maxStreamDuration(properties.getMaxStreamDuration())
                .batchSize(properties.getBatchSize())
                .revokeOnDisconnect(properties.isRevokeOnDisconnect());

        EventBroker broker = brokers.getIfUnique();
        if (broker != null) {
            LOG.info("GraphQL SSE delivering through broker {}", broker.getClass().getSimpleName());
            builder.eventBroker(broker);
        } else {
            EventLog log = logs.getIfUnique();
            if (log == null) {
                log = store instanceof EventLog storeLog ? storeLog : new InMemoryEventLog();
            }
            LOG.info("GraphQL SSE delivering from event log {}", log.getClass().getSimpleName());
            builder.eventLog(log);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphQLSseServlet graphQLSseServlet(GraphQLSseHandler handler) {
        return new GraphQLSseServlet(handler);
    }

    @Bean
    @ConditionalOnMissingBean(name = "graphQLSseServletRegistration")
    public ServletRegistrationBean<GraphQLSseServlet> graphQLSseServletRegistration(GraphQLSseServlet servlet,
                                                                                    GraphQLSseProperties properties) {
        ServletRegistrationBean<GraphQLSseServlet> registration =
                new ServletRegistrationBean<>(servlet, properties.getPath());
        registration.setName("graphQLSseServlet");
        registration.setAsyncSupported(true);
        return registration;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "graphql-sse.maintenance", name = "enabled", matchIfMissing = true)
    public MaintenanceTask graphQLSseMaintenanceTask(GraphQLSseHandler handler, GraphQLSseProperties properties) {
        MaintenanceTask task = handler.maintenance(properties.getMaintenance().getEventRetention());
        task.start(properties.getMaintenance().getInterval());
        return task;
    }
}
