package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.core.Protocol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemoryConnectionStore store = new InMemoryConnectionStore();
    private final TokenService tokens = new TokenService(store, clock);
    private final SubscriptionRegistry registry = new SubscriptionRegistry(store, clock);
    private String token;

    @BeforeEach
    void reserve() {
        token = tokens.reserve(Duration.ofMinutes(10)).token();
    }

    @Test
    void registersSubscription() {
        RegisteredSubscription registered = registry.register(token, "op1",
                "subscription OnPost($id: ID!) { postUpdated(id: $id) { id title } }", Map.of("id", "42"), null);

        assertThat(registered.rootField()).hasValueSatisfying(f -> assertThat(f.getName()).isEqualTo("postUpdated"));
        assertThat(registry.get(token, "op1")).isPresent();
        assertThat(registry.count(token)).isEqualTo(1);
    }

    @Test
    void rejectsQueriesAndMutations() {
        assertThatThrownBy(() -> registry.register(token, "op1", "query { posts { id } }", Map.of(), null))
                .isInstanceOf(GraphQLSseException.InvalidOperation.class)
                .hasMessageContaining("query");
        assertThatThrownBy(() -> registry.register(token, "op2", "mutation { like(id: 1) }", Map.of(), null))
                .isInstanceOf(GraphQLSseException.UnsupportedOperation.class);
        assertThat(registry.count(token)).isZero();
    }

    @Test
    void rejectsUnparsableDocuments() {
        assertThatThrownBy(() -> registry.register(token, "op1", "subscription {", Map.of(), null))
                .isInstanceOf(GraphQLSseException.MalformedRequest.class)
                .satisfies(e -> assertThat(((GraphQLSseException) e).code()).isEqualTo(Protocol.CODE_PARSE_FAILED));
    }

    @Test
    void rejectsSeveralRootFields() {
        assertThatThrownBy(() -> registry.register(token, "op1",
                "subscription { postUpdated { id } commentAdded { id } }", Map.of(), null))
                .isInstanceOf(GraphQLSseException.MalformedRequest.class)
                .satisfies(e -> assertThat(((GraphQLSseException) e).code()).isEqualTo(Protocol.CODE_PARSE_FAILED));
        assertThat(registry.count(token)).isZero();

        registry.register(token, "op2", "subscription { __typename postUpdated { id } }", Map.of(), null);
        assertThat(registry.count(token)).isEqualTo(1);
    }

    @Test
    void selectsOperationByName() {
        String doc = "query Feed { posts { id } } subscription Live { postCreated { id } }";

        assertThat(registry.register(token, "op1", doc, Map.of(), "Live").rootField())
                .hasValueSatisfying(f -> assertThat(f.getName()).isEqualTo("postCreated"));
        assertThatThrownBy(() -> registry.register(token, "op2", doc, Map.of(), null))
                .isInstanceOf(GraphQLSseException.MalformedRequest.class);
        assertThatThrownBy(() -> registry.register(token, "op3", doc, Map.of(), "Missing"))
                .isInstanceOf(GraphQLSseException.MalformedRequest.class);
    }

    @Test
    void rejectsExpiredToken() {
        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> registry.register(token, "op1", "subscription { postUpdated { id } }", Map.of(), null))
                .isInstanceOf(GraphQLSseException.InvalidToken.class);
    }

    @Test
    void reRegisteringReplacesDocument() {
        registry.register(token, "op1", "subscription { postUpdated { id } }", Map.of(), null);
        registry.register(token, "op1", "subscription { postDeleted { id } }", Map.of(), null);

        assertThat(registry.list(token)).singleElement()
                .satisfies(s -> assertThat(s.rootField().get().getName()).isEqualTo("postDeleted"));
    }

    @Test
    void listsInRegistrationOrderAndRemoves() {
        registry.register(token, "b", "subscription { postUpdated { id } }", Map.of(), null);
        clock.advance(Duration.ofSeconds(1));
        registry.register(token, "a", "subscription { postDeleted { id } }", Map.of(), null);

        assertThat(registry.list(token)).extracting(RegisteredSubscription::operationId).containsExactly("b", "a");
        assertThat(registry.remove(token, "b")).isTrue();
        assertThat(registry.remove(token, "b")).isFalse();
        assertThat(registry.totalCount()).isEqualTo(1);
    }

    @Test
    void aliasIsTheResponseKey() {
        RegisteredSubscription registered = registry.register(token, "op1",
                "subscription { changed: postUpdated { id } }", Map.of(), null);

        assertThat(registered.responseKey()).contains("changed");
    }
}
