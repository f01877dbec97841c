package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.SubscriptionDocument;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionMatcherTest {

    private final OperationParser parser = new OperationParser();
    private final SubscriptionMatcher matcher = new SubscriptionMatcher();

    @Test
    void literalIdFilter() {
        RegisteredSubscription sub = subscription("subscription { postUpdated(id: \"123\") { id } }", Map.of());

        assertThat(matcher.matches(sub, "postUpdated", "123")).isTrue();
        assertThat(matcher.matches(sub, "postUpdated", "456")).isFalse();
        assertThat(matcher.matches(sub, "postDeleted", "123")).isFalse();
    }

    @Test
    void variableIdFilter() {
        RegisteredSubscription sub = subscription(
                "subscription ($id: ID!) { postUpdated(id: $id) { id } }", Map.of("id", 42));

        assertThat(matcher.matches(sub, "postUpdated", "42")).isTrue();
        assertThat(matcher.matches(sub, "postUpdated", "43")).isFalse();
    }

    @Test
    void intLiteralComparesAsText() {
        RegisteredSubscription sub = subscription("subscription { postUpdated(id: 7) { id } }", Map.of());

        assertThat(matcher.matches(sub, "postUpdated", "7")).isTrue();
    }

    @Test
    void withoutIdEverySubjectMatches() {
        RegisteredSubscription sub = subscription("subscription { postCreated { id } }", Map.of());

        assertThat(matcher.matches(sub, "postCreated", "1")).isTrue();
        assertThat(matcher.matches(sub, "postCreated", "2")).isTrue();
    }

    @Test
    void unresolvableIdFailsClosed() {
        Map<String, Object> nullVariable = new HashMap<>();
        nullVariable.put("id", null);

        assertThat(matcher.matches(subscription("subscription ($id: ID) { postUpdated(id: $id) { id } }", Map.of()),
                "postUpdated", "1")).isFalse();
        assertThat(matcher.matches(subscription("subscription ($id: ID) { postUpdated(id: $id) { id } }", nullVariable),
                "postUpdated", "1")).isFalse();
        assertThat(matcher.matches(subscription("subscription { postUpdated(id: null) { id } }", Map.of()),
                "postUpdated", "null")).isFalse();
        assertThat(matcher.matches(subscription("subscription { postUpdated(id: [\"1\"]) { id } }", Map.of()),
                "postUpdated", "1")).isFalse();
        assertThat(matcher.matches(subscription("subscription { postUpdated(id: {value: \"1\"}) { id } }", Map.of()),
                "postUpdated", "1")).isFalse();
    }

    @Test
    void fieldAliasesMapToEventTypes() {
        SubscriptionMatcher aliased = SubscriptionMatcher.builder()
                .mapField("postChanged", "postCreated", "postUpdated")
                .build();
        RegisteredSubscription sub = subscription("subscription { postChanged(id: \"5\") { id } }", Map.of());

        assertThat(aliased.matches(sub, "postCreated", "5")).isTrue();
        assertThat(aliased.matches(sub, "postUpdated", "5")).isTrue();
        assertThat(aliased.matches(sub, "postChanged", "5")).isFalse();
    }

    @Test
    void customIdArgument() {
        SubscriptionMatcher byNode = SubscriptionMatcher.builder().idArgument("nodeId").build();
        RegisteredSubscription sub = subscription("subscription { commentAdded(nodeId: \"9\") { id } }", Map.of());

        assertThat(byNode.matches(sub, "commentAdded", "9")).isTrue();
        assertThat(byNode.matches(sub, "commentAdded", "8")).isFalse();
    }

    @Test
    void introspectionFieldsAreSkipped() {
        RegisteredSubscription sub = subscription("subscription { __typename postUpdated(id: \"1\") { id } }", Map.of());

        assertThat(matcher.matches(sub, "postUpdated", "1")).isTrue();
    }

    @Test
    void resolvesNestedArgumentValues() {
        RegisteredSubscription sub = subscription(
                "subscription ($tag: String) { postUpdated(where: {tags: [$tag, \"b\"], state: PUBLISHED, score: 1.50}) { id } }",
                Map.of("tag", "a"));

        Map<String, Object> args = ArgumentValues.resolveAll(sub.rootField().get(), sub.document().variables());

        assertThat(args).containsOnlyKeys("where");
        @SuppressWarnings("unchecked")
        Map<String, Object> where = (Map<String, Object>) args.get("where");
        assertThat(where.get("tags")).isEqualTo(List.of("a", "b"));
        assertThat(where.get("state")).isEqualTo("PUBLISHED");
        assertThat(ArgumentValues.scalarText(where.get("score"))).contains("1.5");
    }

    private RegisteredSubscription subscription(String query, Map<String, Object> variables) {
        ParsedOperation parsed = parser.parse(query, Optional.empty());
        assertThat(parsed).isInstanceOf(ParsedOperation.Subscription.class);
        SubscriptionDocument document = new SubscriptionDocument("t", "op", query, null, variables, Instant.EPOCH);
        return new RegisteredSubscription(document, (ParsedOperation.Subscription) parsed);
    }
}
