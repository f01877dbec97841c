package io.graphqlsse.server.core;

import graphql.language.Document;
import graphql.language.Field;
import graphql.language.OperationDefinition;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;

import java.util.List;
import java.util.Optional;

/**
 * Parses subscription documents with graphql-java. Parse failures are returned, never thrown.
 */
public final class OperationParser {

    private final Parser parser = new Parser();

    public ParsedOperation parse(String query, Optional<String> operationName) {
        if (query == null || query.isBlank()) {
            return new ParsedOperation.Invalid("query must not be empty");
        }

        Document document;
        try {
            document = parser.parseDocument(query);
        } catch (InvalidSyntaxException e) {
            return new ParsedOperation.Invalid(e.getMessage());
        }

        List<OperationDefinition> operations = document.getDefinitionsOfType(OperationDefinition.class);
        if (operations.isEmpty()) {
            return new ParsedOperation.Invalid("document contains no operation");
        }

        OperationDefinition selected;
        if (operationName.isPresent()) {
            String name = operationName.get();
            selected = operations.stream()
                    .filter(op -> name.equals(op.getName()))
                    .findFirst()
                    .orElse(null);
            if (selected == null) {
                return new ParsedOperation.Invalid("unknown operation named '" + name + "'");
            }
        } else if (operations.size() == 1) {
            selected = operations.get(0);
        } else {
            return new ParsedOperation.Invalid("operationName is required when the document has several operations");
        }

        if (selected.getOperation() != OperationDefinition.Operation.SUBSCRIPTION) {
            return new ParsedOperation.NotSubscription(selected.getOperation());
        }
        if (rootSelections(selected) > 1) {
            return new ParsedOperation.Invalid("subscription operations must select exactly one root field");
        }
        return new ParsedOperation.Subscription(document, selected);
    }

    private static long rootSelections(OperationDefinition operation) {
        if (operation.getSelectionSet() == null) return 0;
        return operation.getSelectionSet().getSelections().stream()
                .filter(s -> !(s instanceof Field field && "__typename".equals(field.getName())))
                .count();
    }
}
