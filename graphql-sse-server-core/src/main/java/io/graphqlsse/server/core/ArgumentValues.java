package io.graphqlsse.server.core;

import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.EnumValue;
import graphql.language.Field;
import graphql.language.FloatValue;
import graphql.language.IntValue;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.StringValue;
import graphql.language.Value;
import graphql.language.VariableReference;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves field argument values from the AST, substituting variables.
 *
 * <p>Pure functions; an absent, null or unresolvable value resolves to empty.
 */
public final class ArgumentValues {
    private ArgumentValues() {}

    public static Optional<Argument> argument(Field field, String name) {
        if (field == null || field.getArguments() == null) return Optional.empty();
        return field.getArguments().stream().filter(a -> name.equals(a.getName())).findFirst();
    }

    /**
     * Resolve every argument of a field. Unresolvable values map to null.
     */
    public static Map<String, Object> resolveAll(Field field, Map<String, Object> variables) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Argument argument : field.getArguments()) {
            out.put(argument.getName(), resolve(argument.getValue(), variables).orElse(null));
        }
        return out;
    }

    public static Optional<Object> resolve(Value<?> value, Map<String, Object> variables) {
        if (value == null || value instanceof NullValue) return Optional.empty();
        if (value instanceof StringValue s) return Optional.ofNullable(s.getValue());
        if (value instanceof IntValue i) return Optional.ofNullable(i.getValue());
        if (value instanceof FloatValue f) return Optional.ofNullable(f.getValue());
        if (value instanceof BooleanValue b) return Optional.of(b.isValue());
        if (value instanceof EnumValue e) return Optional.ofNullable(e.getName());
        if (value instanceof VariableReference v) {
            return Optional.ofNullable(variables.get(v.getName()));
        }
        if (value instanceof ArrayValue array) {
            List<Object> out = new ArrayList<>();
            for (Value<?> element : array.getValues()) {
                out.add(resolve(element, variables).orElse(null));
            }
            return Optional.of(out);
        }
        if (value instanceof ObjectValue object) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (ObjectField field : object.getObjectFields()) {
                out.put(field.getName(), resolve(field.getValue(), variables).orElse(null));
            }
            return Optional.of(out);
        }
        return Optional.empty();
    }

    /**
     * Text form of a scalar argument value, used for id comparison and channel keys.
     * Lists and objects have no text form.
     */
    public static Optional<String> scalarText(Object value) {
        if (value instanceof String s) return Optional.of(s);
        if (value instanceof BigDecimal d) return Optional.of(d.stripTrailingZeros().toPlainString());
        if (value instanceof Number || value instanceof Boolean) return Optional.of(value.toString());
        return Optional.empty();
    }
}
