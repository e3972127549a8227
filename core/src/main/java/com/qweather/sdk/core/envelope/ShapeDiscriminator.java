package com.qweather.sdk.core.envelope;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qweather.sdk.core.util.JsonUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Picks one of several untagged payload shapes by field presence.
 *
 * <p>Variants are tried in declaration order and the first whose required fields are all present
 * wins, so the order is part of the contract. {@link Builder#build()} rejects a variant list in
 * which one variant's required fields are a subset of another's, since any body matching the larger
 * set would also match the smaller one.
 */
public final class ShapeDiscriminator<T> implements PayloadDecoder<T> {
    private static final Logger LOGGER = Logger.getLogger(ShapeDiscriminator.class.getName());

    private final String name;
    private final List<Variant<? extends T>> variants;

    private ShapeDiscriminator(String name, List<Variant<? extends T>> variants) {
        this.name = name;
        this.variants = List.copyOf(variants);
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public List<Variant<? extends T>> variants() {
        return variants;
    }

    public Variant<? extends T> select(ObjectNode body) throws ShapeMismatchException {
        List<Variant<? extends T>> matches = variants.stream()
                .filter(variant -> variant.matches(body))
                .toList();
        if (matches.isEmpty()) {
            throw new ShapeMismatchException(name, variants.stream().map(Variant::name).toList(), fieldNames(body));
        }
        if (matches.size() > 1) {
            LOGGER.warning(name + " body matches " + matches.stream().map(Variant::name).toList()
                    + "; using " + matches.get(0).name());
        }
        return matches.get(0);
    }

    @Override
    public T decode(ObjectNode body) throws IOException {
        return select(body).decode(body);
    }

    private static Set<String> fieldNames(ObjectNode body) {
        Set<String> names = new LinkedHashSet<>();
        body.fieldNames().forEachRemaining(names::add);
        return names;
    }

    public record Variant<V>(String name, Set<String> requiredFields, Class<V> type) {
        public Variant {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            requiredFields = Set.copyOf(requiredFields);
            if (requiredFields.isEmpty()) {
                throw new IllegalArgumentException("Variant " + name + " must require at least one field");
            }
        }

        boolean matches(ObjectNode body) {
            return requiredFields.stream().allMatch(field -> body.hasNonNull(field));
        }

        V decode(ObjectNode body) throws IOException {
            return JsonUtils.objectMapper().treeToValue(body, type);
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Variant<? extends T>> variants = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public <V extends T> Builder<T> variant(String variantName, Class<V> type, String... requiredFields) {
            variants.add(new Variant<>(variantName, Set.of(requiredFields), type));
            return this;
        }

        public ShapeDiscriminator<T> build() {
            if (variants.isEmpty()) {
                throw new IllegalStateException(name + " declares no variants");
            }
            for (Variant<? extends T> left : variants) {
                for (Variant<? extends T> right : variants) {
                    if (left != right && right.requiredFields().containsAll(left.requiredFields())) {
                        throw new IllegalStateException(name + " variants overlap: every body matching "
                                + right.name() + " " + right.requiredFields() + " also matches "
                                + left.name() + " " + left.requiredFields());
                    }
                }
            }
            Set<String> names = variants.stream().map(Variant::name).collect(Collectors.toSet());
            if (names.size() != variants.size()) {
                throw new IllegalStateException(name + " declares duplicate variant names");
            }
            return new ShapeDiscriminator<>(name, variants);
        }
    }
}
