package com.entity.graph.resolve;

import com.entity.graph.core.model.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates an entity inside a collection by an approximate key.
 * Rules are tried in {@link MatchRule} order and the first rule with a hit wins, so an exact
 * match always beats a case-insensitive one. An empty result means "not found" and is the
 * signal for callers to create the entity.
 */
public class IdentifierResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    private final SuffixMatchPolicy suffixMatchPolicy;

    public IdentifierResolver() {
        this(SuffixMatchPolicy.MOST_SPECIFIC);
    }

    public IdentifierResolver(SuffixMatchPolicy suffixMatchPolicy) {
        this.suffixMatchPolicy = Objects.requireNonNull(suffixMatchPolicy, "suffixMatchPolicy is required");
    }

    /**
     * Resolves {@code keyValue} against the {@code keyField} of every object in {@code collection}.
     * Elements that are not objects, or whose key is not a string or number, are skipped.
     */
    public Optional<ResolvedEntity> resolve(ArrayNode collection, String keyField, String keyValue) {
        if (collection == null || collection.isEmpty()) {
            return Optional.empty();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < collection.size(); i++) {
            JsonNode element = collection.get(i);
            if (element instanceof ObjectNode node) {
                String value = JsonValues.scalarText(node.get(keyField));
                if (value != null) {
                    candidates.add(new Candidate(node, i, value));
                }
            }
        }
        return match(candidates, keyField, keyValue);
    }

    /**
     * Resolves against a single entity stored directly as an object (e.g. {@code property}).
     */
    public Optional<ResolvedEntity> resolveSingle(JsonNode entity, String keyField, String keyValue) {
        if (!(entity instanceof ObjectNode node)) {
            return Optional.empty();
        }
        String value = JsonValues.scalarText(node.get(keyField));
        if (value == null) {
            return Optional.empty();
        }
        return match(List.of(new Candidate(node, -1, value)), keyField, keyValue);
    }

    public SuffixMatchPolicy getSuffixMatchPolicy() {
        return suffixMatchPolicy;
    }

    private Optional<ResolvedEntity> match(List<Candidate> candidates, String keyField, String keyValue) {
        if (keyField == null || keyValue == null || keyValue.isBlank() || candidates.isEmpty()) {
            return Optional.empty();
        }

        for (Candidate c : candidates) {
            if (c.value.equals(keyValue)) {
                return Optional.of(c.toResolved(MatchRule.EXACT));
            }
        }

        for (Candidate c : candidates) {
            if (c.value.equalsIgnoreCase(keyValue)) {
                log.debug("resolve.caseInsensitive field={} key='{}' matched='{}'", keyField, keyValue, c.value);
                return Optional.of(c.toResolved(MatchRule.CASE_INSENSITIVE));
            }
        }

        String token = lastToken(keyValue);
        List<Candidate> suffixMatches = candidates.stream()
                .filter(c -> c.value.endsWith(token))
                .toList();
        if (suffixMatches.isEmpty()) {
            return Optional.empty();
        }
        if (suffixMatches.size() > 1) {
            log.debug("resolve.ambiguousSuffix field={} key='{}' candidates={} policy={}",
                    keyField, keyValue, suffixMatches.size(), suffixMatchPolicy);
        }
        return pickSuffixMatch(suffixMatches, keyField, keyValue)
                .map(c -> c.toResolved(MatchRule.SUFFIX));
    }

    private Optional<Candidate> pickSuffixMatch(List<Candidate> matches, String keyField, String keyValue) {
        switch (suffixMatchPolicy) {
            case FIRST -> {
                return Optional.of(matches.get(0));
            }
            case REJECT_AMBIGUOUS -> {
                if (matches.size() == 1) {
                    return Optional.of(matches.get(0));
                }
                log.warn("resolve.rejected field={} key='{}' ambiguousCandidates={}",
                        keyField, keyValue, matches.size());
                return Optional.empty();
            }
            default -> {
                Candidate best = matches.get(0);
                for (Candidate c : matches) {
                    if (c.value.length() < best.value.length()) {
                        best = c;
                    }
                }
                return Optional.of(best);
            }
        }
    }

    private static String lastToken(String keyValue) {
        String[] tokens = keyValue.trim().split("\\s+");
        return tokens[tokens.length - 1];
    }

    private record Candidate(ObjectNode node, int index, String value) {
        ResolvedEntity toResolved(MatchRule rule) {
            return new ResolvedEntity(node, index, rule);
        }
    }
}
