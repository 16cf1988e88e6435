package ai.fingerprint.profiles;

import ai.fingerprint.temporal.ClassicalSeasonalDecomposer;
import ai.fingerprint.temporal.SeasonalDecomposer;
import ai.fingerprint.types.TypeSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the profiler of a type signature. Rules are evaluated in order and the first matching one
 * wins, so a signature matching several variants gets the one listed first:
 * <ol>
 *     <li>[Number, Number]</li>
 *     <li>[DateTime, Number]</li>
 *     <li>Number</li>
 *     <li>DateTime</li>
 *     <li>Category</li>
 *     <li>Text</li>
 * </ol>
 * Signatures matching no rule have no variant, callers fall back to {@link DefaultProfiler}.
 */
public class VariantResolver {

    private final List<Rule> rules;

    public VariantResolver(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public VariantResolver(SeasonalDecomposer decomposer) {
        this(defaultRules(decomposer));
    }

    public VariantResolver() {
        this(new ClassicalSeasonalDecomposer());
    }

    public static List<Rule> defaultRules(SeasonalDecomposer decomposer) {
        List<Rule> rules = new ArrayList<>(6);
        rules.add(Rule.isA(TypeSignature.NUMBER_NUMBER, new NumberPairProfiler()));
        rules.add(Rule.isA(TypeSignature.DATE_TIME_NUMBER, new TimeSeriesProfiler(decomposer)));
        rules.add(Rule.isA(TypeSignature.NUMBER, new NumericProfiler()));
        rules.add(Rule.isA(TypeSignature.DATE_TIME, new DateTimeProfiler()));
        rules.add(Rule.isA(TypeSignature.CATEGORY, new CategoryProfiler()));
        rules.add(Rule.isA(TypeSignature.TEXT, new TextProfiler()));
        return rules;
    }

    public Optional<ProfilerStrategy> resolve(TypeSignature signature) {
        for (Rule rule : rules) {
            if (rule.matches(signature)) {
                return Optional.of(rule.strategy);
            }
        }
        return Optional.empty();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public static class Rule {

        private final String description;
        private final Predicate<TypeSignature> predicate;
        private final ProfilerStrategy strategy;

        public Rule(String description, Predicate<TypeSignature> predicate, ProfilerStrategy strategy) {
            this.description = description;
            this.predicate = Objects.requireNonNull(predicate, "predicate");
            this.strategy = Objects.requireNonNull(strategy, "strategy");
        }

        public static Rule isA(TypeSignature pattern, ProfilerStrategy strategy) {
            return new Rule(pattern.toString(), signature -> signature.isA(pattern), strategy);
        }

        public boolean matches(TypeSignature signature) {
            return predicate.test(signature);
        }

        public ProfilerStrategy getStrategy() {
            return strategy;
        }

        @Override
        public String toString() {
            return description + " -> " + strategy.name();
        }
    }
}
