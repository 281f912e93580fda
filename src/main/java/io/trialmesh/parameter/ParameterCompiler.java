package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.sampling.DistributionSampler;
import io.trialmesh.sampling.LatinHypercube;
import io.trialmesh.sampling.RankCorrelation;
import io.trialmesh.sampling.SampleContext;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a parameter set into per-trial draws.
 *
 * <p>Every random column (one per shared parameter, one per independent parameter and
 * experiment) has its own generator seeded from the simulation seed and the column key, so
 * the same seed and parameters always yield the same values and adding a parameter does not
 * shift the others.
 */
public final class ParameterCompiler {
    private static final Logger logger = LoggerFactory.getLogger(ParameterCompiler.class);
    private static final double NO_PERCENTILE = 0.5;

    private final DistributionSampler sampler;
    private final ParameterApplier applier;

    public ParameterCompiler(DistributionSampler sampler, ParameterApplier applier) {
        this.sampler = sampler;
        this.applier = applier;
    }

    public CompiledParameters compile(ParameterSet set, List<String> experiments, int trialCount) {
        if (trialCount < 1) {
            throw new ConfigurationException("Trial count must be at least 1, got " + trialCount);
        }
        if (experiments == null || experiments.isEmpty()) {
            throw new ConfigurationException("At least one experiment is required");
        }
        if (new HashSet<>(experiments).size() != experiments.size()) {
            throw new ConfigurationException("Duplicate experiment names: " + experiments);
        }
        Map<String, ParameterDef> active = new LinkedHashMap<>();
        for (ParameterDef def : set.parameters()) {
            if (!def.active()) {
                continue;
            }
            if (active.put(def.name(), def) != null) {
                throw new ConfigurationException("Duplicate parameter: " + def.name());
            }
        }
        Map<String, DistributionSampler.PreparedDistribution> prepared = new HashMap<>();
        for (ParameterDef def : active.values()) {
            prepared.put(def.name(), sampler.prepare(def.distribution()));
            applier.validate(def);
        }
        List<ParameterDef> order = resolutionOrder(active);
        List<CorrelationGroup> groups = correlationGroups(active);

        Map<String, double[]> percentiles = new HashMap<>();
        Set<String> correlated = new HashSet<>();
        for (CorrelationGroup group : groups) {
            correlated.addAll(group.members());
            assignCorrelatedPercentiles(group, active, experiments, trialCount, set.seed(), percentiles);
        }
        for (ParameterDef def : active.values()) {
            if (!def.distribution().kind().isRandom() || correlated.contains(def.name())) {
                continue;
            }
            for (String experiment : scopes(def, experiments)) {
                String key = CompiledParameters.columnKey(def, experiment);
                percentiles.put(key, LatinHypercube.percentiles(trialCount, generator(set.seed(), key)));
            }
        }

        Map<String, double[]> draws = new LinkedHashMap<>();
        for (ParameterDef def : order) {
            DistributionSampler.PreparedDistribution distribution = prepared.get(def.name());
            for (String experiment : scopes(def, experiments)) {
                String key = CompiledParameters.columnKey(def, experiment);
                double[] pct = percentiles.get(key);
                double[] linkedDraws = def.isLinked()
                        ? draws.get(CompiledParameters.columnKey(active.get(def.linkTarget()), experiment))
                        : null;
                double[] column = new double[trialCount];
                for (int t = 0; t < trialCount; t++) {
                    Map<String, Double> resolved = linkedDraws == null ? Map.of() : Map.of(def.linkTarget(), linkedDraws[t]);
                    column[t] = distribution.draw(new SampleContext(t, pct == null ? NO_PERCENTILE : pct[t], resolved));
                }
                draws.put(key, column);
            }
        }
        logger.debug("Compiled {} parameters x {} trials ({} correlation groups)", order.size(), trialCount, groups.size());
        return new CompiledParameters(order, experiments, trialCount, draws);
    }

    /**
     * Topological order over link edges. Unlinked parameters keep their declaration order.
     */
    List<ParameterDef> resolutionOrder(Map<String, ParameterDef> active) {
        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, Integer> pending = new LinkedHashMap<>();
        for (ParameterDef def : active.values()) {
            pending.put(def.name(), 0);
        }
        for (ParameterDef def : active.values()) {
            if (!def.isLinked()) {
                continue;
            }
            String target = def.linkTarget();
            ParameterDef targetDef = active.get(target);
            if (targetDef == null) {
                throw new ConfigurationException("Parameter '" + def.name() + "' links to unknown or inactive parameter '" + target + "'");
            }
            if (def.mode() == DrawMode.SHARED && targetDef.mode() == DrawMode.INDEPENDENT) {
                throw new ConfigurationException("Shared parameter '" + def.name() + "' cannot link to independent parameter '" + target + "'");
            }
            dependents.computeIfAbsent(target, k -> new ArrayList<>()).add(def.name());
            pending.put(def.name(), 1);
        }
        Deque<String> ready = new ArrayDeque<>();
        pending.forEach((name, count) -> {
            if (count == 0) {
                ready.add(name);
            }
        });
        List<ParameterDef> order = new ArrayList<>(active.size());
        while (!ready.isEmpty()) {
            String name = ready.poll();
            order.add(active.get(name));
            for (String dependent : dependents.getOrDefault(name, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() < active.size()) {
            Set<String> placed = new HashSet<>();
            order.forEach(def -> placed.add(def.name()));
            String start = active.keySet().stream().filter(n -> !placed.contains(n)).findFirst().orElseThrow();
            throw new CyclicLinkException(findCycle(start, active));
        }
        return order;
    }

    private static List<String> findCycle(String start, Map<String, ParameterDef> active) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> seenAt = new HashMap<>();
        String current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            current = active.get(current).linkTarget();
        }
        List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    List<CorrelationGroup> correlationGroups(Map<String, ParameterDef> active) {
        Map<String, Map<String, Double>> edges = new LinkedHashMap<>();
        for (ParameterDef def : active.values()) {
            for (Correlation c : def.correlations()) {
                ParameterDef other = active.get(c.with());
                if (other == null) {
                    throw new ConfigurationException("Parameter '" + def.name() + "' is correlated with unknown or inactive parameter '" + c.with() + "'");
                }
                if (other.name().equals(def.name())) {
                    throw new ConfigurationException("Parameter '" + def.name() + "' cannot be correlated with itself");
                }
                if (other.mode() != def.mode()) {
                    throw new ConfigurationException("Cannot correlate " + def.mode().name().toLowerCase(Locale.ROOT) + " parameter '" + def.name()
                            + "' with " + other.mode().name().toLowerCase(Locale.ROOT) + " parameter '" + other.name() + "'");
                }
                if (!def.distribution().kind().isRandom() || !other.distribution().kind().isRandom()) {
                    throw new ConfigurationException("Only randomly drawn parameters can be correlated: " + def.name() + ", " + other.name());
                }
                Double previous = edges.computeIfAbsent(def.name(), k -> new LinkedHashMap<>()).get(other.name());
                if (previous != null && previous != c.coefficient()) {
                    throw new ConfigurationException("Conflicting correlations between '" + def.name() + "' and '" + other.name() + "'");
                }
                edges.get(def.name()).put(other.name(), c.coefficient());
                edges.computeIfAbsent(other.name(), k -> new LinkedHashMap<>()).put(def.name(), c.coefficient());
            }
        }
        List<CorrelationGroup> groups = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String name : active.keySet()) {
            if (!edges.containsKey(name) || visited.contains(name)) {
                continue;
            }
            Set<String> members = new LinkedHashSet<>();
            Deque<String> frontier = new ArrayDeque<>(List.of(name));
            while (!frontier.isEmpty()) {
                String next = frontier.poll();
                if (visited.add(next)) {
                    members.add(next);
                    frontier.addAll(edges.getOrDefault(next, Map.of()).keySet());
                }
            }
            List<String> ordered = new ArrayList<>(members);
            RealMatrix matrix = MatrixUtils.createRealIdentityMatrix(ordered.size());
            for (int i = 0; i < ordered.size(); i++) {
                for (Map.Entry<String, Double> e : edges.get(ordered.get(i)).entrySet()) {
                    matrix.setEntry(i, ordered.indexOf(e.getKey()), e.getValue());
                }
            }
            groups.add(new CorrelationGroup(ordered, matrix));
        }
        return groups;
    }

    private void assignCorrelatedPercentiles(CorrelationGroup group, Map<String, ParameterDef> active, List<String> experiments,
                                             int trialCount, long seed, Map<String, double[]> out) {
        ParameterDef first = active.get(group.members().get(0));
        for (String experiment : scopes(first, experiments)) {
            String groupKey = "corr|" + String.join(",", group.members()) + "|" + (experiment == null ? "" : experiment);
            int[][] ranks = RankCorrelation.ranks(trialCount, group.matrix(), generator(seed, groupKey));
            for (int col = 0; col < group.members().size(); col++) {
                ParameterDef def = active.get(group.members().get(col));
                String key = CompiledParameters.columnKey(def, experiment);
                double[] strata = LatinHypercube.strata(trialCount, generator(seed, key));
                double[] pct = new double[trialCount];
                for (int row = 0; row < trialCount; row++) {
                    pct[row] = strata[ranks[row][col]];
                }
                out.put(key, pct);
            }
        }
    }

    private static List<String> scopes(ParameterDef def, List<String> experiments) {
        if (def.mode() == DrawMode.SHARED) {
            List<String> shared = new ArrayList<>(1);
            shared.add(null);
            return shared;
        }
        return experiments;
    }

    static RandomGenerator generator(long seed, String columnKey) {
        return new Well19937c(new int[]{(int) (seed >>> 32), (int) seed, columnKey.hashCode(), columnKey.length()});
    }

    record CorrelationGroup(List<String> members, RealMatrix matrix) {
    }
}
