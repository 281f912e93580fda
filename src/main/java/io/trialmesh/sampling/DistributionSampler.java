package io.trialmesh.sampling;

import org.apache.commons.math3.distribution.IntegerDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.TriangularDistribution;
import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Produces one scalar draw per trial from a {@link DistributionSpec}.
 *
 * <p>Random kinds invert their marginal CDF at {@link SampleContext#percentile()}, so the caller
 * controls stratification and rank correlation. Grid and sequence depend only on the trial
 * number; linked copies another parameter's draw from {@link SampleContext#resolved()}.
 *
 * <p>The argument set picks the form: {@code uniform{factor}} and {@code uniform{min,max}} are
 * different distributions.
 */
public final class DistributionSampler {
    private static final double P_EPSILON = 1e-12;
    private static final double Z_95 = 1.96;

    private static final Set<String> MIN_MAX = Set.of("min", "max");
    private static final Set<String> FACTOR = Set.of("factor");
    private static final Set<String> RANGE = Set.of("range");
    private static final Set<String> LOGFACTOR = Set.of("logfactor");

    public double sample(DistributionSpec spec, SampleContext context) {
        return prepare(spec).draw(context);
    }

    /**
     * Validates the distribution and returns a reusable drawer. Invalid arguments fail here, before any
     * trial is drawn.
     */
    public PreparedDistribution prepare(DistributionSpec spec) {
        if (spec == null) {
            throw new DistributionSpecException("Distribution spec must not be null");
        }
        try {
            return switch (spec.kind()) {
                case CONSTANT -> constant(spec);
                case UNIFORM -> uniform(spec);
                case LOGUNIFORM -> logUniform(spec);
                case NORMAL -> normal(spec);
                case LOGNORMAL -> logNormal(spec);
                case TRIANGLE -> triangle(spec);
                case INTEGERS -> integers(spec);
                case GRID -> grid(spec);
                case SEQUENCE -> sequence(spec);
                case BINARY -> binary(spec);
                case LINKED -> linked(spec);
            };
        } catch (MathIllegalArgumentException e) {
            throw new DistributionSpecException("Invalid " + name(spec) + " arguments " + spec.args() + ": " + e.getMessage(), e);
        }
    }

    private PreparedDistribution constant(DistributionSpec spec) {
        requireArgs(spec, Set.of("value"));
        double value = spec.number("value");
        return ctx -> value;
    }

    private PreparedDistribution uniform(DistributionSpec spec) {
        Set<String> names = spec.argNames();
        if (names.equals(MIN_MAX)) {
            return real(new UniformRealDistribution(spec.number("min"), spec.number("max")));
        }
        if (names.equals(FACTOR)) {
            double factor = factor(spec, "factor");
            return real(new UniformRealDistribution(1.0 / factor, factor));
        }
        if (names.equals(RANGE)) {
            double range = range(spec);
            return real(new UniformRealDistribution(1.0 - range, 1.0 + range));
        }
        throw unsupported(spec, "{min,max}, {factor}, {range}");
    }

    private PreparedDistribution logUniform(DistributionSpec spec) {
        requireArgs(spec, FACTOR);
        double logFactor = Math.log(factor(spec, "factor"));
        RealDistribution inLogSpace = new UniformRealDistribution(-logFactor, logFactor);
        return ctx -> Math.exp(inLogSpace.inverseCumulativeProbability(clampPercentile(ctx.percentile())));
    }

    private PreparedDistribution normal(DistributionSpec spec) {
        Set<String> names = spec.argNames();
        String stdevArg;
        if (names.equals(Set.of("mean", "stdev"))) {
            stdevArg = "stdev";
        } else if (names.equals(Set.of("mean", "std"))) {
            stdevArg = "std";
        } else {
            throw unsupported(spec, "{mean,stdev}");
        }
        return real(new NormalDistribution(spec.number("mean"), spec.number(stdevArg)));
    }

    private PreparedDistribution logNormal(DistributionSpec spec) {
        Set<String> names = spec.argNames();
        double mu;
        double sigma;
        if (names.equals(Set.of("log_mean", "log_stdev"))) {
            mu = spec.number("log_mean");
            sigma = spec.number("log_stdev");
        } else if (names.equals(Set.of("norm_mean", "norm_stdev"))) {
            double mean = spec.number("norm_mean");
            double stdev = spec.number("norm_stdev");
            if (mean <= 0.0 || stdev <= 0.0) {
                throw new DistributionSpecException("lognormal norm_mean and norm_stdev must be positive: " + spec.args());
            }
            double variance = stdev * stdev;
            double meanSq = mean * mean;
            mu = Math.log(meanSq / Math.sqrt(variance + meanSq));
            sigma = Math.sqrt(Math.log(variance / meanSq + 1.0));
        } else if (names.equals(Set.of("low95", "high95"))) {
            double[] params = fromInterval(spec.number("low95"), spec.number("high95"));
            mu = params[0];
            sigma = params[1];
        } else if (names.equals(FACTOR)) {
            double factor = factor(spec, "factor");
            double[] params = fromInterval(1.0 / factor, factor);
            mu = params[0];
            sigma = params[1];
        } else {
            throw unsupported(spec, "{log_mean,log_stdev}, {norm_mean,norm_stdev}, {low95,high95}, {factor}");
        }
        if (!(sigma > 0.0)) {
            throw new DistributionSpecException("lognormal log-space stdev must be positive: " + spec.args());
        }
        return real(new LogNormalDistribution(mu, sigma));
    }

    private PreparedDistribution triangle(DistributionSpec spec) {
        Set<String> names = spec.argNames();
        if (names.equals(Set.of("min", "max", "mode"))) {
            double min = spec.number("min");
            double max = spec.number("max");
            if (min > max) {
                double swap = min;
                min = max;
                max = swap;
            }
            return real(new TriangularDistribution(min, spec.number("mode"), max));
        }
        if (names.equals(FACTOR)) {
            double factor = factor(spec, "factor");
            return real(new TriangularDistribution(1.0 / factor, 1.0, factor));
        }
        if (names.equals(RANGE)) {
            double range = range(spec);
            return real(new TriangularDistribution(1.0 - range, 1.0, 1.0 + range));
        }
        if (names.equals(LOGFACTOR)) {
            double logFactor = factor(spec, "logfactor");
            return real(new TriangularDistribution(1.0 / logFactor, 1.0, logFactor));
        }
        throw unsupported(spec, "{min,max,mode}, {factor}, {range}, {logfactor}");
    }

    private PreparedDistribution integers(DistributionSpec spec) {
        requireArgs(spec, MIN_MAX);
        int min = wholeNumber(spec, "min");
        int max = wholeNumber(spec, "max");
        IntegerDistribution distribution = new UniformIntegerDistribution(min, max);
        return ctx -> distribution.inverseCumulativeProbability(clampPercentile(ctx.percentile()));
    }

    private PreparedDistribution grid(DistributionSpec spec) {
        requireArgs(spec, Set.of("min", "max", "count"));
        double min = spec.number("min");
        double max = spec.number("max");
        int count = wholeNumber(spec, "count");
        if (count < 1) {
            throw new DistributionSpecException("grid count must be at least 1: " + spec.args());
        }
        if (count == 1) {
            return ctx -> min;
        }
        double step = (max - min) / (count - 1);
        return ctx -> min + Math.floorMod(ctx.trialNum(), count) * step;
    }

    private PreparedDistribution sequence(DistributionSpec spec) {
        requireArgs(spec, Set.of("values"));
        List<Double> values = List.copyOf(spec.values());
        return ctx -> values.get(Math.floorMod(ctx.trialNum(), values.size()));
    }

    private PreparedDistribution binary(DistributionSpec spec) {
        requireArgs(spec, Set.of());
        return ctx -> ctx.percentile() < 0.5 ? 0.0 : 1.0;
    }

    private PreparedDistribution linked(DistributionSpec spec) {
        requireArgs(spec, Set.of("parameter"));
        String target = spec.linkedParameter();
        return ctx -> {
            Double value = ctx.resolved().get(target);
            if (value == null) {
                throw new IllegalStateException("Linked parameter '" + target + "' has no draw for trial " + ctx.trialNum());
            }
            return value;
        };
    }

    private static PreparedDistribution real(RealDistribution distribution) {
        return ctx -> distribution.inverseCumulativeProbability(clampPercentile(ctx.percentile()));
    }

    private static double[] fromInterval(double low, double high) {
        if (!(low > 0.0) || !(high > low)) {
            throw new DistributionSpecException("95% interval needs 0 < low95 < high95, got [" + low + ", " + high + "]");
        }
        double logLow = Math.log(low);
        double logHigh = Math.log(high);
        double mu = (logLow + logHigh) / 2.0;
        return new double[]{mu, (logHigh - mu) / Z_95};
    }

    private static double factor(DistributionSpec spec, String arg) {
        double factor = spec.number(arg);
        if (!(factor > 1.0)) {
            throw new DistributionSpecException(name(spec) + " " + arg + " must be greater than 1, got " + factor);
        }
        return factor;
    }

    private static double range(DistributionSpec spec) {
        double range = spec.number("range");
        if (!(range > 0.0)) {
            throw new DistributionSpecException(name(spec) + " range must be positive, got " + range);
        }
        return range;
    }

    private static int wholeNumber(DistributionSpec spec, String arg) {
        double value = spec.number(arg);
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new DistributionSpecException(name(spec) + " " + arg + " must be an integer, got " + value);
        }
        return (int) value;
    }

    private static void requireArgs(DistributionSpec spec, Set<String> expected) {
        if (!spec.argNames().equals(expected)) {
            throw unsupported(spec, expected.isEmpty() ? "no arguments" : expected.toString());
        }
    }

    private static DistributionSpecException unsupported(DistributionSpec spec, String expected) {
        return new DistributionSpecException(
                "Unsupported arguments for " + name(spec) + ": " + spec.argNames() + " (expected " + expected + ")"
        );
    }

    private static String name(DistributionSpec spec) {
        return spec.kind().name().toLowerCase(Locale.ROOT);
    }

    static double clampPercentile(double p) {
        if (Double.isNaN(p)) {
            throw new IllegalArgumentException("percentile must not be NaN");
        }
        return Math.min(1.0 - P_EPSILON, Math.max(P_EPSILON, p));
    }

    /**
     * A validated distribution ready to draw.
     */
    @FunctionalInterface
    public interface PreparedDistribution {
        double draw(SampleContext context);
    }
}
