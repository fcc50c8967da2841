package com.apex.ledger.service.analytics;

import com.apex.ledger.config.AnalyticsProperties;
import com.apex.ledger.exception.RiskComputationException;
import com.apex.ledger.exception.RiskComputationException.Reason;
import com.apex.ledger.model.RiskLevel;
import com.apex.ledger.model.RiskMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Stateless risk and performance analytics over daily simple returns.
 *
 * <p>VaR figures from single series are return quantiles (negative for losses);
 * covariance-based portfolio VaR is a positive loss fraction. Every method that
 * takes a return series rejects samples shorter than the configured minimum, and
 * ratios with a zero denominator are reported as empty rather than zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioRiskCalculator {

    private static final double DEFAULT_CONFIDENCE = 0.95;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final AnalyticsProperties properties;
    private final Clock clock;

    public RiskMetrics calculateRiskMetrics(List<Double> returns) {
        return calculateRiskMetrics(returns, null);
    }

    /**
     * Full metric set for one return series.
     *
     * @param benchmark aligned benchmark returns, or null to skip beta, tracking error and information ratio
     * @throws RiskComputationException on short or malformed input, or a benchmark with zero variance
     */
    public RiskMetrics calculateRiskMetrics(List<Double> returns, List<Double> benchmark) {
        double[] values = requireSample(returns, "Return");
        int days = properties.getTradingDays();
        double annualizer = Math.sqrt(days);

        double mean = ReturnSeries.mean(values);
        double std = ReturnSeries.sampleStd(values);
        double volatility = std * annualizer;
        double excessReturn = mean - properties.getRiskFreeRate() / days;
        OptionalDouble sharpe = ReturnSeries.isZero(std)
                ? OptionalDouble.empty()
                : OptionalDouble.of(excessReturn / std * annualizer);

        double maxDrawdown = ReturnSeries.maxDrawdown(values);
        OptionalDouble calmar = maxDrawdown > 0
                ? OptionalDouble.of(mean * days / maxDrawdown)
                : OptionalDouble.empty();

        double var95 = ReturnSeries.percentile(values, 5);
        double var99 = ReturnSeries.percentile(values, 1);

        double growth = ReturnSeries.growthFactor(values);
        double annualizedReturn = Math.pow(growth, (double) days / values.length) - 1.0;

        RiskMetrics.RiskMetricsBuilder metrics = RiskMetrics.builder()
                .meanReturn(mean)
                .totalReturn(growth - 1.0)
                .annualizedReturn(annualizedReturn)
                .volatility(volatility)
                .sharpeRatio(sharpe)
                .sortinoRatio(sortino(values, excessReturn, annualizer))
                .calmarRatio(calmar)
                .maxDrawdown(maxDrawdown)
                .var95(var95)
                .var99(var99)
                .expectedShortfall95(ReturnSeries.tailMean(values, var95))
                .expectedShortfall99(ReturnSeries.tailMean(values, var99))
                .beta(OptionalDouble.empty())
                .trackingError(OptionalDouble.empty())
                .informationRatio(OptionalDouble.empty())
                .riskLevel(RiskLevel.assess(volatility, maxDrawdown, var95))
                .dataPoints(values.length)
                .confidenceLevel(DEFAULT_CONFIDENCE)
                .calculatedAt(LocalDateTime.now(clock));

        if (benchmark != null) {
            applyBenchmark(metrics, values, ReturnSeries.toArray(benchmark, "Benchmark"), days, annualizer);
        }

        RiskMetrics result = metrics.build();
        log.info("Risk metrics over {} observations: volatility {}, max drawdown {}, VaR95 {}, level {}",
                values.length, round(volatility), round(maxDrawdown), round(var95), result.getRiskLevel());
        return result;
    }

    public double maxDrawdown(List<Double> returns) {
        return ReturnSeries.maxDrawdown(requireSample(returns, "Return"));
    }

    /**
     * Historical-simulation VaR. A horizon above one day sums returns over a
     * rolling window of that length before taking the quantile.
     */
    public VaRResult historicalVar(List<Double> returns, double confidenceLevel, int timeHorizon) {
        double[] values = requireSample(returns, "Return");
        requireConfidence(confidenceLevel);
        requireHorizon(timeHorizon, values.length);

        double[] windowed = ReturnSeries.rollingSum(values, timeHorizon);
        double var = ReturnSeries.percentile(windowed, (1.0 - confidenceLevel) * 100.0);
        return new VaRResult(VaRMethod.HISTORICAL, var, ReturnSeries.tailMean(windowed, var),
                confidenceLevel, timeHorizon, windowed.length);
    }

    /**
     * Variance-covariance VaR and ES assuming normally distributed returns,
     * scaled to the horizon by {@code mean * h} and {@code std * sqrt(h)}.
     */
    public VaRResult parametricVar(List<Double> returns, double confidenceLevel, int timeHorizon) {
        double[] values = requireSample(returns, "Return");
        requireConfidence(confidenceLevel);
        requireHorizon(timeHorizon, values.length);

        double std = ReturnSeries.sampleStd(values);
        if (ReturnSeries.isZero(std)) {
            throw new RiskComputationException(Reason.INVALID_INPUT,
                    "Parametric VaR needs a return series with non-zero variance");
        }
        double alpha = 1.0 - confidenceLevel;
        double z = STANDARD_NORMAL.inverseCumulativeProbability(alpha);
        double mean = ReturnSeries.mean(values) * timeHorizon;
        double scaledStd = std * Math.sqrt(timeHorizon);
        double var = mean + z * scaledStd;
        double expectedShortfall = mean - scaledStd * STANDARD_NORMAL.density(z) / alpha;
        return new VaRResult(VaRMethod.PARAMETRIC, var, expectedShortfall, confidenceLevel, timeHorizon, values.length);
    }

    public VaRResult monteCarloVar(List<Double> returns, double confidenceLevel) {
        AnalyticsProperties.MonteCarlo monteCarlo = properties.getMonteCarlo();
        return monteCarloVar(returns, confidenceLevel, monteCarlo.getSimulations(), monteCarlo.getHorizonDays(),
                monteCarlo.getSeed());
    }

    /**
     * Simulates {@code simulations} paths of {@code timeHorizon} daily returns drawn
     * from N(mean, std) of the sample and takes the quantile of the compounded path
     * returns. The same seed always yields the same result.
     */
    public VaRResult monteCarloVar(List<Double> returns, double confidenceLevel, int simulations, int timeHorizon,
                                   long seed) {
        double[] values = requireSample(returns, "Return");
        requireConfidence(confidenceLevel);
        if (simulations < 1 || timeHorizon < 1) {
            throw new RiskComputationException(Reason.INVALID_INPUT,
                    "Simulations and horizon must be positive: " + simulations + ", " + timeHorizon);
        }
        double mean = ReturnSeries.mean(values);
        double std = ReturnSeries.sampleStd(values);
        RandomGenerator random = new Well19937c(seed);
        NormalDistribution daily = ReturnSeries.isZero(std) ? null : new NormalDistribution(random, mean, std);

        double[] pathReturns = new double[simulations];
        for (int i = 0; i < simulations; i++) {
            double wealth = 1.0;
            for (int day = 0; day < timeHorizon; day++) {
                wealth *= 1.0 + (daily == null ? mean : daily.sample());
            }
            pathReturns[i] = wealth - 1.0;
        }
        double var = ReturnSeries.percentile(pathReturns, (1.0 - confidenceLevel) * 100.0);
        log.debug("Monte Carlo VaR {} over {} paths, horizon {}d, seed {}", round(var), simulations, timeHorizon, seed);
        return new VaRResult(VaRMethod.MONTE_CARLO, var, ReturnSeries.tailMean(pathReturns, var),
                confidenceLevel, timeHorizon, simulations);
    }

    /**
     * Annualized sample covariance of aligned return series, in the map's iteration order.
     */
    public CovarianceMatrix covarianceMatrix(Map<String, List<Double>> returnsBySymbol) {
        double[][] data = alignedColumns(returnsBySymbol);
        RealMatrix covariance = new Covariance(data).getCovarianceMatrix()
                .scalarMultiply(properties.getTradingDays());
        return new CovarianceMatrix(new ArrayList<>(returnsBySymbol.keySet()), covariance);
    }

    public CovarianceMatrix correlationMatrix(Map<String, List<Double>> returnsBySymbol) {
        double[][] data = alignedColumns(returnsBySymbol);
        RealMatrix correlation = new PearsonsCorrelation(data).getCorrelationMatrix();
        for (int i = 0; i < correlation.getRowDimension(); i++) {
            for (int j = 0; j < correlation.getColumnDimension(); j++) {
                if (Double.isNaN(correlation.getEntry(i, j))) {
                    throw new RiskComputationException(Reason.INVALID_INPUT,
                            "Correlation undefined for a series with zero variance");
                }
            }
        }
        return new CovarianceMatrix(new ArrayList<>(returnsBySymbol.keySet()), correlation);
    }

    public PortfolioVarResult portfolioVar(Map<String, Double> weights, CovarianceMatrix covariance) {
        return portfolioVar(weights, covariance, DEFAULT_CONFIDENCE);
    }

    /**
     * Portfolio VaR {@code |z| * sqrt(w' S w)} with marginal VaR {@code |z| * (S w)_i / vol}
     * and component VaR {@code marginal_i * w_i}. Only symbols present in both the
     * weights and the matrix take part.
     *
     * @throws RiskComputationException if the aligned matrix is not symmetric positive
     *                                  semi-definite or the portfolio variance is not positive
     */
    public PortfolioVarResult portfolioVar(Map<String, Double> weights, CovarianceMatrix covariance,
                                           double confidenceLevel) {
        requireConfidence(confidenceLevel);
        if (weights == null || weights.isEmpty() || covariance == null) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "Weights and covariance matrix are required");
        }
        List<String> symbols = new ArrayList<>();
        for (String symbol : covariance.getSymbols()) {
            if (weights.containsKey(symbol)) {
                symbols.add(symbol);
            }
        }
        if (symbols.isEmpty()) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "No symbol in common between weights and covariance");
        }
        if (symbols.size() < weights.size()) {
            log.warn("Weights without covariance data ignored: {}",
                    weights.keySet().stream().filter(symbol -> !symbols.contains(symbol)).toList());
        }

        int n = symbols.size();
        int[] index = symbols.stream().mapToInt(covariance::indexOf).toArray();
        RealMatrix sigma = covariance.toRealMatrix().getSubMatrix(index, index);
        requirePositiveSemiDefinite(sigma);

        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            Double weight = weights.get(symbols.get(i));
            if (weight == null || !Double.isFinite(weight)) {
                throw new RiskComputationException(Reason.INVALID_INPUT, "Invalid weight for " + symbols.get(i));
            }
            w[i] = weight;
        }
        RealVector weightVector = MatrixUtils.createRealVector(w);
        RealVector sigmaW = sigma.operate(weightVector);
        double variance = weightVector.dotProduct(sigmaW);
        if (!(variance > 0)) {
            throw new RiskComputationException(Reason.DEGENERATE_PORTFOLIO,
                    "Portfolio variance is not positive: " + variance);
        }
        double volatility = Math.sqrt(variance);
        double z = Math.abs(STANDARD_NORMAL.inverseCumulativeProbability(1.0 - confidenceLevel));

        Map<String, Double> marginal = new LinkedHashMap<>();
        Map<String, Double> component = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            double marginalVar = z * sigmaW.getEntry(i) / volatility;
            marginal.put(symbols.get(i), marginalVar);
            component.put(symbols.get(i), marginalVar * w[i]);
        }
        return new PortfolioVarResult(confidenceLevel, volatility, z * volatility, Collections.unmodifiableMap(marginal),
                Collections.unmodifiableMap(component));
    }

    public List<StressTestResult> stressTest(List<Double> returns) {
        return stressTest(returns, properties.getStressScenarios());
    }

    /**
     * Scales every return by each scenario's factor and recomputes tail risk on the shocked series.
     */
    public List<StressTestResult> stressTest(List<Double> returns, Map<String, Double> scenarios) {
        double[] values = requireSample(returns, "Return");
        if (scenarios == null || scenarios.isEmpty()) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "At least one stress scenario is required");
        }
        List<StressTestResult> results = new ArrayList<>();
        scenarios.forEach((name, factor) -> {
            if (factor == null || !Double.isFinite(factor)) {
                throw new RiskComputationException(Reason.INVALID_INPUT, "Invalid stress factor for " + name);
            }
            double[] shocked = ReturnSeries.scaled(values, factor);
            double var95 = ReturnSeries.percentile(shocked, 5);
            results.add(new StressTestResult(name, factor, var95,
                    ReturnSeries.percentile(shocked, 1),
                    ReturnSeries.tailMean(shocked, var95),
                    ReturnSeries.maxDrawdown(shocked),
                    ReturnSeries.mean(shocked)));
        });
        return List.copyOf(results);
    }

    /**
     * Risk of one holding given its own return series and its share of the portfolio.
     */
    public PositionRiskResult positionRisk(String symbol, BigDecimal positionValue, List<Double> returns,
                                           BigDecimal portfolioValue) {
        double[] values = requireSample(returns, symbol + " return");
        if (positionValue == null || portfolioValue == null || portfolioValue.signum() <= 0) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "Portfolio value must be positive");
        }
        double weight = positionValue.divide(portfolioValue, 10, RoundingMode.HALF_UP).doubleValue();
        double volatility = ReturnSeries.sampleStd(values) * Math.sqrt(properties.getTradingDays());
        return new PositionRiskResult(symbol, weight, volatility,
                ReturnSeries.percentile(values, 5),
                ReturnSeries.percentile(values, 1),
                volatility * weight,
                volatility * Math.abs(weight));
    }

    public RiskBudgetResult riskBudget(Map<String, Double> weights, RiskBudgetLimits limits) {
        if (weights == null || weights.isEmpty() || limits == null) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "Weights and limits are required");
        }
        Map<String, Double> violations = new LinkedHashMap<>();
        double concentration = Double.NEGATIVE_INFINITY;
        double leverage = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double weight = entry.getValue();
            if (weight > limits.maxPositionSize()) {
                violations.put(entry.getKey(), weight);
            }
            concentration = Math.max(concentration, weight);
            leverage += Math.abs(weight);
        }
        return new RiskBudgetResult(Map.copyOf(violations), concentration, concentration > limits.maxConcentration(),
                leverage, leverage > limits.maxLeverage());
    }

    private void applyBenchmark(RiskMetrics.RiskMetricsBuilder metrics, double[] values, double[] benchmark,
                                int days, double annualizer) {
        if (benchmark.length != values.length) {
            throw new RiskComputationException(Reason.INVALID_INPUT,
                    "Benchmark has " + benchmark.length + " observations, returns have " + values.length);
        }
        double benchmarkStd = ReturnSeries.sampleStd(benchmark);
        if (ReturnSeries.isZero(benchmarkStd)) {
            throw new RiskComputationException(Reason.DEGENERATE_BENCHMARK, "Benchmark returns have zero variance");
        }
        double beta = ReturnSeries.sampleCovariance(values, benchmark) / (benchmarkStd * benchmarkStd);

        double[] active = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            active[i] = values[i] - benchmark[i];
        }
        double activeStd = ReturnSeries.sampleStd(active);
        double trackingError = activeStd * annualizer;
        metrics.beta(OptionalDouble.of(beta))
                .trackingError(OptionalDouble.of(trackingError))
                .informationRatio(ReturnSeries.isZero(activeStd)
                        ? OptionalDouble.empty()
                        : OptionalDouble.of(ReturnSeries.mean(active) * days / trackingError));
    }

    // Daily excess return over the annualized deviation of the negative returns
    private OptionalDouble sortino(double[] values, double excessReturn, double annualizer) {
        double[] downside = Arrays.stream(values).filter(value -> value < 0).toArray();
        double downsideStd = ReturnSeries.sampleStd(downside);
        if (ReturnSeries.isZero(downsideStd)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(excessReturn / (downsideStd * annualizer));
    }

    private double[][] alignedColumns(Map<String, List<Double>> returnsBySymbol) {
        if (returnsBySymbol == null || returnsBySymbol.size() < 2) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "At least two return series are required");
        }
        List<double[]> columns = new ArrayList<>();
        int length = -1;
        for (Map.Entry<String, List<Double>> entry : returnsBySymbol.entrySet()) {
            double[] column = requireSample(entry.getValue(), entry.getKey() + " return");
            if (length >= 0 && column.length != length) {
                throw new RiskComputationException(Reason.INVALID_INPUT,
                        "Return series are not aligned: " + entry.getKey() + " has " + column.length
                                + " observations, expected " + length);
            }
            length = column.length;
            columns.add(column);
        }
        double[][] data = new double[length][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < length; i++) {
                data[i][j] = column[i];
            }
        }
        return data;
    }

    private void requirePositiveSemiDefinite(RealMatrix sigma) {
        if (!MatrixUtils.isSymmetric(sigma, 1e-10)) {
            throw new RiskComputationException(Reason.NON_POSITIVE_DEFINITE_COVARIANCE, "Covariance matrix is not symmetric");
        }
        double[] eigenvalues = new EigenDecomposition(sigma).getRealEigenvalues();
        double scale = 0.0;
        for (double eigenvalue : eigenvalues) {
            scale = Math.max(scale, Math.abs(eigenvalue));
        }
        for (double eigenvalue : eigenvalues) {
            if (eigenvalue < -1e-10 * Math.max(scale, 1.0)) {
                throw new RiskComputationException(Reason.NON_POSITIVE_DEFINITE_COVARIANCE,
                        "Covariance matrix has a negative eigenvalue: " + eigenvalue);
            }
        }
    }

    private double[] requireSample(List<Double> returns, String label) {
        double[] values = ReturnSeries.toArray(returns, label);
        if (values.length < properties.getMinObservations()) {
            throw new RiskComputationException(Reason.INSUFFICIENT_DATA,
                    label + " series has " + values.length + " observations, minimum is " + properties.getMinObservations());
        }
        return values;
    }

    private void requireConfidence(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new RiskComputationException(Reason.INVALID_INPUT, "Confidence level must be in (0, 1): " + confidenceLevel);
        }
    }

    private void requireHorizon(int timeHorizon, int observations) {
        if (timeHorizon < 1 || timeHorizon > observations) {
            throw new RiskComputationException(Reason.INVALID_INPUT,
                    "Horizon must be between 1 and " + observations + " days: " + timeHorizon);
        }
    }

    private static String round(double value) {
        return String.format("%.4f", value);
    }
}
