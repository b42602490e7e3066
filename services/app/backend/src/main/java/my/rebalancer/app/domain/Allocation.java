package my.rebalancer.app.domain;

import my.rebalancer.app.util.Decimals;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Target weights per ticker. Instances are always valid: tickers are unique after upper-casing,
 * every weight lies in [0, 1] and the weights sum to one within {@link #DEFAULT_SUM_TOLERANCE}
 * (or the tolerance given to {@link #of(Map, BigDecimal)}).
 */
public final class Allocation {
	public static final BigDecimal DEFAULT_SUM_TOLERANCE = new BigDecimal("1E-9");

	private final Map<String, BigDecimal> weights;

	private Allocation(Map<String, BigDecimal> weights) {
		this.weights = Collections.unmodifiableMap(weights);
	}

	public static Allocation of(Map<String, ?> weights) {
		return of(weights, DEFAULT_SUM_TOLERANCE);
	}

	public static Allocation of(Map<String, ?> weights, BigDecimal tolerance) {
		Objects.requireNonNull(weights, "weights");
		BigDecimal resolvedTolerance = tolerance == null ? DEFAULT_SUM_TOLERANCE : tolerance.abs();
		Map<String, BigDecimal> normalized = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : weights.entrySet()) {
			String ticker = Stock.normalizeTicker(entry.getKey());
			if (normalized.containsKey(ticker)) {
				throw new DuplicateTickerException("Duplicate ticker in allocation: " + ticker);
			}
			if (entry.getValue() == null) {
				throw new InvalidWeightException("Allocation for " + ticker + " has no weight");
			}
			normalized.put(ticker, Decimals.toDecimal(entry.getValue()));
		}
		for (Map.Entry<String, BigDecimal> entry : normalized.entrySet()) {
			BigDecimal weight = entry.getValue();
			if (weight.signum() < 0 || weight.compareTo(BigDecimal.ONE) > 0) {
				throw new InvalidWeightException("Allocation for " + entry.getKey()
						+ " must be between 0 and 1, got " + weight.toPlainString());
			}
		}
		BigDecimal total = normalized.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
		if (total.subtract(BigDecimal.ONE).abs().compareTo(resolvedTolerance) > 0) {
			throw new AllocationSumException("Allocation must sum to 1, got " + total.toPlainString());
		}
		return new Allocation(normalized);
	}

	public BigDecimal weightOf(String ticker) {
		return weights.getOrDefault(Stock.normalizeTicker(ticker), BigDecimal.ZERO);
	}

	public boolean contains(String ticker) {
		return weights.containsKey(Stock.normalizeTicker(ticker));
	}

	public Set<String> tickers() {
		return weights.keySet();
	}

	public Map<String, BigDecimal> weights() {
		return weights;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Allocation allocation)) {
			return false;
		}
		if (!weights.keySet().equals(allocation.weights.keySet())) {
			return false;
		}
		for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
			if (entry.getValue().compareTo(allocation.weights.get(entry.getKey())) != 0) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		// scale-insensitive to stay consistent with equals
		int hash = 0;
		for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
			hash += entry.getKey().hashCode() ^ entry.getValue().stripTrailingZeros().hashCode();
		}
		return hash;
	}

	@Override
	public String toString() {
		return "Allocation" + weights;
	}
}
