package my.rebalancer.app.domain;

import my.rebalancer.app.util.Decimals;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holdings, a target {@link Allocation} and idle cash. Immutable; {@link #rebalance(BigDecimal)} has no side effects
 * and returns equal results for equal thresholds.
 */
public final class Portfolio {
	public static final int SHARE_SCALE = 4;
	public static final RoundingMode SHARE_ROUNDING = RoundingMode.HALF_EVEN;
	private static final MathContext WEIGHT_CONTEXT = MathContext.DECIMAL128;
	private static final Comparator<Trade> TRADE_ORDER = Comparator
			.comparing((Trade trade) -> trade.isSell() ? 0 : 1)
			.thenComparing(Trade::ticker);

	private final Map<String, Holding> holdings;
	private final Allocation allocation;
	private final BigDecimal cash;
	private final PriceLookup prices;

	public Portfolio(List<Holding> holdings, Allocation allocation, BigDecimal cash) {
		this(holdings, allocation, cash, PriceLookup.none());
	}

	public Portfolio(List<Holding> holdings, Allocation allocation, BigDecimal cash, PriceLookup prices) {
		this.allocation = Objects.requireNonNull(allocation, "allocation");
		this.holdings = indexHoldings(holdings);
		this.cash = Decimals.toDecimalOrDefault(cash, BigDecimal.ZERO);
		if (this.cash.signum() < 0) {
			throw new NegativeCashException("Cash cannot be negative, got " + this.cash.toPlainString());
		}
		this.prices = prices == null ? PriceLookup.none() : prices;
	}

	private static Map<String, Holding> indexHoldings(List<Holding> holdings) {
		Map<String, Holding> indexed = new LinkedHashMap<>();
		if (holdings == null) {
			return Collections.unmodifiableMap(indexed);
		}
		for (Holding holding : holdings) {
			Objects.requireNonNull(holding, "holding");
			if (indexed.putIfAbsent(holding.ticker(), holding) != null) {
				throw new DuplicateHoldingException("Duplicate holding for ticker: " + holding.ticker());
			}
		}
		return Collections.unmodifiableMap(indexed);
	}

	public List<Holding> holdings() {
		return List.copyOf(holdings.values());
	}

	public Optional<Holding> holding(String ticker) {
		return Optional.ofNullable(holdings.get(Stock.normalizeTicker(ticker)));
	}

	public Allocation allocation() {
		return allocation;
	}

	public BigDecimal cash() {
		return cash;
	}

	public Portfolio withHolding(Holding holding) {
		List<Holding> extended = new ArrayList<>(holdings.values());
		extended.add(holding);
		return new Portfolio(extended, allocation, cash, prices);
	}

	public Portfolio withAllocation(Allocation replacement) {
		return new Portfolio(holdings(), replacement, cash, prices);
	}

	public BigDecimal totalValue() {
		BigDecimal total = cash;
		for (Holding holding : holdings.values()) {
			total = total.add(holding.marketValue());
		}
		return total;
	}

	/**
	 * Share of the total value held in each position; all zero for an empty portfolio.
	 */
	public Map<String, BigDecimal> currentWeights() {
		BigDecimal total = totalValue();
		Map<String, BigDecimal> weights = new LinkedHashMap<>();
		for (Holding holding : holdings.values()) {
			weights.put(holding.ticker(), ratio(holding.marketValue(), total));
		}
		return Collections.unmodifiableMap(weights);
	}

	public BigDecimal cashWeight() {
		return ratio(cash, totalValue());
	}

	/**
	 * Value each allocated ticker would have once the portfolio matches its allocation.
	 */
	public Map<String, BigDecimal> targetValues() {
		BigDecimal total = totalValue();
		Map<String, BigDecimal> targets = new LinkedHashMap<>();
		for (Map.Entry<String, BigDecimal> entry : allocation.weights().entrySet()) {
			targets.put(entry.getKey(), entry.getValue().multiply(total));
		}
		return Collections.unmodifiableMap(targets);
	}

	public RebalanceResult rebalance() {
		return rebalance(BigDecimal.ZERO);
	}

	/**
	 * Computes the trades that move every position to its target value.
	 *
	 * @param threshold minimum absolute value a trade must move; {@code null} means zero
	 * @throws InvalidThresholdException when the threshold is negative
	 * @throws MissingPriceException when an allocated ticker is neither held nor quoted
	 */
	public RebalanceResult rebalance(BigDecimal threshold) {
		BigDecimal minimumTradeValue = threshold == null ? BigDecimal.ZERO : threshold;
		if (minimumTradeValue.signum() < 0) {
			throw new InvalidThresholdException("Threshold cannot be negative, got " + minimumTradeValue.toPlainString());
		}
		List<String> warnings = new ArrayList<>();
		Map<String, Holding> positions = resolvePositions(warnings);

		BigDecimal total = totalValue();
		if (total.signum() == 0) {
			warnings.add("Portfolio has zero total value. Nothing to rebalance.");
			return new RebalanceResult(List.of(), warnings);
		}

		List<Trade> trades = new ArrayList<>();
		for (Holding position : positions.values()) {
			BigDecimal target = allocation.weightOf(position.ticker()).multiply(total);
			if (target.signum() == 0 && position.shares().signum() > 0) {
				// liquidation sells the exact position instead of a rounded quotient
				if (position.marketValue().compareTo(minimumTradeValue) >= 0) {
					trades.add(new Trade(position.ticker(), TradeAction.SELL, position.shares(), position.marketValue()));
				}
				continue;
			}
			BigDecimal delta = target.subtract(position.marketValue());
			if (delta.signum() == 0 || delta.abs().compareTo(minimumTradeValue) < 0) {
				continue;
			}
			sizeTrade(position, delta, warnings).ifPresent(trades::add);
		}
		trades.sort(TRADE_ORDER);
		return new RebalanceResult(trades, warnings);
	}

	private Map<String, Holding> resolvePositions(List<String> warnings) {
		Map<String, Holding> positions = new LinkedHashMap<>(holdings);
		for (Map.Entry<String, BigDecimal> entry : allocation.weights().entrySet()) {
			String ticker = entry.getKey();
			if (positions.containsKey(ticker) || entry.getValue().signum() == 0) {
				continue;
			}
			Stock quote = prices.find(ticker).orElseThrow(() -> new MissingPriceException(ticker));
			warnings.add(ticker + " is in allocation (" + percent(entry.getValue()) + ") but not in holdings. "
					+ "Buying from zero shares at quoted price " + quote.price().toPlainString() + ".");
			positions.put(ticker, new Holding(quote, BigDecimal.ZERO));
		}
		return positions;
	}

	private Optional<Trade> sizeTrade(Holding position, BigDecimal delta, List<String> warnings) {
		String ticker = position.ticker();
		BigDecimal price = position.price();
		if (price.signum() == 0) {
			warnings.add(ticker + " has a price of zero. Cannot size a trade.");
			return Optional.empty();
		}
		BigDecimal value = delta.abs();
		BigDecimal shares = value.divide(price, SHARE_SCALE, SHARE_ROUNDING);
		TradeAction action = delta.signum() > 0 ? TradeAction.BUY : TradeAction.SELL;
		if (action == TradeAction.SELL) {
			// rounding must never sell more than is held
			shares = shares.min(position.shares());
		}
		if (shares.signum() == 0) {
			return Optional.empty();
		}
		return Optional.of(new Trade(ticker, action, shares, value));
	}

	private static BigDecimal ratio(BigDecimal value, BigDecimal total) {
		if (total.signum() == 0) {
			return BigDecimal.ZERO;
		}
		return value.divide(total, WEIGHT_CONTEXT);
	}

	private static String percent(BigDecimal weight) {
		return weight.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
	}
}
