package my.rebalancer.app.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Trades and warnings from one rebalance. Totals are derived from the trades when the result is built.
 */
public final class RebalanceResult {
	private final List<Trade> trades;
	private final List<String> warnings;
	private final BigDecimal totalBuyValue;
	private final BigDecimal totalSellValue;

	public RebalanceResult(List<Trade> trades, List<String> warnings) {
		this.trades = trades == null ? List.of() : List.copyOf(trades);
		this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
		this.totalBuyValue = sum(this.trades, TradeAction.BUY);
		this.totalSellValue = sum(this.trades, TradeAction.SELL);
	}

	public List<Trade> trades() {
		return trades;
	}

	public List<Trade> trades(TradeAction action) {
		return trades.stream()
				.filter(trade -> trade.action() == action)
				.toList();
	}

	public List<String> warnings() {
		return warnings;
	}

	public BigDecimal totalBuyValue() {
		return totalBuyValue;
	}

	public BigDecimal totalSellValue() {
		return totalSellValue;
	}

	/**
	 * Positive when the trades release cash, negative when they consume it.
	 */
	public BigDecimal netCashFlow() {
		return totalSellValue.subtract(totalBuyValue);
	}

	public boolean isBalanced() {
		return trades.isEmpty();
	}

	private static BigDecimal sum(List<Trade> trades, TradeAction action) {
		BigDecimal total = BigDecimal.ZERO;
		for (Trade trade : trades) {
			if (trade.action() == action) {
				total = total.add(trade.value());
			}
		}
		return total;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof RebalanceResult result)) {
			return false;
		}
		return trades.equals(result.trades) && warnings.equals(result.warnings);
	}

	@Override
	public int hashCode() {
		return Objects.hash(trades, warnings);
	}

	@Override
	public String toString() {
		if (isBalanced()) {
			return "RebalanceResult(balanced, no trades needed)";
		}
		return "RebalanceResult(" + trades.size() + " trades, buy=" + totalBuyValue.toPlainString()
				+ ", sell=" + totalSellValue.toPlainString() + ", net=" + netCashFlow().toPlainString() + ")";
	}
}
