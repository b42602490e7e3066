package my.rebalancer.app.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An order produced by {@link Portfolio#rebalance(BigDecimal)}. {@code value} is the absolute amount moved.
 */
public record Trade(String ticker, TradeAction action, BigDecimal shares, BigDecimal value) {
	public Trade {
		Objects.requireNonNull(ticker, "ticker");
		Objects.requireNonNull(action, "action");
		Objects.requireNonNull(shares, "shares");
		Objects.requireNonNull(value, "value");
		if (shares.signum() <= 0) {
			throw new IllegalArgumentException("Trade shares must be positive for " + ticker + ", got " + shares.toPlainString());
		}
		if (value.signum() < 0) {
			throw new IllegalArgumentException("Trade value cannot be negative for " + ticker + ", got " + value.toPlainString());
		}
	}

	public boolean isSell() {
		return action == TradeAction.SELL;
	}

	public boolean isBuy() {
		return action == TradeAction.BUY;
	}
}
