package my.rebalancer.app.domain;

import my.rebalancer.app.util.Decimals;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A position in one stock. Fractional share counts are allowed.
 */
public record Holding(Stock stock, BigDecimal shares) {
	public Holding {
		Objects.requireNonNull(stock, "stock");
		shares = Decimals.toDecimal(shares);
		if (shares.signum() < 0) {
			throw new NegativeSharesException("Shares cannot be negative for " + stock.ticker() + ", got " + shares.toPlainString());
		}
	}

	public static Holding of(String ticker, Object price, Object shares) {
		return new Holding(Stock.of(ticker, price), Decimals.toDecimal(shares));
	}

	public String ticker() {
		return stock.ticker();
	}

	public BigDecimal price() {
		return stock.price();
	}

	public BigDecimal marketValue() {
		return shares.multiply(stock.price());
	}
}
