package my.rebalancer.app.domain;

import my.rebalancer.app.util.Decimals;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Market reference data: a ticker and its current price.
 */
public record Stock(String ticker, BigDecimal price) {
	public Stock {
		ticker = normalizeTicker(ticker);
		price = Decimals.toDecimal(price);
		if (price.signum() < 0) {
			throw new NegativePriceException("Price cannot be negative for " + ticker + ", got " + price.toPlainString());
		}
	}

	public static Stock of(String ticker, Object price) {
		if (price == null) {
			throw new MissingPriceException(ticker == null ? "<unknown>" : ticker.trim().toUpperCase(Locale.ROOT));
		}
		return new Stock(ticker, Decimals.toDecimal(price));
	}

	public static String normalizeTicker(String value) {
		String trimmed = value == null ? "" : value.trim();
		if (trimmed.isEmpty()) {
			throw new InvalidTickerException("Ticker cannot be empty");
		}
		return trimmed.toUpperCase(Locale.ROOT);
	}
}
