package my.rebalancer.app.domain;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Source of quotes for tickers the portfolio does not hold yet.
 */
@FunctionalInterface
public interface PriceLookup {
	Optional<Stock> find(String ticker);

	static PriceLookup none() {
		return ticker -> Optional.empty();
	}

	static PriceLookup of(Collection<Stock> quotes) {
		if (quotes == null || quotes.isEmpty()) {
			return none();
		}
		Map<String, Stock> byTicker = new LinkedHashMap<>();
		for (Stock quote : quotes) {
			if (quote == null) {
				throw new InvalidTickerException("Quote list cannot contain null entries");
			}
			if (byTicker.putIfAbsent(quote.ticker(), quote) != null) {
				throw new DuplicateTickerException("Duplicate quote for ticker: " + quote.ticker());
			}
		}
		Map<String, Stock> snapshot = Map.copyOf(byTicker);
		return ticker -> Optional.ofNullable(snapshot.get(Stock.normalizeTicker(ticker)));
	}
}
