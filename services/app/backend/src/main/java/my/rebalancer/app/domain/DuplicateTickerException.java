package my.rebalancer.app.domain;

public class DuplicateTickerException extends PortfolioValidationException {
	public DuplicateTickerException(String message) {
		super("DUPLICATE_TICKER", message);
	}
}
