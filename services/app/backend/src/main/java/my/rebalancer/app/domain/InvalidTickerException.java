package my.rebalancer.app.domain;

public class InvalidTickerException extends PortfolioValidationException {
	public InvalidTickerException(String message) {
		super("INVALID_TICKER", message);
	}
}
