package my.rebalancer.app.domain;

public class MissingPriceException extends PortfolioValidationException {
	private final String ticker;

	public MissingPriceException(String ticker) {
		super("MISSING_PRICE", "No price available for " + ticker + ". Supply a quote or a zero-share holding.");
		this.ticker = ticker;
	}

	public String getTicker() {
		return ticker;
	}
}
