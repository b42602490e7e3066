package my.rebalancer.app.domain;

public class NegativePriceException extends PortfolioValidationException {
	public NegativePriceException(String message) {
		super("NEGATIVE_PRICE", message);
	}
}
