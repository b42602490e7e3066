package my.rebalancer.app.domain;

public class NegativeCashException extends PortfolioValidationException {
	public NegativeCashException(String message) {
		super("NEGATIVE_CASH", message);
	}
}
