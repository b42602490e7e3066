package my.rebalancer.app.domain;

public class DuplicateHoldingException extends PortfolioValidationException {
	public DuplicateHoldingException(String message) {
		super("DUPLICATE_HOLDING", message);
	}
}
