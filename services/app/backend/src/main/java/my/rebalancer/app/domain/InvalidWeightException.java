package my.rebalancer.app.domain;

public class InvalidWeightException extends PortfolioValidationException {
	public InvalidWeightException(String message) {
		super("INVALID_WEIGHT", message);
	}
}
