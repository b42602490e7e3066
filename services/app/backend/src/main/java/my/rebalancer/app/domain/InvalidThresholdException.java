package my.rebalancer.app.domain;

public class InvalidThresholdException extends PortfolioValidationException {
	public InvalidThresholdException(String message) {
		super("INVALID_THRESHOLD", message);
	}
}
