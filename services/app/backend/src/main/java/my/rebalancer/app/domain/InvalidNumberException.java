package my.rebalancer.app.domain;

public class InvalidNumberException extends PortfolioValidationException {
	public InvalidNumberException(String message) {
		super("INVALID_NUMBER", message);
	}

	public InvalidNumberException(String message, Throwable cause) {
		super("INVALID_NUMBER", message, cause);
	}
}
