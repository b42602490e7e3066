package my.rebalancer.app.domain;

public class NegativeSharesException extends PortfolioValidationException {
	public NegativeSharesException(String message) {
		super("NEGATIVE_SHARES", message);
	}
}
