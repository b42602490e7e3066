package my.rebalancer.app.domain;

/**
 * Base type for rejected portfolio input. The {@link #getCode()} value is stable and safe to expose to API clients.
 */
public abstract class PortfolioValidationException extends IllegalArgumentException {
	private final String code;

	protected PortfolioValidationException(String code, String message) {
		super(message);
		this.code = code;
	}

	protected PortfolioValidationException(String code, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
