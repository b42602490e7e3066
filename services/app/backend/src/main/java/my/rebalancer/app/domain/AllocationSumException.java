package my.rebalancer.app.domain;

public class AllocationSumException extends PortfolioValidationException {
	public AllocationSumException(String message) {
		super("ALLOCATION_SUM", message);
	}
}
