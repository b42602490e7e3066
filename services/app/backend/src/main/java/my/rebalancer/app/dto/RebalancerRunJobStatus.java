package my.rebalancer.app.dto;

public enum RebalancerRunJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED
}
