package my.rebalancer.app.service;

import jakarta.annotation.PreDestroy;
import my.rebalancer.app.domain.PortfolioValidationException;
import my.rebalancer.app.dto.RebalanceRequestDto;
import my.rebalancer.app.dto.RebalanceResponseDto;
import my.rebalancer.app.dto.RebalancerRunJobResponseDto;
import my.rebalancer.app.dto.RebalancerRunJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs rebalances in the background so clients can poll for the result.
 */
@Service
public class RebalancerJobService {
	private static final Logger logger = LoggerFactory.getLogger(RebalancerJobService.class);
	private static final Duration JOB_TTL = Duration.ofMinutes(30);
	private static final int MAX_CONCURRENT_JOBS = 2;

	private final RebalanceService rebalanceService;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor = Executors.newFixedThreadPool(MAX_CONCURRENT_JOBS);

	public RebalancerJobService(RebalanceService rebalanceService) {
		this.rebalanceService = rebalanceService;
	}

	public RebalancerRunJobResponseDto start(RebalanceRequestDto request) {
		if (request == null) {
			throw new IllegalArgumentException("Rebalance request is required");
		}
		cleanupExpired();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, request, Instant.now());
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		return toDto(job);
	}

	public RebalancerRunJobResponseDto get(String jobId) {
		cleanupExpired();
		JobState job = jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Rebalancer job not found");
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			job.status = RebalancerRunJobStatus.RUNNING;
			job.result = rebalanceService.rebalance(job.request);
			job.status = RebalancerRunJobStatus.DONE;
		} catch (PortfolioValidationException ex) {
			logger.warn("Rebalancer job rejected input (jobId={}, code={}): {}", job.jobId, ex.getCode(), ex.getMessage());
			job.error = ex.getCode() + ": " + ex.getMessage();
			job.status = RebalancerRunJobStatus.FAILED;
		} catch (Exception ex) {
			job.error = failWithReference(job, ex);
			job.status = RebalancerRunJobStatus.FAILED;
		} finally {
			job.finishedAt = Instant.now();
		}
	}

	private RebalancerRunJobResponseDto toDto(JobState job) {
		return new RebalancerRunJobResponseDto(
				job.jobId,
				job.status,
				job.result,
				job.error
		);
	}

	private void cleanupExpired() {
		Instant now = Instant.now();
		jobs.entrySet().removeIf(entry -> {
			JobState job = entry.getValue();
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			return base.plus(JOB_TTL).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String reference = "RB-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Rebalancer job failed (ref={}, jobId={}, request={}, error={})",
				reference, job.jobId, formatRequest(job.request), ex.getMessage(), ex);
		return "Error ref " + reference;
	}

	private String formatRequest(RebalanceRequestDto request) {
		if (request == null) {
			return "{}";
		}
		int holdings = request.holdings() == null ? 0 : request.holdings().size();
		int tickers = request.allocation() == null ? 0 : request.allocation().size();
		return "{holdings=" + holdings + ", allocation=" + tickers + ", threshold=" + request.threshold() + "}";
	}

	private static final class JobState {
		private final String jobId;
		private final RebalanceRequestDto request;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile RebalancerRunJobStatus status;
		private volatile RebalanceResponseDto result;
		private volatile String error;

		private JobState(String jobId, RebalanceRequestDto request, Instant createdAt) {
			this.jobId = jobId;
			this.request = request;
			this.createdAt = createdAt;
			this.status = RebalancerRunJobStatus.PENDING;
		}
	}
}
