package my.rebalancer.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.rebalancer.app.dto.PortfolioSummaryDto;
import my.rebalancer.app.dto.RebalanceRequestDto;
import my.rebalancer.app.dto.RebalanceResponseDto;
import my.rebalancer.app.dto.RebalancerRunJobResponseDto;
import my.rebalancer.app.service.RebalanceService;
import my.rebalancer.app.service.RebalancerJobService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rebalancer")
@Tag(name = "Rebalancer")
public class RebalancerController {
	private final RebalanceService rebalanceService;
	private final RebalancerJobService rebalancerJobService;

	public RebalancerController(RebalanceService rebalanceService,
								RebalancerJobService rebalancerJobService) {
		this.rebalanceService = rebalanceService;
		this.rebalancerJobService = rebalancerJobService;
	}

	@PostMapping("/rebalance")
	@Operation(summary = "Compute the trades that move a portfolio to its target allocation")
	public RebalanceResponseDto rebalance(@Valid @RequestBody RebalanceRequestDto request) {
		return rebalanceService.rebalance(request);
	}

	@PostMapping("/summary")
	@Operation(summary = "Compare current weights with the target allocation")
	public PortfolioSummaryDto summary(@Valid @RequestBody RebalanceRequestDto request) {
		return rebalanceService.summarize(request);
	}

	@PostMapping("/run")
	@Operation(summary = "Start a background rebalance")
	public RebalancerRunJobResponseDto run(@Valid @RequestBody RebalanceRequestDto request) {
		return rebalancerJobService.start(request);
	}

	@GetMapping("/run/{jobId}")
	@Operation(summary = "Poll a background rebalance")
	public RebalancerRunJobResponseDto get(@PathVariable("jobId") String jobId) {
		return rebalancerJobService.get(jobId);
	}
}
