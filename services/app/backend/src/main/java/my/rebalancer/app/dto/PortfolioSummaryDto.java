package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Schema(description = "Current weights next to target weights, plus the value each target implies.")
public record PortfolioSummaryDto(
		@JsonProperty("totalValue") BigDecimal totalValue,
		@JsonProperty("cash") BigDecimal cash,
		@JsonProperty("cashWeight") BigDecimal cashWeight,
		@JsonProperty("positions") List<PositionSummaryDto> positions,
		@JsonProperty("targets") Map<String, BigDecimal> targets
) {
}
