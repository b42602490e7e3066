package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PositionSummaryDto(
		@JsonProperty("ticker") String ticker,
		@JsonProperty("shares") BigDecimal shares,
		@JsonProperty("price") BigDecimal price,
		@JsonProperty("marketValue") BigDecimal marketValue,
		@JsonProperty("currentWeight") BigDecimal currentWeight,
		@JsonProperty("targetWeight") BigDecimal targetWeight
) {
}
