package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.rebalancer.app.domain.TradeAction;

import java.math.BigDecimal;

public record TradeDto(
		@JsonProperty("ticker") String ticker,
		@JsonProperty("action") TradeAction action,
		@JsonProperty("shares") BigDecimal shares,
		@JsonProperty("value") BigDecimal value
) {
}
