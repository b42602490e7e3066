package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Schema(description = "Portfolio snapshot and target allocation to rebalance.")
public record RebalanceRequestDto(
		@Schema(description = "Current holdings.")
		@JsonProperty("holdings") @Valid List<HoldingRequestDto> holdings,
		@Schema(description = "Target weight per ticker, summing to 1.")
		@JsonProperty("allocation") @NotEmpty Map<String, BigDecimal> allocation,
		@Schema(description = "Idle cash to deploy.")
		@JsonProperty("cash") BigDecimal cash,
		@Schema(description = "Prices for allocated tickers without a holding.")
		@JsonProperty("quotes") @Valid List<QuoteDto> quotes,
		@Schema(description = "Minimum trade value. Defaults to the configured threshold.")
		@JsonProperty("threshold") BigDecimal threshold
) {
}
