package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.List;

@Schema(description = "Trades needed to reach the target allocation, sells first.")
public record RebalanceResponseDto(
		@JsonProperty("trades") List<TradeDto> trades,
		@JsonProperty("warnings") List<String> warnings,
		@JsonProperty("totalBuyValue") BigDecimal totalBuyValue,
		@JsonProperty("totalSellValue") BigDecimal totalSellValue,
		@Schema(description = "Sell value minus buy value. Negative when cash is deployed.")
		@JsonProperty("netCashFlow") BigDecimal netCashFlow,
		@JsonProperty("balanced") boolean balanced
) {
}
