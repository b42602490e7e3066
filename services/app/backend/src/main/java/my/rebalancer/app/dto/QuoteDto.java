package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

@Schema(description = "Price for a ticker that is allocated but not held.")
public record QuoteDto(
		@JsonProperty("ticker") @NotBlank String ticker,
		@JsonProperty("price") @NotNull BigDecimal price
) {
}
