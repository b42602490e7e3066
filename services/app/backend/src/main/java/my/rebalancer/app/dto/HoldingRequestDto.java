package my.rebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

@Schema(description = "Current position in one stock.")
public record HoldingRequestDto(
		@JsonProperty("ticker") @NotBlank String ticker,
		@JsonProperty("price") @NotNull BigDecimal price,
		@JsonProperty("shares") @NotNull BigDecimal shares
) {
}
