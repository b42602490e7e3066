package my.rebalancer.app.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Security security,
		Rebalancer rebalancer
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Rebalancer(
			@DecimalMin("0") BigDecimal defaultThreshold,
			@DecimalMin("0") BigDecimal allocationTolerance
	) {
	}
}
