package my.performancemanager.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Scoring scoring
) {
	public record Scoring(
			@NotNull @DecimalMin("0.0") BigDecimal weightTolerance,
			@Min(1) int parallelism,
			@Min(1) int maxConcurrentJobs,
			@Min(1) int jobTtlMinutes,
			@NotBlank String systemUser
	) {
	}
}
