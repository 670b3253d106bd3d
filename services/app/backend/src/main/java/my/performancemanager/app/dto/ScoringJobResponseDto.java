package my.performancemanager.app.dto;

public record ScoringJobResponseDto(String jobId,
									String reviewPeriodId,
									ScoringJobStatus status,
									PeriodRecomputationDto result,
									String error) {
}
