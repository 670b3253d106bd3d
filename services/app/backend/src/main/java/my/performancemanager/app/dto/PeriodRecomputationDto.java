package my.performancemanager.app.dto;

import my.performancemanager.app.scoring.ExcludedUnit;

import java.util.List;

public record PeriodRecomputationDto(String reviewPeriodId,
									 int scoredStaff,
									 int storedCompetencyGaps,
									 List<ExcludedUnit> failedStaff) {
}
