package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record OrganizationalUnitSummary(String unitId,
										String unitName,
										OrganizationLevel level,
										String reviewPeriodId,
										int totalStaff,
										BigDecimal totalScore,
										BigDecimal totalPercentage,
										BigDecimal averageScore,
										BigDecimal averagePercentage,
										PerformanceGrade grade,
										Map<PerformanceGrade, Integer> gradeDistribution,
										int totalWorkProducts,
										int workProductsOnTime,
										int workProductsOverdue,
										int total360Feedbacks,
										int completed360Feedbacks,
										int totalCompetencyGaps,
										int closedCompetencyGaps,
										BigDecimal gapClosurePercentage,
										int expectedUnits,
										int coveredUnits,
										boolean partial,
										List<ExcludedUnit> excludedUnits) {
}
