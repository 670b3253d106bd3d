package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.List;

public record StaffPeriodScore(String staffId,
							   String reviewPeriodId,
							   List<CategoryScore> categories,
							   BigDecimal deductedPoints,
							   BigDecimal finalScore,
							   BigDecimal maxPoints,
							   BigDecimal percentage,
							   PerformanceGrade grade,
							   boolean underPerforming) {
}
