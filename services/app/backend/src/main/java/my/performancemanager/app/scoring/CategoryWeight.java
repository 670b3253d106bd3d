package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CategoryWeight(String reviewPeriodId,
							 String categoryId,
							 String reviewTypeId,
							 CategoryType categoryType,
							 BigDecimal weightPercent,
							 BigDecimal maxPoints,
							 Integer maxCount) {
}
