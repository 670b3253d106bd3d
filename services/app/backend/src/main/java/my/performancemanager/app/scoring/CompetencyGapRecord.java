package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CompetencyGapRecord(String staffId,
								  String competencyId,
								  String reviewPeriodId,
								  String categoryId,
								  BigDecimal expectedRatingValue,
								  BigDecimal averageActualRatingValue,
								  BigDecimal gap,
								  boolean haveGap) {
}
