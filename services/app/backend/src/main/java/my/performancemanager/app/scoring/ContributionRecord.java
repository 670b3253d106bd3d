package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record ContributionRecord(String recordId,
								 String staffId,
								 String reviewPeriodId,
								 String categoryId,
								 String reviewTypeId,
								 BigDecimal points,
								 boolean eligible) {
}
