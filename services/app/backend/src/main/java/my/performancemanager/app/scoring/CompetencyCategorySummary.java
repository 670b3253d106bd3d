package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CompetencyCategorySummary(String categoryId,
										String categoryName,
										int staffCount,
										int competencyCount,
										BigDecimal averageActual,
										BigDecimal averageExpected,
										BigDecimal highestRating,
										BigDecimal lowestRating,
										BigDecimal mostFrequentRating) {
}
