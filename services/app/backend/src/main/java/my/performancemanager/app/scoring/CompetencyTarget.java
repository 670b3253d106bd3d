package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CompetencyTarget(String staffId,
							   String competencyId,
							   String competencyName,
							   String categoryId,
							   String categoryName,
							   BigDecimal expectedRatingValue) {
}
