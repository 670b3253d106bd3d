package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CompetencyRating(String staffId,
							   String competencyId,
							   String reviewTypeId,
							   String reviewerId,
							   BigDecimal ratingValue) {
}
