package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record FeedbackRating(String cycleId, String reviewerId, String competencyId, BigDecimal rating) {
}
