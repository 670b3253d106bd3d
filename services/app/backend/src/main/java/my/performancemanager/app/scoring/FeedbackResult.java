package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record FeedbackResult(String cycleId,
							 String staffId,
							 String reviewPeriodId,
							 BigDecimal finalScore,
							 BigDecimal maxPoints,
							 BigDecimal percentage,
							 FeedbackCompletion completion,
							 int respondedReviewers,
							 int invitedReviewers) {
}
