package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.List;

public record FeedbackCycle(String cycleId,
							String staffId,
							String reviewPeriodId,
							String categoryId,
							String reviewTypeId,
							BigDecimal maxPoints,
							BigDecimal ratingScaleMax,
							List<String> invitedReviewerIds) {
	public FeedbackCycle {
		invitedReviewerIds = invitedReviewerIds == null ? List.of() : List.copyOf(invitedReviewerIds);
	}
}
