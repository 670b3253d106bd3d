package my.performancemanager.app.scoring;

import java.util.List;

public class InconsistentWeightException extends ScoringException {
	private final String reviewPeriodId;
	private final List<String> violations;

	public InconsistentWeightException(String reviewPeriodId, List<String> violations) {
		super("Category weights for review period " + reviewPeriodId + " are inconsistent: "
				+ String.join("; ", violations));
		this.reviewPeriodId = reviewPeriodId;
		this.violations = List.copyOf(violations);
	}

	public String getReviewPeriodId() {
		return reviewPeriodId;
	}

	public List<String> violations() {
		return violations;
	}
}
