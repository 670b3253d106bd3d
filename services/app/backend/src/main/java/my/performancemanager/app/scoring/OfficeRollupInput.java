package my.performancemanager.app.scoring;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record OfficeRollupInput(OrganizationalUnit office,
								String reviewPeriodId,
								LocalDate periodEndDate,
								List<StaffOutcome> staff,
								List<WorkProductEvaluation> workProducts,
								List<FeedbackResult> feedbackResults,
								List<CompetencyGapRecord> competencyGaps,
								Set<GapClosure> closedGaps) {
	public OfficeRollupInput {
		staff = staff == null ? List.of() : List.copyOf(staff);
		workProducts = workProducts == null ? List.of() : List.copyOf(workProducts);
		feedbackResults = feedbackResults == null ? List.of() : List.copyOf(feedbackResults);
		competencyGaps = competencyGaps == null ? List.of() : List.copyOf(competencyGaps);
		closedGaps = closedGaps == null ? Set.of() : Set.copyOf(closedGaps);
	}
}
