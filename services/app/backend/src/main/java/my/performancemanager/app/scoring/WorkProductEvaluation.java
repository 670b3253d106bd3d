package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.time.LocalDate;

public record WorkProductEvaluation(String workProductId,
									String staffId,
									String reviewPeriodId,
									String categoryId,
									String reviewTypeId,
									BigDecimal timeliness,
									BigDecimal quality,
									BigDecimal output,
									LocalDate dueDate,
									LocalDate completionDate,
									boolean completed,
									boolean eligible) {

	public BigDecimal outcome() {
		return ScoreMath.safe(timeliness).add(ScoreMath.safe(quality)).add(ScoreMath.safe(output));
	}

	public ContributionRecord toContribution() {
		return new ContributionRecord(workProductId, staffId, reviewPeriodId, categoryId, reviewTypeId, outcome(), eligible);
	}

	public ScheduleStatus scheduleStatus(LocalDate periodEnd) {
		if (completed && completionDate != null) {
			if (dueDate == null || !completionDate.isAfter(dueDate)) {
				return ScheduleStatus.ON_TIME;
			}
			return ScheduleStatus.OVERDUE;
		}
		if (dueDate != null && periodEnd != null && dueDate.isBefore(periodEnd)) {
			return ScheduleStatus.OVERDUE;
		}
		return ScheduleStatus.OPEN;
	}

	public enum ScheduleStatus {
		ON_TIME,
		OVERDUE,
		OPEN
	}
}
