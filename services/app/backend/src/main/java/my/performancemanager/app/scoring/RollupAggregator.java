package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class RollupAggregator {
	private final GradeClassifier gradeClassifier;

	public RollupAggregator(GradeClassifier gradeClassifier) {
		this.gradeClassifier = gradeClassifier;
	}

	public OrganizationalUnitSummary summarizeOffice(OfficeRollupInput input) {
		Objects.requireNonNull(input, "input");
		OrganizationalUnit office = input.office();
		if (office == null || office.level() != OrganizationLevel.OFFICE) {
			throw new IllegalArgumentException("Office roll-up requires an office unit");
		}
		Totals totals = new Totals();
		Set<String> included = new HashSet<>();
		for (StaffOutcome outcome : input.staff()) {
			if (!outcome.succeeded()) {
				totals.exclude(outcome.staffId(), outcome.failure());
				continue;
			}
			StaffPeriodScore score = outcome.score();
			included.add(outcome.staffId());
			totals.covered++;
			totals.staff++;
			totals.score = totals.score.add(ScoreMath.safe(score.finalScore()));
			totals.percentage = totals.percentage.add(ScoreMath.safe(score.percentage()));
			totals.grades.merge(score.grade(), 1, Integer::sum);
		}

		for (WorkProductEvaluation workProduct : input.workProducts()) {
			if (!included.contains(workProduct.staffId())) {
				continue;
			}
			totals.workProducts++;
			switch (workProduct.scheduleStatus(input.periodEndDate())) {
				case ON_TIME -> totals.onTime++;
				case OVERDUE -> totals.overdue++;
				default -> {
				}
			}
		}
		for (FeedbackResult feedback : input.feedbackResults()) {
			if (!included.contains(feedback.staffId())) {
				continue;
			}
			totals.feedbacks++;
			if (feedback.completion() == FeedbackCompletion.COMPLETE) {
				totals.completedFeedbacks++;
			}
		}
		for (CompetencyGapRecord gap : input.competencyGaps()) {
			if (!gap.haveGap() || !included.contains(gap.staffId())) {
				continue;
			}
			totals.gaps++;
			if (input.closedGaps().contains(new GapClosure(gap.staffId(), gap.competencyId()))) {
				totals.closedGaps++;
			}
		}
		return totals.toSummary(office, input.reviewPeriodId(), input.staff().size());
	}

	public OrganizationalUnitSummary summarizeParent(OrganizationalUnit unit,
													 String reviewPeriodId,
													 List<UnitOutcome> children) {
		Objects.requireNonNull(unit, "unit");
		if (unit.level() == OrganizationLevel.OFFICE) {
			throw new IllegalArgumentException("Offices are summarized from staff scores");
		}
		List<UnitOutcome> outcomes = children == null ? List.of() : children;
		Totals totals = new Totals();
		for (UnitOutcome outcome : outcomes) {
			if (!outcome.succeeded()) {
				totals.exclude(outcome.unitId(), outcome.failure());
				continue;
			}
			OrganizationalUnitSummary child = outcome.summary();
			if (child.level() != unit.level().child()) {
				throw new IllegalArgumentException("Unit " + child.unitId() + " at level " + child.level()
						+ " cannot roll up into " + unit.level() + " " + unit.unitId());
			}
			totals.covered++;
			totals.partial |= child.partial();
			totals.staff += child.totalStaff();
			totals.score = totals.score.add(ScoreMath.safe(child.totalScore()));
			totals.percentage = totals.percentage.add(ScoreMath.safe(child.totalPercentage()));
			if (child.gradeDistribution() != null) {
				child.gradeDistribution().forEach((grade, count) -> totals.grades.merge(grade, count, Integer::sum));
			}
			totals.workProducts += child.totalWorkProducts();
			totals.onTime += child.workProductsOnTime();
			totals.overdue += child.workProductsOverdue();
			totals.feedbacks += child.total360Feedbacks();
			totals.completedFeedbacks += child.completed360Feedbacks();
			totals.gaps += child.totalCompetencyGaps();
			totals.closedGaps += child.closedCompetencyGaps();
		}
		return totals.toSummary(unit, reviewPeriodId, outcomes.size());
	}

	public OrganizationalUnitSummary requireComplete(OrganizationalUnitSummary summary) {
		if (!summary.partial()) {
			return summary;
		}
		List<String> reasons = new ArrayList<>();
		for (ExcludedUnit excluded : summary.excludedUnits()) {
			reasons.add(excluded.unitId() + ": " + excluded.reason());
		}
		String detail = reasons.isEmpty() ? "a descendant unit is partial" : String.join("; ", reasons);
		throw new PartialAggregationException(summary.unitId(), "Unit " + summary.unitId() + " covers "
				+ summary.coveredUnits() + " of " + summary.expectedUnits() + " expected units (" + detail + ")");
	}

	private final class Totals {
		private final Map<PerformanceGrade, Integer> grades = new EnumMap<>(PerformanceGrade.class);
		private final List<ExcludedUnit> excluded = new ArrayList<>();
		private boolean partial;
		private int covered;
		private int staff;
		private BigDecimal score = ScoreMath.ZERO;
		private BigDecimal percentage = ScoreMath.ZERO;
		private int workProducts;
		private int onTime;
		private int overdue;
		private int feedbacks;
		private int completedFeedbacks;
		private int gaps;
		private int closedGaps;

		private void exclude(String id, String reason) {
			excluded.add(new ExcludedUnit(id, reason));
			partial = true;
		}

		private OrganizationalUnitSummary toSummary(OrganizationalUnit unit, String reviewPeriodId, int expected) {
			BigDecimal staffCount = BigDecimal.valueOf(staff);
			BigDecimal averagePercentage = ScoreMath.divide(percentage, staffCount);
			Map<PerformanceGrade, Integer> distribution = new LinkedHashMap<>();
			for (PerformanceGrade grade : PerformanceGrade.values()) {
				distribution.put(grade, grades.getOrDefault(grade, 0));
			}
			return new OrganizationalUnitSummary(
					unit.unitId(),
					unit.name(),
					unit.level(),
					reviewPeriodId,
					staff,
					score,
					percentage,
					ScoreMath.round(ScoreMath.divide(score, staffCount)),
					ScoreMath.round(averagePercentage),
					gradeClassifier.classify(averagePercentage),
					Collections.unmodifiableMap(distribution),
					workProducts,
					onTime,
					overdue,
					feedbacks,
					completedFeedbacks,
					gaps,
					closedGaps,
					ScoreMath.round(ScoreMath.percentOf(BigDecimal.valueOf(closedGaps), BigDecimal.valueOf(gaps))),
					expected,
					covered,
					partial,
					List.copyOf(excluded)
			);
		}
	}
}
