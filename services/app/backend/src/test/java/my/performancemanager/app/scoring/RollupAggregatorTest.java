package my.performancemanager.app.scoring;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollupAggregatorTest {
	private static final LocalDate PERIOD_END = LocalDate.of(2025, 12, 31);
	private static final OrganizationalUnit DIVISION = new OrganizationalUnit("D1", "Division", OrganizationLevel.DIVISION, "DEP1");

	private final GradeClassifier classifier = new GradeClassifier();
	private final RollupAggregator aggregator = new RollupAggregator(classifier);

	@Test
	void divisionAverageIsWeightedByStaffCount() {
		OrganizationalUnitSummary officeA = aggregator.summarizeOffice(officeInput("OA",
				StaffOutcome.scored(score("S1", "80")), StaffOutcome.scored(score("S2", "60"))));
		OrganizationalUnitSummary officeB = aggregator.summarizeOffice(officeInput("OB",
				StaffOutcome.scored(score("S3", "90"))));

		OrganizationalUnitSummary division = aggregator.summarizeParent(DIVISION, "P1", List.of(
				UnitOutcome.summarized(officeA),
				UnitOutcome.summarized(officeB)
		));

		assertThat(officeA.averagePercentage()).isEqualByComparingTo("70");
		assertThat(division.totalStaff()).isEqualTo(3);
		assertThat(division.averagePercentage()).isEqualByComparingTo("76.67");
		assertThat(division.grade()).isEqualTo(PerformanceGrade.COMPETENT);
		assertThat(division.coveredUnits()).isEqualTo(2);
		assertThat(division.expectedUnits()).isEqualTo(2);
		assertThat(division.partial()).isFalse();
		assertThat(division.gradeDistribution())
				.containsEntry(PerformanceGrade.ACCOMPLISHED, 1)
				.containsEntry(PerformanceGrade.PROGRESSIVE, 1)
				.containsEntry(PerformanceGrade.EXEMPLARY, 1)
				.containsEntry(PerformanceGrade.DEVELOPING, 0);
	}

	@Test
	void unitGradeUsesExactAverage() {
		OrganizationalUnitSummary office = aggregator.summarizeOffice(officeInput("OA",
				StaffOutcome.scored(score("S1", "89.99")), StaffOutcome.scored(score("S2", "90.00"))));

		assertThat(office.averagePercentage()).isEqualByComparingTo("90.00");
		assertThat(office.grade()).isEqualTo(PerformanceGrade.ACCOMPLISHED);
	}

	@Test
	void failedOfficeIsExcludedAndReportedAsPartialCoverage() {
		OrganizationalUnitSummary officeA = aggregator.summarizeOffice(officeInput("OA",
				StaffOutcome.scored(score("S1", "80"))));
		OrganizationalUnitSummary officeB = aggregator.summarizeOffice(officeInput("OB",
				StaffOutcome.scored(score("S2", "60"))));

		OrganizationalUnitSummary division = aggregator.summarizeParent(DIVISION, "P1", List.of(
				UnitOutcome.summarized(officeA),
				UnitOutcome.summarized(officeB),
				UnitOutcome.failed("OC", "Missing weight configuration")
		));

		assertThat(division.expectedUnits()).isEqualTo(3);
		assertThat(division.coveredUnits()).isEqualTo(2);
		assertThat(division.partial()).isTrue();
		assertThat(division.totalStaff()).isEqualTo(2);
		assertThat(division.averagePercentage()).isEqualByComparingTo("70");
		assertThat(division.excludedUnits()).extracting(ExcludedUnit::unitId).containsExactly("OC");
		assertThatThrownBy(() -> aggregator.requireComplete(division))
				.isInstanceOf(PartialAggregationException.class)
				.hasMessageContaining("2 of 3");
	}

	@Test
	void partialChildMakesParentPartial() {
		OrganizationalUnitSummary office = aggregator.summarizeOffice(officeInput("OA",
				StaffOutcome.scored(score("S1", "80")), StaffOutcome.failed("S2", "Missing weight")));
		OrganizationalUnitSummary division = aggregator.summarizeParent(DIVISION, "P1",
				List.of(UnitOutcome.summarized(office)));

		assertThat(office.partial()).isTrue();
		assertThat(office.excludedUnits()).extracting(ExcludedUnit::unitId).containsExactly("S2");
		assertThat(division.partial()).isTrue();
		assertThat(division.coveredUnits()).isEqualTo(1);
		assertThat(division.excludedUnits()).isEmpty();
	}

	@Test
	void officeCountsScheduleFeedbackAndGaps() {
		List<WorkProductEvaluation> workProducts = List.of(
				workProduct("W1", LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 1), true),
				workProduct("W2", LocalDate.of(2025, 4, 10), LocalDate.of(2025, 4, 15), true),
				workProduct("W3", LocalDate.of(2025, 6, 30), null, false),
				workProduct("W4", LocalDate.of(2026, 2, 1), null, false)
		);
		List<FeedbackResult> feedback = List.of(
				feedback("CY1", FeedbackCompletion.COMPLETE),
				feedback("CY2", FeedbackCompletion.PARTIAL)
		);
		List<CompetencyGapRecord> gaps = List.of(
				gap("C1", true),
				gap("C2", true),
				gap("C3", false)
		);
		OfficeRollupInput input = new OfficeRollupInput(office("OA"), "P1", PERIOD_END,
				List.of(StaffOutcome.scored(score("S1", "75"))), workProducts, feedback, gaps,
				Set.of(new GapClosure("S1", "C1")));

		OrganizationalUnitSummary summary = aggregator.summarizeOffice(input);

		assertThat(summary.totalWorkProducts()).isEqualTo(4);
		assertThat(summary.workProductsOnTime()).isEqualTo(1);
		assertThat(summary.workProductsOverdue()).isEqualTo(2);
		assertThat(summary.total360Feedbacks()).isEqualTo(2);
		assertThat(summary.completed360Feedbacks()).isEqualTo(1);
		assertThat(summary.totalCompetencyGaps()).isEqualTo(2);
		assertThat(summary.closedCompetencyGaps()).isEqualTo(1);
		assertThat(summary.gapClosurePercentage()).isEqualByComparingTo("50");
	}

	@Test
	void officeWithoutStaffHasZeroAverage() {
		OrganizationalUnitSummary summary = aggregator.summarizeOffice(officeInput("OA"));

		assertThat(summary.totalStaff()).isZero();
		assertThat(summary.averagePercentage()).isEqualByComparingTo("0");
		assertThat(summary.grade()).isEqualTo(PerformanceGrade.DEVELOPING);
		assertThat(summary.gapClosurePercentage()).isEqualByComparingTo("0");
		assertThat(summary.partial()).isFalse();
	}

	@Test
	void rejectsChildFromWrongLevel() {
		OrganizationalUnitSummary office = aggregator.summarizeOffice(officeInput("OA",
				StaffOutcome.scored(score("S1", "80"))));
		OrganizationalUnit department = new OrganizationalUnit("DEP1", "Department", OrganizationLevel.DEPARTMENT, "E1");

		assertThatThrownBy(() -> aggregator.summarizeParent(department, "P1", List.of(UnitOutcome.summarized(office))))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void workProductOutcomeSumsEvaluationScores() {
		WorkProductEvaluation evaluation = new WorkProductEvaluation("W1", "S1", "P1", "WP", "SUPERVISOR",
				new BigDecimal("3"), new BigDecimal("4"), new BigDecimal("2.5"), null, null, false, true);

		assertThat(evaluation.outcome()).isEqualByComparingTo("9.5");
		assertThat(evaluation.toContribution().points()).isEqualByComparingTo("9.5");
	}

	private OfficeRollupInput officeInput(String officeId, StaffOutcome... staff) {
		return new OfficeRollupInput(office(officeId), "P1", PERIOD_END, List.of(staff), List.of(), List.of(),
				List.of(), Set.of());
	}

	private static OrganizationalUnit office(String officeId) {
		return new OrganizationalUnit(officeId, "Office " + officeId, OrganizationLevel.OFFICE, "D1");
	}

	private StaffPeriodScore score(String staffId, String percentage) {
		BigDecimal value = new BigDecimal(percentage);
		return new StaffPeriodScore(staffId, "P1", List.of(), BigDecimal.ZERO, value, new BigDecimal("100"), value,
				classifier.classify(value), classifier.isUnderPerforming(value));
	}

	private static WorkProductEvaluation workProduct(String id, LocalDate due, LocalDate completedOn, boolean completed) {
		return new WorkProductEvaluation(id, "S1", "P1", "WP", "SUPERVISOR", BigDecimal.ONE, BigDecimal.ONE,
				BigDecimal.ONE, due, completedOn, completed, true);
	}

	private static FeedbackResult feedback(String cycleId, FeedbackCompletion completion) {
		return new FeedbackResult(cycleId, "S1", "P1", BigDecimal.TEN, BigDecimal.TEN, new BigDecimal("100"),
				completion, 1, 1);
	}

	private static CompetencyGapRecord gap(String competencyId, boolean haveGap) {
		BigDecimal gap = haveGap ? BigDecimal.ONE : BigDecimal.ONE.negate();
		return new CompetencyGapRecord("S1", competencyId, "P1", "TECH", new BigDecimal("3"),
				new BigDecimal("3").subtract(gap), gap, haveGap);
	}
}
