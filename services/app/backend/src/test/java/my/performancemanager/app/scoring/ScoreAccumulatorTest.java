package my.performancemanager.app.scoring;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreAccumulatorTest {
	private static final ReviewPeriod PERIOD = new ReviewPeriod("P1", "2025", new BigDecimal("100"), null, null);

	private final ScoreAccumulator accumulator = new ScoreAccumulator(new GradeClassifier());

	@Test
	void scoresWorkProductsAndCompetenciesAgainstPeriodMaximum() {
		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "25"),
				record("R2", "WP", "SUPERVISOR", "20"),
				record("R3", "COMP", "SUPERVISOR", "30")
		), standardWeights());

		assertThat(score.finalScore()).isEqualByComparingTo("75");
		assertThat(score.percentage()).isEqualByComparingTo("75");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.COMPETENT);
		assertThat(score.underPerforming()).isFalse();
		assertThat(score.categories())
				.extracting(CategoryScore::categoryId)
				.containsExactly("COMP", "WP");
		CategoryScore workProducts = score.categories().get(1);
		assertThat(workProducts.score()).isEqualByComparingTo("45");
		assertThat(workProducts.recordCount()).isEqualTo(2);
		assertThat(workProducts.periodSharePercent()).isEqualByComparingTo("60");
	}

	@Test
	void gradeUsesExactPercentageBelowUpperBoundary() {
		ReviewPeriod period = new ReviewPeriod("P1", "2025", new BigDecimal("200"), null, null);
		CategoryWeightResolver weights = new CategoryWeightResolver(List.of(
				weight("WP", "SELF", CategoryType.WORK_PRODUCT, "100", "200", null)
		));

		StaffPeriodScore score = accumulator.accumulate("S1", period, List.of(
				record("R1", "WP", "SELF", "179.99")
		), weights);

		assertThat(score.percentage()).isEqualByComparingTo("90.00");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.ACCOMPLISHED);
	}

	@Test
	void underPerformingUsesExactPercentageBelowProgressiveBoundary() {
		ReviewPeriod period = new ReviewPeriod("P1", "2025", new BigDecimal("200"), null, null);
		CategoryWeightResolver weights = new CategoryWeightResolver(List.of(
				weight("WP", "SELF", CategoryType.WORK_PRODUCT, "100", "200", null)
		));

		StaffPeriodScore score = accumulator.accumulate("S1", period, List.of(
				record("R1", "WP", "SELF", "99.99")
		), weights);

		assertThat(score.percentage()).isEqualByComparingTo("50.00");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.DEVELOPING);
		assertThat(score.underPerforming()).isTrue();
	}

	@Test
	void capsCategoryAtItsMaximum() {
		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "80"),
				record("R2", "COMP", "SUPERVISOR", "40")
		), standardWeights());

		CategoryScore workProducts = score.categories().get(1);
		assertThat(workProducts.rawPoints()).isEqualByComparingTo("80");
		assertThat(workProducts.cappedPoints()).isEqualByComparingTo("60");
		assertThat(score.finalScore()).isEqualByComparingTo("100");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.EXEMPLARY);
	}

	@Test
	void weightsEachReviewTypeWithinCategory() {
		CategoryWeightResolver weights = new CategoryWeightResolver(List.of(
				weight("WP", "SUPERVISOR", CategoryType.WORK_PRODUCT, "60", "100", null),
				weight("WP", "SELF", CategoryType.WORK_PRODUCT, "40", "100", null)
		));

		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "50"),
				record("R2", "WP", "SELF", "30")
		), weights);

		assertThat(score.finalScore()).isEqualByComparingTo("42");
	}

	@Test
	void appliesDeductionsAfterPositiveCategories() {
		List<CategoryWeight> rows = new ArrayList<>(standardRows());
		rows.add(weight("HRD", "HR", CategoryType.DEDUCTION, "100", "10", null));

		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "45"),
				record("R2", "COMP", "SUPERVISOR", "30"),
				record("R3", "HRD", "HR", "15")
		), new CategoryWeightResolver(rows));

		assertThat(score.deductedPoints()).isEqualByComparingTo("10");
		assertThat(score.finalScore()).isEqualByComparingTo("65");
		assertThat(score.categories()).extracting(CategoryScore::categoryId).containsExactly("COMP", "WP", "HRD");
	}

	@Test
	void deductionsNeverPushScoreBelowZero() {
		List<CategoryWeight> rows = new ArrayList<>(standardRows());
		rows.add(weight("HRD", "HR", CategoryType.DEDUCTION, "100", "10", null));

		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "5"),
				record("R2", "HRD", "HR", "10")
		), new CategoryWeightResolver(rows));

		assertThat(score.finalScore()).isEqualByComparingTo("0");
		assertThat(score.percentage()).isEqualByComparingTo("0");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.DEVELOPING);
	}

	@Test
	void staffWithoutContributionsScoresZero() {
		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(), standardWeights());

		assertThat(score.finalScore()).isEqualByComparingTo("0");
		assertThat(score.grade()).isEqualTo(PerformanceGrade.DEVELOPING);
		assertThat(score.underPerforming()).isTrue();
		assertThat(score.categories()).allSatisfy(category -> assertThat(category.score()).isEqualByComparingTo("0"));
	}

	@Test
	void ignoresIneligibleRecordsAndOtherStaff() {
		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "SUPERVISOR", "45"),
				new ContributionRecord("R2", "S1", "P1", "WP", "SUPERVISOR", new BigDecimal("10"), false),
				new ContributionRecord("R3", "S2", "P1", "WP", "SUPERVISOR", new BigDecimal("10"), true)
		), standardWeights());

		assertThat(score.finalScore()).isEqualByComparingTo("45");
	}

	@Test
	void countsOnlyFirstRecordsUpToMaxCount() {
		CategoryWeightResolver weights = new CategoryWeightResolver(List.of(
				weight("WP", "SUPERVISOR", CategoryType.WORK_PRODUCT, "100", "100", 2)
		));

		StaffPeriodScore score = accumulator.accumulate("S1", PERIOD, List.of(
				record("R3", "WP", "SUPERVISOR", "30"),
				record("R1", "WP", "SUPERVISOR", "10"),
				record("R2", "WP", "SUPERVISOR", "20")
		), weights);

		assertThat(score.finalScore()).isEqualByComparingTo("30");
		assertThat(score.categories().get(0).recordCount()).isEqualTo(2);
	}

	@Test
	void missingReviewTypeWeightFailsWholeComputation() {
		assertThatThrownBy(() -> accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "WP", "PEER", "10")
		), standardWeights()))
				.isInstanceOf(ConfigurationMissingException.class);
	}

	@Test
	void contributionInUnconfiguredCategoryFails() {
		assertThatThrownBy(() -> accumulator.accumulate("S1", PERIOD, List.of(
				record("R1", "TRAINING", "SUPERVISOR", "10")
		), standardWeights()))
				.isInstanceOf(ConfigurationMissingException.class)
				.hasMessageContaining("TRAINING");
	}

	@Test
	void rejectsInconsistentWeightsBeforeScoring() {
		CategoryWeightResolver weights = new CategoryWeightResolver(List.of(
				weight("WP", "SUPERVISOR", CategoryType.WORK_PRODUCT, "60", "100", null),
				weight("WP", "SELF", CategoryType.WORK_PRODUCT, "50", "100", null)
		));

		assertThatThrownBy(() -> accumulator.accumulate("S1", PERIOD, List.of(), weights))
				.isInstanceOf(InconsistentWeightException.class);
	}

	@Test
	void repeatedRunsProduceIdenticalResults() {
		List<ContributionRecord> records = List.of(
				record("R1", "WP", "SUPERVISOR", "33.335"),
				record("R2", "COMP", "SUPERVISOR", "17.5")
		);

		StaffPeriodScore first = accumulator.accumulate("S1", PERIOD, records, standardWeights());
		StaffPeriodScore second = accumulator.accumulate("S1", PERIOD, records, standardWeights());

		assertThat(second).isEqualTo(first);
		assertThat(first.percentage()).isBetween(BigDecimal.ZERO, new BigDecimal("100"));
	}

	private static CategoryWeightResolver standardWeights() {
		return new CategoryWeightResolver(standardRows());
	}

	private static List<CategoryWeight> standardRows() {
		return List.of(
				weight("WP", "SUPERVISOR", CategoryType.WORK_PRODUCT, "100", "60", null),
				weight("COMP", "SUPERVISOR", CategoryType.COMPETENCY, "100", "40", null)
		);
	}

	private static CategoryWeight weight(String categoryId, String reviewType, CategoryType type, String percent,
										 String maxPoints, Integer maxCount) {
		return new CategoryWeight("P1", categoryId, reviewType, type, new BigDecimal(percent), new BigDecimal(maxPoints),
				maxCount);
	}

	private static ContributionRecord record(String recordId, String categoryId, String reviewType, String points) {
		return new ContributionRecord(recordId, "S1", "P1", categoryId, reviewType, new BigDecimal(points), true);
	}
}
