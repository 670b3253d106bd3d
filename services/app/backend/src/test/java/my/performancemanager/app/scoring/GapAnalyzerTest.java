package my.performancemanager.app.scoring;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GapAnalyzerTest {
	private static final Map<String, BigDecimal> WEIGHTS = Map.of(
			"SUPERVISOR", new BigDecimal("60"),
			"SELF", new BigDecimal("40")
	);

	private final GapAnalyzer analyzer = new GapAnalyzer();

	@Test
	void positiveGapWhenBelowExpectation() {
		CompetencyGapRecord gap = analyzer.analyzeCompetency("P1", target("C1", "4"), List.of(
				rating("C1", "SUPERVISOR", "3"),
				rating("C1", "SELF", "3")
		), WEIGHTS);

		assertThat(gap.averageActualRatingValue()).isEqualByComparingTo("3");
		assertThat(gap.gap()).isEqualByComparingTo("1");
		assertThat(gap.haveGap()).isTrue();
	}

	@Test
	void gapBelowReportedPrecisionStillCounts() {
		CompetencyGapRecord gap = analyzer.analyzeCompetency("P1", target("C1", "4"), List.of(
				rating("C1", "SUPERVISOR", "3.994"),
				rating("C1", "SELF", "4")
		), WEIGHTS);

		assertThat(gap.gap()).isEqualByComparingTo("0.00");
		assertThat(gap.haveGap()).isTrue();
	}

	@Test
	void negativeGapWhenAboveExpectation() {
		CompetencyGapRecord gap = analyzer.analyzeCompetency("P1", target("C1", "3"), List.of(
				rating("C1", "SUPERVISOR", "4"),
				rating("C1", "SELF", "4")
		), WEIGHTS);

		assertThat(gap.gap()).isEqualByComparingTo("-1");
		assertThat(gap.haveGap()).isFalse();
	}

	@Test
	void missingReviewTypeReducesActualWithoutRenormalizing() {
		CompetencyGapRecord gap = analyzer.analyzeCompetency("P1", target("C1", "3"), List.of(
				rating("C1", "SUPERVISOR", "4")
		), WEIGHTS);

		assertThat(gap.averageActualRatingValue()).isEqualByComparingTo("2.4");
		assertThat(gap.gap()).isEqualByComparingTo("0.6");
	}

	@Test
	void zeroRatingsAreTreatedAsNotRated() {
		CompetencyGapRecord gap = analyzer.analyzeCompetency("P1", target("C1", "4"), List.of(
				rating("C1", "SUPERVISOR", "4"),
				rating("C1", "SUPERVISOR", "0"),
				rating("C1", "SELF", "4")
		), WEIGHTS);

		assertThat(gap.averageActualRatingValue()).isEqualByComparingTo("4");
		assertThat(gap.haveGap()).isFalse();
	}

	@Test
	void targetWithoutRatingsHasFullGap() {
		List<CompetencyGapRecord> gaps = analyzer.analyze("S1", "P1", List.of(target("C1", "4")), List.of(), WEIGHTS);

		assertThat(gaps).hasSize(1);
		assertThat(gaps.get(0).averageActualRatingValue()).isEqualByComparingTo("0");
		assertThat(gaps.get(0).gap()).isEqualByComparingTo("4");
	}

	@Test
	void ratingWithoutTargetIsConfigurationError() {
		assertThatThrownBy(() -> analyzer.analyze("S1", "P1", List.of(target("C1", "4")),
				List.of(rating("C2", "SUPERVISOR", "3")), WEIGHTS))
				.isInstanceOf(ConfigurationMissingException.class)
				.hasMessageContaining("C2");
	}

	@Test
	void ratingFromUnweightedReviewTypeIsConfigurationError() {
		assertThatThrownBy(() -> analyzer.analyzeCompetency("P1", target("C1", "4"),
				List.of(rating("C1", "PEER", "3")), WEIGHTS))
				.isInstanceOf(ConfigurationMissingException.class)
				.hasMessageContaining("PEER");
	}

	@Test
	void analyzeOrdersByCompetency() {
		List<CompetencyGapRecord> gaps = analyzer.analyze("S1", "P1",
				List.of(target("C2", "3"), target("C1", "3")), List.of(), WEIGHTS);

		assertThat(gaps).extracting(CompetencyGapRecord::competencyId).containsExactly("C1", "C2");
	}

	@Test
	void categorySummaryBreaksFrequencyTiesTowardsLowestRating() {
		List<CompetencyGapRecord> gaps = List.of(
				gap("S1", "C1", "3"),
				gap("S2", "C1", "4"),
				gap("S3", "C1", "3"),
				gap("S1", "C2", "4"),
				gap("S2", "C2", "2")
		);

		List<CompetencyCategorySummary> summaries = analyzer.summarizeCategories(
				List.of(new CompetencyTarget("S1", "C1", "Delivery", "TECH", "Technical", new BigDecimal("4"))), gaps);

		assertThat(summaries).hasSize(1);
		CompetencyCategorySummary summary = summaries.get(0);
		assertThat(summary.categoryName()).isEqualTo("Technical");
		assertThat(summary.staffCount()).isEqualTo(3);
		assertThat(summary.competencyCount()).isEqualTo(2);
		assertThat(summary.highestRating()).isEqualByComparingTo("4");
		assertThat(summary.lowestRating()).isEqualByComparingTo("2");
		assertThat(summary.averageActual()).isEqualByComparingTo("3.2");
		assertThat(summary.averageExpected()).isEqualByComparingTo("4");
		assertThat(summary.mostFrequentRating()).isEqualByComparingTo("3");
	}

	private static CompetencyTarget target(String competencyId, String expected) {
		return new CompetencyTarget("S1", competencyId, competencyId + " name", "TECH", "Technical",
				new BigDecimal(expected));
	}

	private static CompetencyRating rating(String competencyId, String reviewType, String value) {
		return new CompetencyRating("S1", competencyId, reviewType, "R-" + reviewType, new BigDecimal(value));
	}

	private static CompetencyGapRecord gap(String staffId, String competencyId, String actual) {
		BigDecimal actualValue = new BigDecimal(actual).setScale(2);
		BigDecimal expected = new BigDecimal("4.00");
		BigDecimal gap = expected.subtract(actualValue);
		return new CompetencyGapRecord(staffId, competencyId, "P1", "TECH", expected, actualValue, gap, gap.signum() > 0);
	}
}
