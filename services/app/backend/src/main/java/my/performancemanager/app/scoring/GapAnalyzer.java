package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

public class GapAnalyzer {

	public List<CompetencyGapRecord> analyze(String staffId,
											 String reviewPeriodId,
											 List<CompetencyTarget> targets,
											 List<CompetencyRating> ratings,
											 Map<String, BigDecimal> reviewTypeWeights) {
		Map<String, CompetencyTarget> targetsByCompetency = new TreeMap<>();
		if (targets != null) {
			for (CompetencyTarget target : targets) {
				if (target != null && Objects.equals(target.staffId(), staffId)) {
					targetsByCompetency.put(target.competencyId(), target);
				}
			}
		}
		Map<String, List<CompetencyRating>> ratingsByCompetency = new HashMap<>();
		if (ratings != null) {
			for (CompetencyRating rating : ratings) {
				if (rating == null || !Objects.equals(rating.staffId(), staffId)) {
					continue;
				}
				if (!targetsByCompetency.containsKey(rating.competencyId())) {
					throw new ConfigurationMissingException("No expected rating configured for staff " + staffId
							+ " and competency " + rating.competencyId());
				}
				ratingsByCompetency.computeIfAbsent(rating.competencyId(), key -> new ArrayList<>()).add(rating);
			}
		}

		List<CompetencyGapRecord> gaps = new ArrayList<>();
		for (CompetencyTarget target : targetsByCompetency.values()) {
			gaps.add(analyzeCompetency(reviewPeriodId, target,
					ratingsByCompetency.getOrDefault(target.competencyId(), List.of()), reviewTypeWeights));
		}
		return List.copyOf(gaps);
	}

	public CompetencyGapRecord analyzeCompetency(String reviewPeriodId,
												 CompetencyTarget target,
												 List<CompetencyRating> ratings,
												 Map<String, BigDecimal> reviewTypeWeights) {
		Objects.requireNonNull(target, "target");
		BigDecimal actual = weightedActual(ratings, reviewTypeWeights);
		BigDecimal expected = ScoreMath.safe(target.expectedRatingValue());
		BigDecimal gap = expected.subtract(actual);
		return new CompetencyGapRecord(
				target.staffId(),
				target.competencyId(),
				reviewPeriodId,
				target.categoryId(),
				ScoreMath.round(expected),
				ScoreMath.round(actual),
				ScoreMath.round(gap),
				gap.signum() > 0
		);
	}

	public List<CompetencyCategorySummary> summarizeCategories(List<CompetencyTarget> targets,
															   List<CompetencyGapRecord> gaps) {
		Map<String, String> categoryNames = new HashMap<>();
		if (targets != null) {
			for (CompetencyTarget target : targets) {
				if (target != null && target.categoryId() != null) {
					categoryNames.putIfAbsent(target.categoryId(), target.categoryName());
				}
			}
		}
		Map<String, List<CompetencyGapRecord>> byCategory = new TreeMap<>();
		if (gaps != null) {
			for (CompetencyGapRecord gap : gaps) {
				if (gap != null && gap.categoryId() != null) {
					byCategory.computeIfAbsent(gap.categoryId(), key -> new ArrayList<>()).add(gap);
				}
			}
		}

		List<CompetencyCategorySummary> summaries = new ArrayList<>();
		for (Map.Entry<String, List<CompetencyGapRecord>> entry : byCategory.entrySet()) {
			List<CompetencyGapRecord> records = entry.getValue();
			Set<String> staff = new HashSet<>();
			Set<String> competencies = new HashSet<>();
			BigDecimal actualTotal = ScoreMath.ZERO;
			BigDecimal expectedTotal = ScoreMath.ZERO;
			BigDecimal highest = null;
			BigDecimal lowest = null;
			for (CompetencyGapRecord record : records) {
				staff.add(record.staffId());
				competencies.add(record.competencyId());
				BigDecimal actual = ScoreMath.safe(record.averageActualRatingValue());
				actualTotal = actualTotal.add(actual);
				expectedTotal = expectedTotal.add(ScoreMath.safe(record.expectedRatingValue()));
				highest = highest == null ? actual : ScoreMath.max(highest, actual);
				lowest = lowest == null ? actual : ScoreMath.min(lowest, actual);
			}
			BigDecimal count = BigDecimal.valueOf(records.size());
			summaries.add(new CompetencyCategorySummary(
					entry.getKey(),
					categoryNames.get(entry.getKey()),
					staff.size(),
					competencies.size(),
					ScoreMath.round(ScoreMath.divide(actualTotal, count)),
					ScoreMath.round(ScoreMath.divide(expectedTotal, count)),
					ScoreMath.round(highest),
					ScoreMath.round(lowest),
					mostFrequent(records)
			));
		}
		return List.copyOf(summaries);
	}

	private BigDecimal weightedActual(List<CompetencyRating> ratings, Map<String, BigDecimal> reviewTypeWeights) {
		if (ratings == null || ratings.isEmpty()) {
			return ScoreMath.ZERO;
		}
		Map<String, List<BigDecimal>> byReviewType = new TreeMap<>();
		for (CompetencyRating rating : ratings) {
			BigDecimal value = ScoreMath.safe(rating.ratingValue());
			// A zero rating means the reviewer has not rated yet.
			if (value.signum() <= 0) {
				continue;
			}
			byReviewType.computeIfAbsent(rating.reviewTypeId(), key -> new ArrayList<>()).add(value);
		}
		BigDecimal actual = ScoreMath.ZERO;
		for (Map.Entry<String, List<BigDecimal>> entry : byReviewType.entrySet()) {
			BigDecimal weight = reviewTypeWeights == null ? null : reviewTypeWeights.get(entry.getKey());
			if (weight == null) {
				throw new ConfigurationMissingException("No competency weight configured for review type " + entry.getKey());
			}
			BigDecimal sum = entry.getValue().stream().reduce(ScoreMath.ZERO, BigDecimal::add);
			BigDecimal average = ScoreMath.divide(sum, BigDecimal.valueOf(entry.getValue().size()));
			actual = actual.add(average.multiply(weight));
		}
		return ScoreMath.divide(actual, ScoreMath.ONE_HUNDRED);
	}

	private BigDecimal mostFrequent(List<CompetencyGapRecord> records) {
		Map<BigDecimal, Integer> frequencies = new LinkedHashMap<>();
		for (CompetencyGapRecord record : records) {
			frequencies.merge(ScoreMath.round(record.averageActualRatingValue()), 1, Integer::sum);
		}
		return frequencies.entrySet().stream()
				.max(Comparator.<Map.Entry<BigDecimal, Integer>>comparingInt(Map.Entry::getValue)
						.thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
				.map(Map.Entry::getKey)
				.orElse(ScoreMath.round(ScoreMath.ZERO));
	}
}
