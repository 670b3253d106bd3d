package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public class ScoreAccumulator {
	private static final Comparator<ContributionRecord> RECORD_ORDER = Comparator.comparing(
			ContributionRecord::recordId, Comparator.nullsLast(Comparator.naturalOrder()));

	private final GradeClassifier gradeClassifier;

	public ScoreAccumulator(GradeClassifier gradeClassifier) {
		this.gradeClassifier = gradeClassifier;
	}

	public StaffPeriodScore accumulate(String staffId,
									   ReviewPeriod period,
									   List<ContributionRecord> records,
									   CategoryWeightResolver resolver) {
		Objects.requireNonNull(period, "period");
		Objects.requireNonNull(resolver, "resolver");
		resolver.requireConsistent(period);
		String periodId = period.reviewPeriodId();
		BigDecimal periodMax = period.maxPoints();

		List<CategoryWeightResolver.CategoryDefinition> definitions = resolver.categories(periodId);
		Map<String, List<ContributionRecord>> byCategory = groupEligible(staffId, periodId, records, definitions);

		List<CategoryScore> categoryScores = new ArrayList<>();
		BigDecimal positiveTotal = ScoreMath.ZERO;
		for (CategoryWeightResolver.CategoryDefinition definition : definitions) {
			if (definition.categoryType().isDeduction()) {
				continue;
			}
			ScoredCategory scored = scoreCategory(definition, periodId, periodMax,
					byCategory.getOrDefault(definition.categoryId(), List.of()), resolver);
			categoryScores.add(scored.summary());
			positiveTotal = positiveTotal.add(scored.score());
		}

		// Deductions apply only after every positive category has been summed.
		BigDecimal deductions = ScoreMath.ZERO;
		for (CategoryWeightResolver.CategoryDefinition definition : definitions) {
			if (!definition.categoryType().isDeduction()) {
				continue;
			}
			ScoredCategory scored = scoreCategory(definition, periodId, periodMax,
					byCategory.getOrDefault(definition.categoryId(), List.of()), resolver);
			categoryScores.add(scored.summary());
			deductions = deductions.add(scored.score());
		}

		BigDecimal finalScore = ScoreMath.max(ScoreMath.ZERO, positiveTotal.subtract(deductions));
		BigDecimal percentage = ScoreMath.min(ScoreMath.max(ScoreMath.percentOf(finalScore, periodMax), ScoreMath.ZERO),
				ScoreMath.ONE_HUNDRED);
		// Grade bands apply to the exact percentage; only the reported figure is rounded.
		PerformanceGrade grade = gradeClassifier.classify(percentage);

		return new StaffPeriodScore(
				staffId,
				periodId,
				List.copyOf(categoryScores),
				ScoreMath.round(deductions),
				ScoreMath.round(finalScore),
				ScoreMath.round(periodMax),
				ScoreMath.round(percentage),
				grade,
				gradeClassifier.isUnderPerforming(percentage)
		);
	}

	private Map<String, List<ContributionRecord>> groupEligible(String staffId,
															   String periodId,
															   List<ContributionRecord> records,
															   List<CategoryWeightResolver.CategoryDefinition> definitions) {
		Map<String, List<ContributionRecord>> grouped = new LinkedHashMap<>();
		for (CategoryWeightResolver.CategoryDefinition definition : definitions) {
			grouped.put(definition.categoryId(), new ArrayList<>());
		}
		if (records == null) {
			return grouped;
		}
		for (ContributionRecord record : records) {
			if (record == null || !record.eligible()) {
				continue;
			}
			if (!Objects.equals(record.staffId(), staffId) || !Objects.equals(record.reviewPeriodId(), periodId)) {
				continue;
			}
			List<ContributionRecord> bucket = grouped.get(record.categoryId());
			if (bucket == null) {
				throw new ConfigurationMissingException("No weight configuration for category " + record.categoryId()
						+ " in review period " + periodId);
			}
			bucket.add(record);
		}
		return grouped;
	}

	private ScoredCategory scoreCategory(CategoryWeightResolver.CategoryDefinition definition,
										 String periodId,
										 BigDecimal periodMax,
										 List<ContributionRecord> records,
										 CategoryWeightResolver resolver) {
		List<ContributionRecord> counted = new ArrayList<>(records);
		counted.sort(RECORD_ORDER);
		Integer maxCount = definition.maxCount();
		if (maxCount != null && counted.size() > maxCount) {
			counted = counted.subList(0, maxCount);
		}

		Map<String, BigDecimal> pointsByReviewType = new TreeMap<>();
		for (ContributionRecord record : counted) {
			String reviewType = record.reviewTypeId() == null ? "" : record.reviewTypeId();
			pointsByReviewType.merge(reviewType, ScoreMath.safe(record.points()), BigDecimal::add);
		}

		BigDecimal raw = ScoreMath.ZERO;
		for (Map.Entry<String, BigDecimal> entry : pointsByReviewType.entrySet()) {
			String reviewType = entry.getKey().isEmpty() ? null : entry.getKey();
			CategoryWeight weight = resolver.resolve(periodId, definition.categoryId(), reviewType);
			raw = raw.add(entry.getValue().multiply(weight.weightPercent()));
		}
		raw = ScoreMath.max(ScoreMath.ZERO, ScoreMath.divide(raw, ScoreMath.ONE_HUNDRED));

		BigDecimal maxPoints = definition.maxPoints();
		BigDecimal capped = ScoreMath.min(raw, maxPoints);
		// Category maximums are shares of the period maximum, so capped points are already on the period scale.
		BigDecimal share = ScoreMath.divide(maxPoints, periodMax);

		CategoryScore summary = new CategoryScore(
				definition.categoryId(),
				definition.categoryType(),
				counted.size(),
				ScoreMath.round(raw),
				ScoreMath.round(capped),
				ScoreMath.round(maxPoints),
				ScoreMath.round(share.multiply(ScoreMath.ONE_HUNDRED)),
				ScoreMath.round(capped)
		);
		return new ScoredCategory(summary, capped);
	}

	private record ScoredCategory(CategoryScore summary, BigDecimal score) {
	}
}
