package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public class CategoryWeightResolver {
	public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

	private final Map<WeightKey, CategoryWeight> weights = new HashMap<>();
	private final Map<String, List<CategoryWeight>> byCategory = new TreeMap<>();
	private final BigDecimal tolerance;

	public CategoryWeightResolver(List<CategoryWeight> rows) {
		this(rows, DEFAULT_TOLERANCE);
	}

	public CategoryWeightResolver(List<CategoryWeight> rows, BigDecimal tolerance) {
		this.tolerance = tolerance == null ? DEFAULT_TOLERANCE : tolerance.abs();
		if (rows == null) {
			return;
		}
		for (CategoryWeight row : rows) {
			if (row == null) {
				continue;
			}
			weights.put(new WeightKey(row.reviewPeriodId(), row.categoryId(), row.reviewTypeId()), row);
			byCategory.computeIfAbsent(categoryKey(row.reviewPeriodId(), row.categoryId()), key -> new ArrayList<>()).add(row);
		}
	}

	public CategoryWeight resolve(String reviewPeriodId, String categoryId, String reviewTypeId) {
		CategoryWeight weight = weights.get(new WeightKey(reviewPeriodId, categoryId, reviewTypeId));
		if (weight == null) {
			throw ConfigurationMissingException.weight(reviewPeriodId, categoryId, reviewTypeId);
		}
		return weight;
	}

	public List<CategoryWeight> rows(String reviewPeriodId, String categoryId) {
		return List.copyOf(byCategory.getOrDefault(categoryKey(reviewPeriodId, categoryId), List.of()));
	}

	public List<CategoryDefinition> categories(String reviewPeriodId) {
		List<CategoryDefinition> definitions = new ArrayList<>();
		for (Map.Entry<String, List<CategoryWeight>> entry : byCategory.entrySet()) {
			CategoryWeight first = entry.getValue().get(0);
			if (!Objects.equals(first.reviewPeriodId(), reviewPeriodId)) {
				continue;
			}
			definitions.add(new CategoryDefinition(first.categoryId(), first.categoryType(), first.maxPoints(),
					first.maxCount()));
		}
		return List.copyOf(definitions);
	}

	public List<String> validate(ReviewPeriod period) {
		List<String> violations = new ArrayList<>();
		if (period == null) {
			violations.add("review period is required");
			return violations;
		}
		String periodId = period.reviewPeriodId();
		BigDecimal positiveMaxTotal = BigDecimal.ZERO;
		boolean anyCategory = false;
		for (List<CategoryWeight> rows : byCategory.values()) {
			CategoryWeight first = rows.get(0);
			if (!Objects.equals(first.reviewPeriodId(), periodId)) {
				continue;
			}
			anyCategory = true;
			String categoryId = first.categoryId();
			BigDecimal shareTotal = BigDecimal.ZERO;
			for (CategoryWeight row : rows) {
				shareTotal = shareTotal.add(ScoreMath.safe(row.weightPercent()));
				if (row.weightPercent() == null || row.weightPercent().signum() < 0) {
					violations.add("category " + categoryId + " review type " + row.reviewTypeId()
							+ " has no valid weight percentage");
				}
				if (!sameAmount(row.maxPoints(), first.maxPoints())) {
					violations.add("category " + categoryId + " has conflicting max points across review types");
				}
				if (!Objects.equals(row.maxCount(), first.maxCount())) {
					violations.add("category " + categoryId + " has conflicting max count across review types");
				}
				if (row.categoryType() != first.categoryType()) {
					violations.add("category " + categoryId + " has conflicting category types");
				}
			}
			if (shareTotal.subtract(ScoreMath.ONE_HUNDRED).abs().compareTo(tolerance) > 0) {
				violations.add("category " + categoryId + " weights sum to " + shareTotal.stripTrailingZeros().toPlainString()
						+ "% instead of 100%");
			}
			if (first.maxPoints() == null || first.maxPoints().signum() <= 0) {
				violations.add("category " + categoryId + " must have positive max points");
			} else if (first.categoryType() != null && !first.categoryType().isDeduction()) {
				positiveMaxTotal = positiveMaxTotal.add(first.maxPoints());
			}
			if (first.categoryType() == null) {
				violations.add("category " + categoryId + " has no category type");
			}
			if (first.maxCount() != null && first.maxCount() <= 0) {
				violations.add("category " + categoryId + " max count must be positive");
			}
		}
		if (!anyCategory) {
			violations.add("no category weights configured for review period " + periodId);
			return violations;
		}
		BigDecimal periodMax = period.maxPoints();
		if (periodMax == null || periodMax.signum() <= 0) {
			violations.add("review period " + periodId + " must have positive max points");
		} else if (positiveMaxTotal.subtract(periodMax).abs().compareTo(tolerance) > 0) {
			violations.add("category max points sum to " + positiveMaxTotal.stripTrailingZeros().toPlainString()
					+ " but the review period maximum is " + periodMax.stripTrailingZeros().toPlainString());
		}
		return violations;
	}

	public void requireConsistent(ReviewPeriod period) {
		List<String> violations = validate(period);
		if (!violations.isEmpty()) {
			throw new InconsistentWeightException(period == null ? null : period.reviewPeriodId(), violations);
		}
	}

	private static boolean sameAmount(BigDecimal left, BigDecimal right) {
		if (left == null || right == null) {
			return left == right;
		}
		return left.compareTo(right) == 0;
	}

	private static String categoryKey(String reviewPeriodId, String categoryId) {
		return reviewPeriodId + "\u0000" + categoryId;
	}

	public record CategoryDefinition(String categoryId, CategoryType categoryType, BigDecimal maxPoints,
									 Integer maxCount) {
	}

	private record WeightKey(String reviewPeriodId, String categoryId, String reviewTypeId) {
	}
}
