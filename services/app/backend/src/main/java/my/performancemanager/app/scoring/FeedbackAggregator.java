package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

public class FeedbackAggregator {

	public FeedbackResult aggregate(FeedbackCycle cycle,
									List<FeedbackRating> ratings,
									Map<String, BigDecimal> competencyPoints) {
		Objects.requireNonNull(cycle, "cycle");
		BigDecimal maxPoints = cycle.maxPoints();
		if (maxPoints == null || maxPoints.signum() <= 0) {
			throw new ConfigurationMissingException("Feedback cycle " + cycle.cycleId() + " has no max points configured");
		}
		Set<String> invited = new HashSet<>(cycle.invitedReviewerIds());
		if (invited.isEmpty()) {
			return new FeedbackResult(cycle.cycleId(), cycle.staffId(), cycle.reviewPeriodId(),
					ScoreMath.round(ScoreMath.ZERO), ScoreMath.round(maxPoints), ScoreMath.round(ScoreMath.ZERO),
					FeedbackCompletion.NOT_STARTED, 0, 0);
		}
		BigDecimal scaleMax = cycle.ratingScaleMax();
		if (scaleMax == null || scaleMax.signum() <= 0) {
			throw new ConfigurationMissingException("Feedback cycle " + cycle.cycleId() + " has no rating scale configured");
		}

		Set<String> responded = new HashSet<>();
		Map<String, List<BigDecimal>> byCompetency = new TreeMap<>();
		if (ratings != null) {
			for (FeedbackRating rating : ratings) {
				if (rating == null || !Objects.equals(rating.cycleId(), cycle.cycleId())) {
					continue;
				}
				if (!invited.contains(rating.reviewerId())) {
					continue;
				}
				BigDecimal value = ScoreMath.safe(rating.rating());
				if (value.signum() <= 0) {
					continue;
				}
				responded.add(rating.reviewerId());
				byCompetency.computeIfAbsent(rating.competencyId(), key -> new ArrayList<>()).add(value);
			}
		}

		BigDecimal weightedTotal = ScoreMath.ZERO;
		BigDecimal pointTotal = ScoreMath.ZERO;
		for (Map.Entry<String, List<BigDecimal>> entry : byCompetency.entrySet()) {
			BigDecimal points = competencyPoints == null ? null : competencyPoints.get(entry.getKey());
			if (points == null) {
				throw new ConfigurationMissingException("No point value configured for competency " + entry.getKey()
						+ " in feedback cycle " + cycle.cycleId());
			}
			BigDecimal sum = entry.getValue().stream().reduce(ScoreMath.ZERO, BigDecimal::add);
			BigDecimal average = ScoreMath.divide(sum, BigDecimal.valueOf(entry.getValue().size()));
			weightedTotal = weightedTotal.add(average.multiply(points));
			pointTotal = pointTotal.add(points);
		}

		BigDecimal weightedAverage = ScoreMath.divide(weightedTotal, pointTotal);
		BigDecimal score = ScoreMath.min(ScoreMath.divide(weightedAverage, scaleMax).multiply(maxPoints), maxPoints);
		FeedbackCompletion completion = responded.size() >= invited.size()
				? FeedbackCompletion.COMPLETE
				: FeedbackCompletion.PARTIAL;
		return new FeedbackResult(
				cycle.cycleId(),
				cycle.staffId(),
				cycle.reviewPeriodId(),
				ScoreMath.round(score),
				ScoreMath.round(maxPoints),
				ScoreMath.round(ScoreMath.percentOf(score, maxPoints)),
				completion,
				responded.size(),
				invited.size()
		);
	}

	public ContributionRecord toContribution(FeedbackCycle cycle, FeedbackResult result) {
		return new ContributionRecord(
				cycle.cycleId(),
				cycle.staffId(),
				cycle.reviewPeriodId(),
				cycle.categoryId(),
				cycle.reviewTypeId(),
				result.finalScore(),
				result.completion() != FeedbackCompletion.NOT_STARTED
		);
	}
}
