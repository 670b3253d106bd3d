package my.performancemanager.app.service;

import my.performancemanager.app.config.AppProperties;
import my.performancemanager.app.dto.WeightValidationDto;
import my.performancemanager.app.repository.PerformanceSnapshotRepository;
import my.performancemanager.app.scoring.CategoryWeightResolver;
import my.performancemanager.app.scoring.ContributionRecord;
import my.performancemanager.app.scoring.FeedbackAggregator;
import my.performancemanager.app.scoring.FeedbackCycle;
import my.performancemanager.app.scoring.FeedbackResult;
import my.performancemanager.app.scoring.ReviewPeriod;
import my.performancemanager.app.scoring.ScoreAccumulator;
import my.performancemanager.app.scoring.StaffPeriodScore;
import my.performancemanager.app.scoring.WorkProductEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class StaffScoringService {
	private static final Logger logger = LoggerFactory.getLogger(StaffScoringService.class);

	private final PeriodSnapshotLoader snapshotLoader;
	private final PerformanceSnapshotRepository snapshotRepository;
	private final ScoreAccumulator scoreAccumulator;
	private final FeedbackAggregator feedbackAggregator;
	private final ScoreResultWriter resultWriter;
	private final AppProperties properties;

	public StaffScoringService(PeriodSnapshotLoader snapshotLoader,
							   PerformanceSnapshotRepository snapshotRepository,
							   ScoreAccumulator scoreAccumulator,
							   FeedbackAggregator feedbackAggregator,
							   ScoreResultWriter resultWriter,
							   AppProperties properties) {
		this.snapshotLoader = snapshotLoader;
		this.snapshotRepository = snapshotRepository;
		this.scoreAccumulator = scoreAccumulator;
		this.feedbackAggregator = feedbackAggregator;
		this.resultWriter = resultWriter;
		this.properties = properties;
	}

	public StaffPeriodScore computeStaffScore(String staffId, String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadStaff(reviewPeriodId, staffId);
		snapshot.weights().requireConsistent(snapshot.period());
		StaffPeriodScore score = score(snapshot, staffId);
		resultWriter.replaceScore(score);
		logger.info("Computed score for staff {} in period {}: {}% ({})",
				staffId, reviewPeriodId, score.percentage(), score.grade());
		return score;
	}

	public List<FeedbackResult> computeFeedback(String staffId, String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadStaff(reviewPeriodId, staffId);
		return feedback(snapshot, staffId);
	}

	public WeightValidationDto validateWeights(String reviewPeriodId) {
		ReviewPeriod period = snapshotRepository.findReviewPeriod(reviewPeriodId)
				.orElseThrow(() -> new IllegalArgumentException("Review period not found: " + reviewPeriodId));
		CategoryWeightResolver resolver = new CategoryWeightResolver(snapshotRepository.findCategoryWeights(reviewPeriodId),
				properties.scoring().weightTolerance());
		List<String> violations = resolver.validate(period);
		return new WeightValidationDto(reviewPeriodId, violations.isEmpty(), violations);
	}

	StaffPeriodScore score(PeriodSnapshot snapshot, String staffId) {
		List<ContributionRecord> records = new ArrayList<>(snapshot.contributionsFor(staffId));
		for (WorkProductEvaluation workProduct : snapshot.workProductsFor(staffId)) {
			records.add(workProduct.toContribution());
		}
		for (FeedbackCycle cycle : snapshot.feedbackCyclesFor(staffId)) {
			FeedbackResult result = feedbackAggregator.aggregate(cycle, snapshot.feedbackRatingsFor(cycle.cycleId()),
					snapshot.feedbackCompetencyPoints());
			records.add(feedbackAggregator.toContribution(cycle, result));
		}
		return scoreAccumulator.accumulate(staffId, snapshot.period(), records, snapshot.weights());
	}

	List<FeedbackResult> feedback(PeriodSnapshot snapshot, String staffId) {
		List<FeedbackResult> results = new ArrayList<>();
		for (FeedbackCycle cycle : snapshot.feedbackCyclesFor(staffId)) {
			results.add(feedbackAggregator.aggregate(cycle, snapshot.feedbackRatingsFor(cycle.cycleId()),
					snapshot.feedbackCompetencyPoints()));
		}
		return results;
	}
}
