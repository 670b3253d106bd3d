package my.performancemanager.app.service;

import my.performancemanager.app.dto.UnitLevelSummaryDto;
import my.performancemanager.app.scoring.CompetencyGapRecord;
import my.performancemanager.app.scoring.ExcludedUnit;
import my.performancemanager.app.scoring.FeedbackResult;
import my.performancemanager.app.scoring.OfficeRollupInput;
import my.performancemanager.app.scoring.OrganizationLevel;
import my.performancemanager.app.scoring.OrganizationalUnit;
import my.performancemanager.app.scoring.OrganizationalUnitSummary;
import my.performancemanager.app.scoring.PartialAggregationException;
import my.performancemanager.app.scoring.RollupAggregator;
import my.performancemanager.app.scoring.StaffOutcome;
import my.performancemanager.app.scoring.UnitOutcome;
import my.performancemanager.app.scoring.WorkProductEvaluation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
public class UnitSummaryService {
	private static final Logger logger = LoggerFactory.getLogger(UnitSummaryService.class);

	private final PeriodSnapshotLoader snapshotLoader;
	private final StaffScoringService staffScoringService;
	private final CompetencyGapService competencyGapService;
	private final RollupAggregator rollupAggregator;
	private final ExecutorService scoringExecutor;

	public UnitSummaryService(PeriodSnapshotLoader snapshotLoader,
							  StaffScoringService staffScoringService,
							  CompetencyGapService competencyGapService,
							  RollupAggregator rollupAggregator,
							  @Qualifier("scoringExecutor") ExecutorService scoringExecutor) {
		this.snapshotLoader = snapshotLoader;
		this.staffScoringService = staffScoringService;
		this.competencyGapService = competencyGapService;
		this.rollupAggregator = rollupAggregator;
		this.scoringExecutor = scoringExecutor;
	}

	public OrganizationalUnitSummary computeUnitSummary(String unitId, OrganizationLevel level, String reviewPeriodId) {
		return computeUnitSummary(unitId, level, reviewPeriodId, false);
	}

	public OrganizationalUnitSummary computeUnitSummary(String unitId,
														OrganizationLevel level,
														String reviewPeriodId,
														boolean strict) {
		PeriodSnapshot snapshot = snapshotLoader.loadUnit(reviewPeriodId, level, unitId);
		snapshot.weights().requireConsistent(snapshot.period());
		UnitOutcome outcome = aggregate(snapshot, level).get(unitId);
		if (outcome == null || !outcome.succeeded()) {
			String reason = outcome == null ? "no result" : outcome.failure();
			throw new PartialAggregationException(unitId, "Unit " + unitId + " could not be aggregated: " + reason);
		}
		OrganizationalUnitSummary summary = outcome.summary();
		if (summary.partial()) {
			logger.warn("Summary for {} {} in period {} is partial: {} of {} units covered, excluded={}",
					level, unitId, reviewPeriodId, summary.coveredUnits(), summary.expectedUnits(), summary.excludedUnits());
		}
		return strict ? rollupAggregator.requireComplete(summary) : summary;
	}

	public UnitLevelSummaryDto computeLevelSummaries(OrganizationLevel level, String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadLevel(reviewPeriodId, level);
		snapshot.weights().requireConsistent(snapshot.period());
		Map<String, UnitOutcome> outcomes = aggregate(snapshot, level);
		List<OrganizationalUnitSummary> summaries = new ArrayList<>();
		List<ExcludedUnit> excluded = new ArrayList<>();
		for (OrganizationalUnit unit : snapshot.unitsAt(level)) {
			UnitOutcome outcome = outcomes.get(unit.unitId());
			if (outcome != null && outcome.succeeded()) {
				summaries.add(outcome.summary());
			} else {
				excluded.add(new ExcludedUnit(unit.unitId(), outcome == null ? "no result" : outcome.failure()));
			}
		}
		return new UnitLevelSummaryDto(reviewPeriodId, level, summaries, excluded);
	}

	Map<String, UnitOutcome> aggregate(PeriodSnapshot snapshot, OrganizationLevel topLevel) {
		Map<String, StaffWork> staffWork = scoreStaff(snapshot);
		Map<String, UnitOutcome> outcomes = new HashMap<>();
		// Each level starts only after every unit of the level below has finished.
		for (OrganizationLevel level = OrganizationLevel.OFFICE; level != null && level.compareTo(topLevel) <= 0;
			 level = level.parent()) {
			Map<String, UnitOutcome> completed = Map.copyOf(outcomes);
			List<OrganizationalUnit> units = snapshot.unitsAt(level);
			Map<String, ParallelRunner.Result<OrganizationalUnitSummary>> results = ParallelRunner.runAll(
					units.stream().map(OrganizationalUnit::unitId).toList(),
					unitId -> summarize(snapshot, snapshot.unit(unitId), staffWork, completed),
					scoringExecutor);
			results.forEach((unitId, result) -> {
				if (result.succeeded()) {
					outcomes.put(unitId, UnitOutcome.summarized(result.value()));
				} else {
					logger.warn("Aggregation of unit {} failed: {}", unitId, result.failureMessage());
					outcomes.put(unitId, UnitOutcome.failed(unitId, result.failureMessage()));
				}
			});
			logger.debug("Aggregated {} units at level {} for period {}", units.size(), level, snapshot.reviewPeriodId());
		}
		return outcomes;
	}

	private OrganizationalUnitSummary summarize(PeriodSnapshot snapshot,
												OrganizationalUnit unit,
												Map<String, StaffWork> staffWork,
												Map<String, UnitOutcome> completed) {
		if (unit.level() != OrganizationLevel.OFFICE) {
			List<UnitOutcome> children = new ArrayList<>();
			for (OrganizationalUnit child : snapshot.childrenOf(unit.unitId())) {
				UnitOutcome outcome = completed.get(child.unitId());
				children.add(outcome == null ? UnitOutcome.failed(child.unitId(), "no result") : outcome);
			}
			return rollupAggregator.summarizeParent(unit, snapshot.reviewPeriodId(), children);
		}
		List<StaffOutcome> staff = new ArrayList<>();
		List<WorkProductEvaluation> workProducts = new ArrayList<>();
		List<FeedbackResult> feedback = new ArrayList<>();
		List<CompetencyGapRecord> gaps = new ArrayList<>();
		for (String staffId : snapshot.staffOf(unit.unitId())) {
			StaffWork work = staffWork.get(staffId);
			if (work == null) {
				staff.add(StaffOutcome.failed(staffId, "no result"));
				continue;
			}
			staff.add(work.outcome());
			workProducts.addAll(snapshot.workProductsFor(staffId));
			feedback.addAll(work.feedback());
			gaps.addAll(work.gaps());
		}
		return rollupAggregator.summarizeOffice(new OfficeRollupInput(unit, snapshot.reviewPeriodId(),
				snapshot.period().endDate(), staff, workProducts, feedback, gaps, snapshot.closedGaps()));
	}

	private Map<String, StaffWork> scoreStaff(PeriodSnapshot snapshot) {
		Map<String, ParallelRunner.Result<StaffWork>> results = ParallelRunner.runAll(snapshot.allStaff(),
				staffId -> new StaffWork(
						StaffOutcome.scored(staffScoringService.score(snapshot, staffId)),
						staffScoringService.feedback(snapshot, staffId),
						competencyGapService.gaps(snapshot, staffId)),
				scoringExecutor);
		Map<String, StaffWork> work = new HashMap<>();
		results.forEach((staffId, result) -> {
			if (result.succeeded()) {
				work.put(staffId, result.value());
			} else {
				logger.warn("Scoring of staff {} in period {} failed: {}", staffId, snapshot.reviewPeriodId(),
						result.failureMessage());
				work.put(staffId, new StaffWork(StaffOutcome.failed(staffId, result.failureMessage()), List.of(), List.of()));
			}
		});
		return work;
	}

	private record StaffWork(StaffOutcome outcome, List<FeedbackResult> feedback, List<CompetencyGapRecord> gaps) {
	}
}
