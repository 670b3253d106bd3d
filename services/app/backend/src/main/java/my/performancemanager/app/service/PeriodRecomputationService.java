package my.performancemanager.app.service;

import my.performancemanager.app.dto.PeriodRecomputationDto;
import my.performancemanager.app.scoring.CompetencyGapRecord;
import my.performancemanager.app.scoring.ExcludedUnit;
import my.performancemanager.app.scoring.StaffPeriodScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
public class PeriodRecomputationService {
	private static final Logger logger = LoggerFactory.getLogger(PeriodRecomputationService.class);

	private final PeriodSnapshotLoader snapshotLoader;
	private final StaffScoringService staffScoringService;
	private final CompetencyGapService competencyGapService;
	private final ScoreResultWriter resultWriter;
	private final ExecutorService scoringExecutor;

	public PeriodRecomputationService(PeriodSnapshotLoader snapshotLoader,
									  StaffScoringService staffScoringService,
									  CompetencyGapService competencyGapService,
									  ScoreResultWriter resultWriter,
									  @Qualifier("scoringExecutor") ExecutorService scoringExecutor) {
		this.snapshotLoader = snapshotLoader;
		this.staffScoringService = staffScoringService;
		this.competencyGapService = competencyGapService;
		this.resultWriter = resultWriter;
		this.scoringExecutor = scoringExecutor;
	}

	public PeriodRecomputationDto recompute(String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadPeriod(reviewPeriodId);
		snapshot.weights().requireConsistent(snapshot.period());

		Map<String, ParallelRunner.Result<StaffResult>> results = ParallelRunner.runAll(snapshot.allStaff(),
				staffId -> new StaffResult(staffScoringService.score(snapshot, staffId),
						competencyGapService.gaps(snapshot, staffId)),
				scoringExecutor);

		int scored = 0;
		int storedGaps = 0;
		List<ExcludedUnit> failed = new ArrayList<>();
		for (Map.Entry<String, ParallelRunner.Result<StaffResult>> entry : results.entrySet()) {
			String staffId = entry.getKey();
			ParallelRunner.Result<StaffResult> result = entry.getValue();
			if (!result.succeeded()) {
				logger.warn("Recomputation of staff {} in period {} failed: {}", staffId, reviewPeriodId,
						result.failureMessage());
				failed.add(new ExcludedUnit(staffId, result.failureMessage()));
				continue;
			}
			try {
				storedGaps += resultWriter.replaceResults(result.value().score(), result.value().gaps());
			} catch (RuntimeException ex) {
				logger.error("Storing results of staff {} in period {} failed", staffId, reviewPeriodId, ex);
				failed.add(new ExcludedUnit(staffId, "storing results failed: " + ex.getMessage()));
				continue;
			}
			scored++;
		}
		logger.info("Recomputed period {}: {} staff scored, {} failed, {} competency gaps stored",
				reviewPeriodId, scored, failed.size(), storedGaps);
		return new PeriodRecomputationDto(reviewPeriodId, scored, storedGaps, failed);
	}

	private record StaffResult(StaffPeriodScore score, List<CompetencyGapRecord> gaps) {
	}
}
