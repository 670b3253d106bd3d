package my.performancemanager.app.service;

import my.performancemanager.app.scoring.CategoryType;
import my.performancemanager.app.scoring.CategoryWeight;
import my.performancemanager.app.scoring.CategoryWeightResolver;
import my.performancemanager.app.scoring.CompetencyCategorySummary;
import my.performancemanager.app.scoring.CompetencyGapRecord;
import my.performancemanager.app.scoring.CompetencyTarget;
import my.performancemanager.app.scoring.GapAnalyzer;
import my.performancemanager.app.scoring.OrganizationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CompetencyGapService {
	private static final Logger logger = LoggerFactory.getLogger(CompetencyGapService.class);

	private final PeriodSnapshotLoader snapshotLoader;
	private final GapAnalyzer gapAnalyzer;
	private final ScoreResultWriter resultWriter;

	public CompetencyGapService(PeriodSnapshotLoader snapshotLoader,
								GapAnalyzer gapAnalyzer,
								ScoreResultWriter resultWriter) {
		this.snapshotLoader = snapshotLoader;
		this.gapAnalyzer = gapAnalyzer;
		this.resultWriter = resultWriter;
	}

	public List<CompetencyGapRecord> computeCompetencyGaps(String staffId, String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadStaff(reviewPeriodId, staffId);
		List<CompetencyGapRecord> gaps = gaps(snapshot, staffId);
		resultWriter.replaceGaps(staffId, reviewPeriodId, gaps);
		long open = gaps.stream().filter(CompetencyGapRecord::haveGap).count();
		logger.info("Computed {} competency gaps for staff {} in period {} ({} open)",
				gaps.size(), staffId, reviewPeriodId, open);
		return gaps;
	}

	public List<CompetencyCategorySummary> summarizeCategories(String unitId,
															   OrganizationLevel level,
															   String reviewPeriodId) {
		PeriodSnapshot snapshot = snapshotLoader.loadUnit(reviewPeriodId, level, unitId);
		List<CompetencyTarget> targets = new ArrayList<>();
		List<CompetencyGapRecord> gaps = new ArrayList<>();
		for (String staffId : snapshot.allStaff()) {
			targets.addAll(snapshot.competencyTargetsFor(staffId));
			gaps.addAll(gaps(snapshot, staffId));
		}
		return gapAnalyzer.summarizeCategories(targets, gaps);
	}

	List<CompetencyGapRecord> gaps(PeriodSnapshot snapshot, String staffId) {
		return gapAnalyzer.analyze(staffId, snapshot.reviewPeriodId(), snapshot.competencyTargetsFor(staffId),
				snapshot.competencyRatingsFor(staffId), reviewTypeWeights(snapshot));
	}

	// Review-type weights come from the first competency category of the period.
	private Map<String, BigDecimal> reviewTypeWeights(PeriodSnapshot snapshot) {
		CategoryWeightResolver resolver = snapshot.weights();
		Map<String, BigDecimal> weights = new LinkedHashMap<>();
		resolver.categories(snapshot.reviewPeriodId()).stream()
				.filter(category -> category.categoryType() == CategoryType.COMPETENCY)
				.findFirst()
				.ifPresent(category -> {
					for (CategoryWeight row : resolver.rows(snapshot.reviewPeriodId(), category.categoryId())) {
						weights.put(row.reviewTypeId(), row.weightPercent());
					}
				});
		return weights;
	}
}
