package my.performancemanager.app.service;

import my.performancemanager.app.config.AppProperties;
import my.performancemanager.app.domain.AuditFields;
import my.performancemanager.app.domain.CompetencyGap;
import my.performancemanager.app.domain.PeriodScore;
import my.performancemanager.app.domain.PeriodScoreCategory;
import my.performancemanager.app.repository.CompetencyGapRepository;
import my.performancemanager.app.repository.PeriodScoreCategoryRepository;
import my.performancemanager.app.repository.PeriodScoreRepository;
import my.performancemanager.app.scoring.CategoryScore;
import my.performancemanager.app.scoring.CompetencyGapRecord;
import my.performancemanager.app.scoring.StaffPeriodScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class ScoreResultWriter {
	private static final Logger logger = LoggerFactory.getLogger(ScoreResultWriter.class);

	private final PeriodScoreRepository periodScoreRepository;
	private final PeriodScoreCategoryRepository periodScoreCategoryRepository;
	private final CompetencyGapRepository competencyGapRepository;
	private final AppProperties properties;

	public ScoreResultWriter(PeriodScoreRepository periodScoreRepository,
							 PeriodScoreCategoryRepository periodScoreCategoryRepository,
							 CompetencyGapRepository competencyGapRepository,
							 AppProperties properties) {
		this.periodScoreRepository = periodScoreRepository;
		this.periodScoreCategoryRepository = periodScoreCategoryRepository;
		this.competencyGapRepository = competencyGapRepository;
		this.properties = properties;
	}

	@Transactional
	public int replaceResults(StaffPeriodScore score, List<CompetencyGapRecord> gaps) {
		replaceScore(score);
		return replaceGaps(score.staffId(), score.reviewPeriodId(), gaps);
	}

	@Transactional
	public PeriodScore replaceScore(StaffPeriodScore score) {
		periodScoreRepository.findByStaffIdAndReviewPeriodId(score.staffId(), score.reviewPeriodId())
				.ifPresent(existing -> periodScoreCategoryRepository.deleteByPeriodScore(existing.getPeriodScoreId()));
		periodScoreRepository.deleteByStaffAndPeriod(score.staffId(), score.reviewPeriodId());

		PeriodScore entity = new PeriodScore();
		entity.setStaffId(score.staffId());
		entity.setReviewPeriodId(score.reviewPeriodId());
		entity.setDeductedPoints(score.deductedPoints());
		entity.setFinalScore(score.finalScore());
		entity.setMaxPoints(score.maxPoints());
		entity.setPercentage(score.percentage());
		entity.setGrade(score.grade());
		entity.setUnderPerforming(score.underPerforming());
		entity.setAudit(audit());
		PeriodScore saved = periodScoreRepository.save(entity);

		List<PeriodScoreCategory> categories = new ArrayList<>();
		for (CategoryScore category : score.categories()) {
			PeriodScoreCategory row = new PeriodScoreCategory();
			row.setPeriodScoreId(saved.getPeriodScoreId());
			row.setCategoryId(category.categoryId());
			row.setCategoryType(category.categoryType());
			row.setRecordCount(category.recordCount());
			row.setRawPoints(category.rawPoints());
			row.setCappedPoints(category.cappedPoints());
			row.setMaxPoints(category.maxPoints());
			row.setPeriodSharePercent(category.periodSharePercent());
			row.setScore(category.score());
			categories.add(row);
		}
		periodScoreCategoryRepository.saveAll(categories);
		logger.debug("Stored score for staff {} in period {} ({} categories)",
				score.staffId(), score.reviewPeriodId(), categories.size());
		return saved;
	}

	@Transactional
	public int replaceGaps(String staffId, String reviewPeriodId, List<CompetencyGapRecord> gaps) {
		competencyGapRepository.deleteByStaffAndPeriod(staffId, reviewPeriodId);
		AuditFields audit = audit();
		List<CompetencyGap> rows = new ArrayList<>();
		for (CompetencyGapRecord gap : gaps) {
			CompetencyGap row = new CompetencyGap();
			row.setStaffId(staffId);
			row.setReviewPeriodId(reviewPeriodId);
			row.setCompetencyId(gap.competencyId());
			row.setCategoryId(gap.categoryId());
			row.setExpectedRating(gap.expectedRatingValue());
			row.setActualRating(gap.averageActualRatingValue());
			row.setGap(gap.gap());
			row.setHaveGap(gap.haveGap());
			row.setAudit(new AuditFields(audit.getComputedAt(), audit.getComputedBy()));
			rows.add(row);
		}
		competencyGapRepository.saveAll(rows);
		return rows.size();
	}

	private AuditFields audit() {
		return new AuditFields(LocalDateTime.now(), properties.scoring().systemUser());
	}
}
