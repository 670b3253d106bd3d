package my.performancemanager.app.repository;

import my.performancemanager.app.scoring.CategoryWeight;
import my.performancemanager.app.scoring.CompetencyRating;
import my.performancemanager.app.scoring.CompetencyTarget;
import my.performancemanager.app.scoring.ContributionRecord;
import my.performancemanager.app.scoring.FeedbackCycle;
import my.performancemanager.app.scoring.FeedbackRating;
import my.performancemanager.app.scoring.GapClosure;
import my.performancemanager.app.scoring.OrganizationalUnit;
import my.performancemanager.app.scoring.ReviewPeriod;
import my.performancemanager.app.scoring.WorkProductEvaluation;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface PerformanceSnapshotRepository {
	Optional<ReviewPeriod> findReviewPeriod(String reviewPeriodId);

	List<CategoryWeight> findCategoryWeights(String reviewPeriodId);

	List<OrganizationalUnit> findUnits();

	Optional<String> findOfficeOfStaff(String staffId);

	Map<String, List<String>> findStaffByOffice(Collection<String> officeUnitIds);

	List<ContributionRecord> findContributions(String reviewPeriodId, Collection<String> staffIds);

	List<WorkProductEvaluation> findWorkProducts(String reviewPeriodId, Collection<String> staffIds);

	List<CompetencyTarget> findCompetencyTargets(String reviewPeriodId, Collection<String> staffIds);

	List<CompetencyRating> findCompetencyRatings(String reviewPeriodId, Collection<String> staffIds);

	Set<GapClosure> findClosedGaps(String reviewPeriodId, Collection<String> staffIds);

	List<FeedbackCycle> findFeedbackCycles(String reviewPeriodId, Collection<String> staffIds);

	List<FeedbackRating> findFeedbackRatings(Collection<String> cycleIds);

	Map<String, BigDecimal> findFeedbackCompetencyPoints(String reviewPeriodId);
}
