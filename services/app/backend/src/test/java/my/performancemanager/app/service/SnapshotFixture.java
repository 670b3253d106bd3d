package my.performancemanager.app.service;

import my.performancemanager.app.scoring.CategoryType;
import my.performancemanager.app.scoring.CategoryWeight;
import my.performancemanager.app.scoring.CategoryWeightResolver;
import my.performancemanager.app.scoring.CompetencyRating;
import my.performancemanager.app.scoring.CompetencyTarget;
import my.performancemanager.app.scoring.ContributionRecord;
import my.performancemanager.app.scoring.FeedbackCycle;
import my.performancemanager.app.scoring.FeedbackRating;
import my.performancemanager.app.scoring.GapClosure;
import my.performancemanager.app.scoring.OrganizationLevel;
import my.performancemanager.app.scoring.OrganizationalUnit;
import my.performancemanager.app.scoring.ReviewPeriod;
import my.performancemanager.app.scoring.WorkProductEvaluation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class SnapshotFixture {
	static final String PERIOD_ID = "P1";
	static final ReviewPeriod PERIOD = new ReviewPeriod(PERIOD_ID, "2025", new BigDecimal("100"),
			LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31));

	private final List<CategoryWeight> weights = new ArrayList<>();
	private final List<OrganizationalUnit> units = new ArrayList<>();
	private final Map<String, List<String>> staffByOffice = new LinkedHashMap<>();
	private final List<ContributionRecord> contributions = new ArrayList<>();
	private final List<WorkProductEvaluation> workProducts = new ArrayList<>();
	private final List<CompetencyTarget> targets = new ArrayList<>();
	private final List<CompetencyRating> ratings = new ArrayList<>();
	private final Set<GapClosure> closedGaps = new HashSet<>();
	private final List<FeedbackCycle> cycles = new ArrayList<>();
	private final List<FeedbackRating> feedbackRatings = new ArrayList<>();
	private final Map<String, BigDecimal> feedbackPoints = new HashMap<>();

	static SnapshotFixture standard() {
		return new SnapshotFixture()
				.weight("COMP", "SUPERVISOR", CategoryType.COMPETENCY, "100", "40")
				.weight("WP", "SUPERVISOR", CategoryType.WORK_PRODUCT, "100", "60");
	}

	SnapshotFixture weight(String categoryId, String reviewType, CategoryType type, String percent, String maxPoints) {
		weights.add(new CategoryWeight(PERIOD_ID, categoryId, reviewType, type, new BigDecimal(percent),
				new BigDecimal(maxPoints), null));
		return this;
	}

	SnapshotFixture unit(String unitId, OrganizationLevel level, String parentUnitId) {
		units.add(new OrganizationalUnit(unitId, unitId + " unit", level, parentUnitId));
		return this;
	}

	SnapshotFixture staff(String officeId, String staffId, String workProductPoints, String competencyPoints) {
		staffByOffice.computeIfAbsent(officeId, key -> new ArrayList<>()).add(staffId);
		contribution(staffId, "WP", workProductPoints);
		contribution(staffId, "COMP", competencyPoints);
		return this;
	}

	SnapshotFixture contribution(String staffId, String categoryId, String points) {
		contributions.add(new ContributionRecord(staffId + "-" + categoryId + "-" + contributions.size(), staffId,
				PERIOD_ID, categoryId, "SUPERVISOR", new BigDecimal(points), true));
		return this;
	}

	SnapshotFixture target(String staffId, String competencyId, String expected) {
		targets.add(new CompetencyTarget(staffId, competencyId, competencyId + " name", "TECH", "Technical",
				new BigDecimal(expected)));
		return this;
	}

	SnapshotFixture rating(String staffId, String competencyId, String value) {
		ratings.add(new CompetencyRating(staffId, competencyId, "SUPERVISOR", "R" + ratings.size(), new BigDecimal(value)));
		return this;
	}

	PeriodSnapshot build() {
		return new PeriodSnapshot(PERIOD, new CategoryWeightResolver(weights), units, staffByOffice, contributions,
				workProducts, targets, ratings, closedGaps, cycles, feedbackRatings, feedbackPoints);
	}
}
