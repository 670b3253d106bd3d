package my.performancemanager.app.service;

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
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable view of every input needed for one scoring invocation, read in a single transaction.
 */
public final class PeriodSnapshot {
	private final ReviewPeriod period;
	private final CategoryWeightResolver weights;
	private final Map<String, OrganizationalUnit> units;
	private final Map<String, List<String>> staffByOffice;
	private final Map<String, List<ContributionRecord>> contributions;
	private final Map<String, List<WorkProductEvaluation>> workProducts;
	private final Map<String, List<CompetencyTarget>> competencyTargets;
	private final Map<String, List<CompetencyRating>> competencyRatings;
	private final Set<GapClosure> closedGaps;
	private final Map<String, List<FeedbackCycle>> feedbackCycles;
	private final Map<String, List<FeedbackRating>> feedbackRatings;
	private final Map<String, BigDecimal> feedbackCompetencyPoints;

	PeriodSnapshot(ReviewPeriod period,
				   CategoryWeightResolver weights,
				   Collection<OrganizationalUnit> units,
				   Map<String, List<String>> staffByOffice,
				   List<ContributionRecord> contributions,
				   List<WorkProductEvaluation> workProducts,
				   List<CompetencyTarget> competencyTargets,
				   List<CompetencyRating> competencyRatings,
				   Set<GapClosure> closedGaps,
				   List<FeedbackCycle> feedbackCycles,
				   List<FeedbackRating> feedbackRatings,
				   Map<String, BigDecimal> feedbackCompetencyPoints) {
		this.period = period;
		this.weights = weights;
		Map<String, OrganizationalUnit> unitMap = new LinkedHashMap<>();
		for (OrganizationalUnit unit : units) {
			unitMap.put(unit.unitId(), unit);
		}
		this.units = Map.copyOf(unitMap);
		Map<String, List<String>> staffCopy = new HashMap<>();
		staffByOffice.forEach((office, staff) -> staffCopy.put(office, List.copyOf(staff)));
		this.staffByOffice = Map.copyOf(staffCopy);
		this.contributions = group(contributions, ContributionRecord::staffId);
		this.workProducts = group(workProducts, WorkProductEvaluation::staffId);
		this.competencyTargets = group(competencyTargets, CompetencyTarget::staffId);
		this.competencyRatings = group(competencyRatings, CompetencyRating::staffId);
		this.closedGaps = Set.copyOf(closedGaps);
		this.feedbackCycles = group(feedbackCycles, FeedbackCycle::staffId);
		this.feedbackRatings = group(feedbackRatings, FeedbackRating::cycleId);
		this.feedbackCompetencyPoints = Map.copyOf(feedbackCompetencyPoints);
	}

	public ReviewPeriod period() {
		return period;
	}

	public String reviewPeriodId() {
		return period.reviewPeriodId();
	}

	public CategoryWeightResolver weights() {
		return weights;
	}

	public OrganizationalUnit unit(String unitId) {
		return units.get(unitId);
	}

	public List<OrganizationalUnit> unitsAt(OrganizationLevel level) {
		return units.values().stream()
				.filter(unit -> unit.level() == level)
				.sorted((left, right) -> left.unitId().compareTo(right.unitId()))
				.toList();
	}

	public List<OrganizationalUnit> childrenOf(String unitId) {
		return units.values().stream()
				.filter(unit -> unitId.equals(unit.parentUnitId()))
				.sorted((left, right) -> left.unitId().compareTo(right.unitId()))
				.toList();
	}

	public List<String> staffOf(String officeUnitId) {
		return staffByOffice.getOrDefault(officeUnitId, List.of());
	}

	public List<String> allStaff() {
		List<String> staff = new ArrayList<>();
		staffByOffice.values().forEach(staff::addAll);
		staff.sort(String::compareTo);
		return staff;
	}

	public List<ContributionRecord> contributionsFor(String staffId) {
		return contributions.getOrDefault(staffId, List.of());
	}

	public List<WorkProductEvaluation> workProductsFor(String staffId) {
		return workProducts.getOrDefault(staffId, List.of());
	}

	public List<CompetencyTarget> competencyTargetsFor(String staffId) {
		return competencyTargets.getOrDefault(staffId, List.of());
	}

	public List<CompetencyRating> competencyRatingsFor(String staffId) {
		return competencyRatings.getOrDefault(staffId, List.of());
	}

	public Set<GapClosure> closedGaps() {
		return closedGaps;
	}

	public List<FeedbackCycle> feedbackCyclesFor(String staffId) {
		return feedbackCycles.getOrDefault(staffId, List.of());
	}

	public List<FeedbackRating> feedbackRatingsFor(String cycleId) {
		return feedbackRatings.getOrDefault(cycleId, List.of());
	}

	public Map<String, BigDecimal> feedbackCompetencyPoints() {
		return feedbackCompetencyPoints;
	}

	private static <T> Map<String, List<T>> group(List<T> rows, Function<T, String> key) {
		Map<String, List<T>> grouped = new HashMap<>();
		for (T row : rows) {
			grouped.computeIfAbsent(key.apply(row), ignored -> new ArrayList<>()).add(row);
		}
		Map<String, List<T>> frozen = new HashMap<>();
		grouped.forEach((id, values) -> frozen.put(id, List.copyOf(values)));
		return Map.copyOf(frozen);
	}
}
