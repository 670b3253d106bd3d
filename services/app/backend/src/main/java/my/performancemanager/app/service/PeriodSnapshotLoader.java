package my.performancemanager.app.service;

import my.performancemanager.app.config.AppProperties;
import my.performancemanager.app.repository.PerformanceSnapshotRepository;
import my.performancemanager.app.scoring.CategoryWeightResolver;
import my.performancemanager.app.scoring.FeedbackCycle;
import my.performancemanager.app.scoring.OrganizationLevel;
import my.performancemanager.app.scoring.OrganizationalUnit;
import my.performancemanager.app.scoring.ReviewPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class PeriodSnapshotLoader {
	private static final Logger logger = LoggerFactory.getLogger(PeriodSnapshotLoader.class);

	private final PerformanceSnapshotRepository repository;
	private final AppProperties properties;

	public PeriodSnapshotLoader(PerformanceSnapshotRepository repository, AppProperties properties) {
		this.repository = repository;
		this.properties = properties;
	}

	@Transactional(readOnly = true)
	public PeriodSnapshot loadStaff(String reviewPeriodId, String staffId) {
		ReviewPeriod period = requirePeriod(reviewPeriodId);
		String officeId = repository.findOfficeOfStaff(staffId)
				.orElseThrow(() -> new IllegalArgumentException("Staff member not found: " + staffId));
		Map<String, List<String>> staffByOffice = Map.of(officeId, List.of(staffId));
		return assemble(period, List.of(), staffByOffice);
	}

	@Transactional(readOnly = true)
	public PeriodSnapshot loadUnit(String reviewPeriodId, OrganizationLevel level, String unitId) {
		ReviewPeriod period = requirePeriod(reviewPeriodId);
		List<OrganizationalUnit> allUnits = repository.findUnits();
		OrganizationalUnit root = allUnits.stream()
				.filter(unit -> unit.unitId().equals(unitId))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Organizational unit not found: " + unitId));
		if (root.level() != level) {
			throw new IllegalArgumentException("Unit " + unitId + " is a " + root.level() + ", not a " + level);
		}
		List<OrganizationalUnit> subtree = subtree(allUnits, List.of(root));
		return assemble(period, subtree, repository.findStaffByOffice(officeIds(subtree)));
	}

	@Transactional(readOnly = true)
	public PeriodSnapshot loadLevel(String reviewPeriodId, OrganizationLevel level) {
		ReviewPeriod period = requirePeriod(reviewPeriodId);
		List<OrganizationalUnit> allUnits = repository.findUnits();
		List<OrganizationalUnit> roots = allUnits.stream()
				.filter(unit -> unit.level() == level)
				.toList();
		List<OrganizationalUnit> subtree = subtree(allUnits, roots);
		return assemble(period, subtree, repository.findStaffByOffice(officeIds(subtree)));
	}

	@Transactional(readOnly = true)
	public PeriodSnapshot loadPeriod(String reviewPeriodId) {
		ReviewPeriod period = requirePeriod(reviewPeriodId);
		List<OrganizationalUnit> allUnits = repository.findUnits();
		return assemble(period, allUnits, repository.findStaffByOffice(officeIds(allUnits)));
	}

	private ReviewPeriod requirePeriod(String reviewPeriodId) {
		return repository.findReviewPeriod(reviewPeriodId)
				.orElseThrow(() -> new IllegalArgumentException("Review period not found: " + reviewPeriodId));
	}

	private PeriodSnapshot assemble(ReviewPeriod period,
									List<OrganizationalUnit> units,
									Map<String, List<String>> staffByOffice) {
		String periodId = period.reviewPeriodId();
		Set<String> staffIds = new LinkedHashSet<>();
		staffByOffice.values().forEach(staffIds::addAll);
		List<FeedbackCycle> cycles = repository.findFeedbackCycles(periodId, staffIds);
		List<String> cycleIds = cycles.stream().map(FeedbackCycle::cycleId).toList();
		CategoryWeightResolver weights = new CategoryWeightResolver(repository.findCategoryWeights(periodId),
				properties.scoring().weightTolerance());
		PeriodSnapshot snapshot = new PeriodSnapshot(
				period,
				weights,
				units,
				staffByOffice,
				repository.findContributions(periodId, staffIds),
				repository.findWorkProducts(periodId, staffIds),
				repository.findCompetencyTargets(periodId, staffIds),
				repository.findCompetencyRatings(periodId, staffIds),
				repository.findClosedGaps(periodId, staffIds),
				cycles,
				repository.findFeedbackRatings(cycleIds),
				repository.findFeedbackCompetencyPoints(periodId)
		);
		logger.debug("Loaded snapshot for period {}: {} units, {} staff, {} feedback cycles",
				periodId, units.size(), staffIds.size(), cycles.size());
		return snapshot;
	}

	private List<OrganizationalUnit> subtree(List<OrganizationalUnit> allUnits, List<OrganizationalUnit> roots) {
		Map<String, List<OrganizationalUnit>> children = new LinkedHashMap<>();
		for (OrganizationalUnit unit : allUnits) {
			if (unit.parentUnitId() != null) {
				children.computeIfAbsent(unit.parentUnitId(), key -> new ArrayList<>()).add(unit);
			}
		}
		Map<String, OrganizationalUnit> collected = new LinkedHashMap<>();
		Deque<OrganizationalUnit> pending = new ArrayDeque<>(roots);
		while (!pending.isEmpty()) {
			OrganizationalUnit unit = pending.pop();
			if (collected.putIfAbsent(unit.unitId(), unit) != null) {
				continue;
			}
			pending.addAll(children.getOrDefault(unit.unitId(), List.of()));
		}
		return new ArrayList<>(collected.values());
	}

	private Collection<String> officeIds(List<OrganizationalUnit> units) {
		return units.stream()
				.filter(unit -> unit.level() == OrganizationLevel.OFFICE)
				.map(OrganizationalUnit::unitId)
				.toList();
	}
}
