package my.performancemanager.app.repository;

import my.performancemanager.app.scoring.CategoryType;
import my.performancemanager.app.scoring.CategoryWeight;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcPerformanceSnapshotRepository implements PerformanceSnapshotRepository {
	private static final Logger logger = LoggerFactory.getLogger(JdbcPerformanceSnapshotRepository.class);

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	public JdbcPerformanceSnapshotRepository(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
	}

	@Override
	public Optional<ReviewPeriod> findReviewPeriod(String reviewPeriodId) {
		String sql = """
				select review_period_id, name, max_points, start_date, end_date
				from review_periods
				where review_period_id = :reviewPeriodId
				""";
		List<ReviewPeriod> periods = namedParameterJdbcTemplate.query(sql,
				new MapSqlParameterSource("reviewPeriodId", reviewPeriodId),
				(rs, rowNum) -> new ReviewPeriod(
						rs.getString("review_period_id"),
						rs.getString("name"),
						rs.getBigDecimal("max_points"),
						rs.getObject("start_date", LocalDate.class),
						rs.getObject("end_date", LocalDate.class)
				));
		return periods.stream().findFirst();
	}

	@Override
	public List<CategoryWeight> findCategoryWeights(String reviewPeriodId) {
		String sql = """
				select review_period_id, category_id, review_type_id, category_type, weight_percent, max_points, max_count
				from category_weights
				where review_period_id = :reviewPeriodId
				order by category_id, review_type_id
				""";
		return namedParameterJdbcTemplate.query(sql,
				new MapSqlParameterSource("reviewPeriodId", reviewPeriodId),
				(rs, rowNum) -> new CategoryWeight(
						rs.getString("review_period_id"),
						rs.getString("category_id"),
						rs.getString("review_type_id"),
						parseCategoryType(rs.getString("category_type")),
						rs.getBigDecimal("weight_percent"),
						rs.getBigDecimal("max_points"),
						rs.getObject("max_count", Integer.class)
				));
	}

	@Override
	public List<OrganizationalUnit> findUnits() {
		String sql = """
				select unit_id, name, unit_level, parent_unit_id
				from organizational_units
				order by unit_id
				""";
		return namedParameterJdbcTemplate.query(sql, new MapSqlParameterSource(),
				(rs, rowNum) -> new OrganizationalUnit(
						rs.getString("unit_id"),
						rs.getString("name"),
						OrganizationLevel.valueOf(rs.getString("unit_level").trim().toUpperCase(Locale.ROOT)),
						rs.getString("parent_unit_id")
				));
	}

	@Override
	public Optional<String> findOfficeOfStaff(String staffId) {
		List<String> offices = namedParameterJdbcTemplate.queryForList(
				"select office_unit_id from staff_assignments where staff_id = :staffId",
				new MapSqlParameterSource("staffId", staffId), String.class);
		return offices.stream().findFirst();
	}

	@Override
	public Map<String, List<String>> findStaffByOffice(Collection<String> officeUnitIds) {
		Map<String, List<String>> result = new LinkedHashMap<>();
		if (officeUnitIds == null || officeUnitIds.isEmpty()) {
			return result;
		}
		String sql = """
				select office_unit_id, staff_id
				from staff_assignments
				where office_unit_id in (:officeUnitIds)
				order by office_unit_id, staff_id
				""";
		namedParameterJdbcTemplate.query(sql, new MapSqlParameterSource("officeUnitIds", officeUnitIds), rs -> {
			result.computeIfAbsent(rs.getString("office_unit_id"), key -> new ArrayList<>()).add(rs.getString("staff_id"));
		});
		return result;
	}

	@Override
	public List<ContributionRecord> findContributions(String reviewPeriodId, Collection<String> staffIds) {
		if (staffIds == null || staffIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select contribution_id, staff_id, review_period_id, category_id, review_type_id, points, eligible
				from contributions
				where review_period_id = :reviewPeriodId
				  and staff_id in (:staffIds)
				order by staff_id, contribution_id
				""";
		return namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds),
				(rs, rowNum) -> new ContributionRecord(
						rs.getString("contribution_id"),
						rs.getString("staff_id"),
						rs.getString("review_period_id"),
						rs.getString("category_id"),
						rs.getString("review_type_id"),
						rs.getBigDecimal("points"),
						rs.getBoolean("eligible")
				));
	}

	@Override
	public List<WorkProductEvaluation> findWorkProducts(String reviewPeriodId, Collection<String> staffIds) {
		if (staffIds == null || staffIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select work_product_id, staff_id, review_period_id, category_id, review_type_id,
				       timeliness_score, quality_score, output_score, due_date, completion_date, completed, eligible
				from work_products
				where review_period_id = :reviewPeriodId
				  and staff_id in (:staffIds)
				order by staff_id, work_product_id
				""";
		return namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds),
				(rs, rowNum) -> new WorkProductEvaluation(
						rs.getString("work_product_id"),
						rs.getString("staff_id"),
						rs.getString("review_period_id"),
						rs.getString("category_id"),
						rs.getString("review_type_id"),
						rs.getBigDecimal("timeliness_score"),
						rs.getBigDecimal("quality_score"),
						rs.getBigDecimal("output_score"),
						rs.getObject("due_date", LocalDate.class),
						rs.getObject("completion_date", LocalDate.class),
						rs.getBoolean("completed"),
						rs.getBoolean("eligible")
				));
	}

	@Override
	public List<CompetencyTarget> findCompetencyTargets(String reviewPeriodId, Collection<String> staffIds) {
		if (staffIds == null || staffIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select staff_id, competency_id, competency_name, category_id, category_name, expected_rating
				from competency_targets
				where review_period_id = :reviewPeriodId
				  and staff_id in (:staffIds)
				order by staff_id, competency_id
				""";
		return namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds),
				(rs, rowNum) -> new CompetencyTarget(
						rs.getString("staff_id"),
						rs.getString("competency_id"),
						rs.getString("competency_name"),
						rs.getString("category_id"),
						rs.getString("category_name"),
						rs.getBigDecimal("expected_rating")
				));
	}

	@Override
	public List<CompetencyRating> findCompetencyRatings(String reviewPeriodId, Collection<String> staffIds) {
		if (staffIds == null || staffIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select staff_id, competency_id, review_type_id, reviewer_id, rating_value
				from competency_ratings
				where review_period_id = :reviewPeriodId
				  and staff_id in (:staffIds)
				order by staff_id, competency_id, competency_rating_id
				""";
		return namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds),
				(rs, rowNum) -> new CompetencyRating(
						rs.getString("staff_id"),
						rs.getString("competency_id"),
						rs.getString("review_type_id"),
						rs.getString("reviewer_id"),
						rs.getBigDecimal("rating_value")
				));
	}

	@Override
	public Set<GapClosure> findClosedGaps(String reviewPeriodId, Collection<String> staffIds) {
		Set<GapClosure> closures = new HashSet<>();
		if (staffIds == null || staffIds.isEmpty()) {
			return closures;
		}
		String sql = """
				select staff_id, competency_id
				from competency_gap_closures
				where review_period_id = :reviewPeriodId
				  and staff_id in (:staffIds)
				""";
		namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds), rs -> {
			closures.add(new GapClosure(rs.getString("staff_id"), rs.getString("competency_id")));
		});
		return closures;
	}

	@Override
	public List<FeedbackCycle> findFeedbackCycles(String reviewPeriodId, Collection<String> staffIds) {
		if (staffIds == null || staffIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select c.cycle_id, c.staff_id, c.review_period_id, c.category_id, c.review_type_id,
				       c.max_points, c.rating_scale_max, r.reviewer_id
				from feedback_cycles c
				left join feedback_reviewers r on r.cycle_id = c.cycle_id
				where c.review_period_id = :reviewPeriodId
				  and c.staff_id in (:staffIds)
				order by c.cycle_id, r.reviewer_id
				""";
		Map<String, CycleRow> cycles = new LinkedHashMap<>();
		namedParameterJdbcTemplate.query(sql, staffParams(reviewPeriodId, staffIds), rs -> {
			String cycleId = rs.getString("cycle_id");
			CycleRow row = cycles.get(cycleId);
			if (row == null) {
				row = new CycleRow(
						cycleId,
						rs.getString("staff_id"),
						rs.getString("review_period_id"),
						rs.getString("category_id"),
						rs.getString("review_type_id"),
						rs.getBigDecimal("max_points"),
						rs.getBigDecimal("rating_scale_max"),
						new ArrayList<>()
				);
				cycles.put(cycleId, row);
			}
			String reviewerId = rs.getString("reviewer_id");
			if (reviewerId != null) {
				row.reviewerIds().add(reviewerId);
			}
		});
		return cycles.values().stream().map(CycleRow::toCycle).toList();
	}

	@Override
	public List<FeedbackRating> findFeedbackRatings(Collection<String> cycleIds) {
		if (cycleIds == null || cycleIds.isEmpty()) {
			return List.of();
		}
		String sql = """
				select cycle_id, reviewer_id, competency_id, rating
				from feedback_ratings
				where cycle_id in (:cycleIds)
				order by cycle_id, feedback_rating_id
				""";
		return namedParameterJdbcTemplate.query(sql, new MapSqlParameterSource("cycleIds", cycleIds),
				(rs, rowNum) -> new FeedbackRating(
						rs.getString("cycle_id"),
						rs.getString("reviewer_id"),
						rs.getString("competency_id"),
						rs.getBigDecimal("rating")
				));
	}

	@Override
	public Map<String, BigDecimal> findFeedbackCompetencyPoints(String reviewPeriodId) {
		Map<String, BigDecimal> points = new LinkedHashMap<>();
		String sql = """
				select competency_id, point_value
				from feedback_competency_points
				where review_period_id = :reviewPeriodId
				order by competency_id
				""";
		namedParameterJdbcTemplate.query(sql, new MapSqlParameterSource("reviewPeriodId", reviewPeriodId), rs -> {
			points.put(rs.getString("competency_id"), rs.getBigDecimal("point_value"));
		});
		return points;
	}

	private MapSqlParameterSource staffParams(String reviewPeriodId, Collection<String> staffIds) {
		return new MapSqlParameterSource()
				.addValue("reviewPeriodId", reviewPeriodId)
				.addValue("staffIds", staffIds);
	}

	private CategoryType parseCategoryType(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		try {
			return CategoryType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			logger.warn("Unknown category type {} in category weights", raw);
			return null;
		}
	}

	private record CycleRow(String cycleId,
							String staffId,
							String reviewPeriodId,
							String categoryId,
							String reviewTypeId,
							BigDecimal maxPoints,
							BigDecimal ratingScaleMax,
							List<String> reviewerIds) {
		private FeedbackCycle toCycle() {
			return new FeedbackCycle(cycleId, staffId, reviewPeriodId, categoryId, reviewTypeId, maxPoints,
					ratingScaleMax, reviewerIds);
		}
	}
}
