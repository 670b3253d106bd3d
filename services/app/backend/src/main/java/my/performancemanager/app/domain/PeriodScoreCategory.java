package my.performancemanager.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.performancemanager.app.scoring.CategoryType;

import java.math.BigDecimal;

@Entity
@Table(name = "period_score_categories")
public class PeriodScoreCategory {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "period_score_category_id")
	private Long periodScoreCategoryId;

	@Column(name = "period_score_id", nullable = false)
	private Long periodScoreId;

	@Column(name = "category_id", nullable = false)
	private String categoryId;

	@Enumerated(EnumType.STRING)
	@Column(name = "category_type", nullable = false)
	private CategoryType categoryType;

	@Column(name = "record_count", nullable = false)
	private int recordCount;

	@Column(name = "raw_points", nullable = false)
	private BigDecimal rawPoints;

	@Column(name = "capped_points", nullable = false)
	private BigDecimal cappedPoints;

	@Column(name = "max_points", nullable = false)
	private BigDecimal maxPoints;

	@Column(name = "period_share_percent", nullable = false)
	private BigDecimal periodSharePercent;

	@Column(name = "score", nullable = false)
	private BigDecimal score;

	public Long getPeriodScoreCategoryId() {
		return periodScoreCategoryId;
	}

	public void setPeriodScoreCategoryId(Long periodScoreCategoryId) {
		this.periodScoreCategoryId = periodScoreCategoryId;
	}

	public Long getPeriodScoreId() {
		return periodScoreId;
	}

	public void setPeriodScoreId(Long periodScoreId) {
		this.periodScoreId = periodScoreId;
	}

	public String getCategoryId() {
		return categoryId;
	}

	public void setCategoryId(String categoryId) {
		this.categoryId = categoryId;
	}

	public CategoryType getCategoryType() {
		return categoryType;
	}

	public void setCategoryType(CategoryType categoryType) {
		this.categoryType = categoryType;
	}

	public int getRecordCount() {
		return recordCount;
	}

	public void setRecordCount(int recordCount) {
		this.recordCount = recordCount;
	}

	public BigDecimal getRawPoints() {
		return rawPoints;
	}

	public void setRawPoints(BigDecimal rawPoints) {
		this.rawPoints = rawPoints;
	}

	public BigDecimal getCappedPoints() {
		return cappedPoints;
	}

	public void setCappedPoints(BigDecimal cappedPoints) {
		this.cappedPoints = cappedPoints;
	}

	public BigDecimal getMaxPoints() {
		return maxPoints;
	}

	public void setMaxPoints(BigDecimal maxPoints) {
		this.maxPoints = maxPoints;
	}

	public BigDecimal getPeriodSharePercent() {
		return periodSharePercent;
	}

	public void setPeriodSharePercent(BigDecimal periodSharePercent) {
		this.periodSharePercent = periodSharePercent;
	}

	public BigDecimal getScore() {
		return score;
	}

	public void setScore(BigDecimal score) {
		this.score = score;
	}
}
