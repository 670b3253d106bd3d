package my.performancemanager.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;

@Entity
@Table(name = "competency_gaps")
public class CompetencyGap {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "competency_gap_id")
	private Long competencyGapId;

	@Column(name = "staff_id", nullable = false)
	private String staffId;

	@Column(name = "review_period_id", nullable = false)
	private String reviewPeriodId;

	@Column(name = "competency_id", nullable = false)
	private String competencyId;

	@Column(name = "category_id")
	private String categoryId;

	@Column(name = "expected_rating", nullable = false)
	private BigDecimal expectedRating;

	@Column(name = "actual_rating", nullable = false)
	private BigDecimal actualRating;

	@Column(name = "gap", nullable = false)
	private BigDecimal gap;

	@Column(name = "have_gap", nullable = false)
	private boolean haveGap;

	@Embedded
	private AuditFields audit;

	public Long getCompetencyGapId() {
		return competencyGapId;
	}

	public void setCompetencyGapId(Long competencyGapId) {
		this.competencyGapId = competencyGapId;
	}

	public String getStaffId() {
		return staffId;
	}

	public void setStaffId(String staffId) {
		this.staffId = staffId;
	}

	public String getReviewPeriodId() {
		return reviewPeriodId;
	}

	public void setReviewPeriodId(String reviewPeriodId) {
		this.reviewPeriodId = reviewPeriodId;
	}

	public String getCompetencyId() {
		return competencyId;
	}

	public void setCompetencyId(String competencyId) {
		this.competencyId = competencyId;
	}

	public String getCategoryId() {
		return categoryId;
	}

	public void setCategoryId(String categoryId) {
		this.categoryId = categoryId;
	}

	public BigDecimal getExpectedRating() {
		return expectedRating;
	}

	public void setExpectedRating(BigDecimal expectedRating) {
		this.expectedRating = expectedRating;
	}

	public BigDecimal getActualRating() {
		return actualRating;
	}

	public void setActualRating(BigDecimal actualRating) {
		this.actualRating = actualRating;
	}

	public BigDecimal getGap() {
		return gap;
	}

	public void setGap(BigDecimal gap) {
		this.gap = gap;
	}

	public boolean isHaveGap() {
		return haveGap;
	}

	public void setHaveGap(boolean haveGap) {
		this.haveGap = haveGap;
	}

	public AuditFields getAudit() {
		return audit;
	}

	public void setAudit(AuditFields audit) {
		this.audit = audit;
	}
}
