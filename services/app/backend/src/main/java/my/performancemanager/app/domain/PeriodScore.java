package my.performancemanager.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.performancemanager.app.scoring.PerformanceGrade;

import java.math.BigDecimal;

@Entity
@Table(name = "period_scores")
public class PeriodScore {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "period_score_id")
	private Long periodScoreId;

	@Column(name = "staff_id", nullable = false)
	private String staffId;

	@Column(name = "review_period_id", nullable = false)
	private String reviewPeriodId;

	@Column(name = "deducted_points", nullable = false)
	private BigDecimal deductedPoints;

	@Column(name = "final_score", nullable = false)
	private BigDecimal finalScore;

	@Column(name = "max_points", nullable = false)
	private BigDecimal maxPoints;

	@Column(name = "percentage", nullable = false)
	private BigDecimal percentage;

	@Enumerated(EnumType.STRING)
	@Column(name = "grade", nullable = false)
	private PerformanceGrade grade;

	@Column(name = "under_performing", nullable = false)
	private boolean underPerforming;

	@Embedded
	private AuditFields audit;

	public Long getPeriodScoreId() {
		return periodScoreId;
	}

	public void setPeriodScoreId(Long periodScoreId) {
		this.periodScoreId = periodScoreId;
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

	public BigDecimal getDeductedPoints() {
		return deductedPoints;
	}

	public void setDeductedPoints(BigDecimal deductedPoints) {
		this.deductedPoints = deductedPoints;
	}

	public BigDecimal getFinalScore() {
		return finalScore;
	}

	public void setFinalScore(BigDecimal finalScore) {
		this.finalScore = finalScore;
	}

	public BigDecimal getMaxPoints() {
		return maxPoints;
	}

	public void setMaxPoints(BigDecimal maxPoints) {
		this.maxPoints = maxPoints;
	}

	public BigDecimal getPercentage() {
		return percentage;
	}

	public void setPercentage(BigDecimal percentage) {
		this.percentage = percentage;
	}

	public PerformanceGrade getGrade() {
		return grade;
	}

	public void setGrade(PerformanceGrade grade) {
		this.grade = grade;
	}

	public boolean isUnderPerforming() {
		return underPerforming;
	}

	public void setUnderPerforming(boolean underPerforming) {
		this.underPerforming = underPerforming;
	}

	public AuditFields getAudit() {
		return audit;
	}

	public void setAudit(AuditFields audit) {
		this.audit = audit;
	}
}
