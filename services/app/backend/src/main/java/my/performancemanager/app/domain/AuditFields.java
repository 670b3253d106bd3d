package my.performancemanager.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.LocalDateTime;

@Embeddable
public class AuditFields {
	@Column(name = "computed_at", nullable = false)
	private LocalDateTime computedAt;

	@Column(name = "computed_by", nullable = false)
	private String computedBy;

	public AuditFields() {
	}

	public AuditFields(LocalDateTime computedAt, String computedBy) {
		this.computedAt = computedAt;
		this.computedBy = computedBy;
	}

	public LocalDateTime getComputedAt() {
		return computedAt;
	}

	public void setComputedAt(LocalDateTime computedAt) {
		this.computedAt = computedAt;
	}

	public String getComputedBy() {
		return computedBy;
	}

	public void setComputedBy(String computedBy) {
		this.computedBy = computedBy;
	}
}
