package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public enum PerformanceGrade {
	DEVELOPING("Developing", new BigDecimal("0")),
	PROGRESSIVE("Progressive", new BigDecimal("50")),
	COMPETENT("Competent", new BigDecimal("66")),
	ACCOMPLISHED("Accomplished", new BigDecimal("80")),
	EXEMPLARY("Exemplary", new BigDecimal("90"));

	private final String displayName;
	private final BigDecimal lowerBound;

	PerformanceGrade(String displayName, BigDecimal lowerBound) {
		this.displayName = displayName;
		this.lowerBound = lowerBound;
	}

	public String displayName() {
		return displayName;
	}

	public BigDecimal lowerBound() {
		return lowerBound;
	}
}
