package my.performancemanager.app.scoring;

public record UnitOutcome(String unitId, OrganizationalUnitSummary summary, String failure) {

	public static UnitOutcome summarized(OrganizationalUnitSummary summary) {
		return new UnitOutcome(summary.unitId(), summary, null);
	}

	public static UnitOutcome failed(String unitId, String failure) {
		return new UnitOutcome(unitId, null, failure == null ? "aggregation failed" : failure);
	}

	public boolean succeeded() {
		return summary != null;
	}
}
