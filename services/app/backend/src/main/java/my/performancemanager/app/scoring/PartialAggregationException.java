package my.performancemanager.app.scoring;

public class PartialAggregationException extends ScoringException {
	private final String unitId;

	public PartialAggregationException(String unitId, String message) {
		super(message);
		this.unitId = unitId;
	}

	public PartialAggregationException(String unitId, String message, Throwable cause) {
		super(message, cause);
		this.unitId = unitId;
	}

	public String getUnitId() {
		return unitId;
	}
}
