package my.performancemanager.app.scoring;

public record StaffOutcome(String staffId, StaffPeriodScore score, String failure) {

	public static StaffOutcome scored(StaffPeriodScore score) {
		return new StaffOutcome(score.staffId(), score, null);
	}

	public static StaffOutcome failed(String staffId, String failure) {
		return new StaffOutcome(staffId, null, failure == null ? "scoring failed" : failure);
	}

	public boolean succeeded() {
		return score != null;
	}
}
