package my.performancemanager.app.scoring;

public enum CategoryType {
	WORK_PRODUCT,
	OBJECTIVE,
	COMPETENCY,
	FEEDBACK,
	DEDUCTION;

	public boolean isDeduction() {
		return this == DEDUCTION;
	}
}
