package my.performancemanager.app.dto;

public enum ScoringJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED
}
