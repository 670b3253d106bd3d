package my.performancemanager.app.scoring;

public enum FeedbackCompletion {
	NOT_STARTED,
	PARTIAL,
	COMPLETE
}
