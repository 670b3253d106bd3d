package my.performancemanager.app.scoring;

public class OutOfRangeInputException extends ScoringException {
	public OutOfRangeInputException(String message) {
		super(message);
	}
}
