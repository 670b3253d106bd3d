package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a percentage score onto the five performance grade bands. Bands are lower-bound inclusive
 * and together cover [0, 100] without gaps; the top band includes 100.
 */
public class GradeClassifier {
	private static final BigDecimal MIN = BigDecimal.ZERO;
	private static final BigDecimal MAX = new BigDecimal("100");
	private static final List<PerformanceGrade> DESCENDING = Arrays.stream(PerformanceGrade.values())
			.sorted(Comparator.comparing(PerformanceGrade::lowerBound).reversed())
			.toList();

	public PerformanceGrade classify(BigDecimal percentage) {
		if (percentage == null) {
			throw new OutOfRangeInputException("Percentage is required");
		}
		if (percentage.compareTo(MIN) < 0 || percentage.compareTo(MAX) > 0) {
			throw new OutOfRangeInputException("Percentage " + percentage.toPlainString() + " is outside [0, 100]");
		}
		for (PerformanceGrade grade : DESCENDING) {
			if (percentage.compareTo(grade.lowerBound()) >= 0) {
				return grade;
			}
		}
		return PerformanceGrade.DEVELOPING;
	}

	public boolean isUnderPerforming(BigDecimal percentage) {
		return classify(percentage) == PerformanceGrade.DEVELOPING;
	}
}
