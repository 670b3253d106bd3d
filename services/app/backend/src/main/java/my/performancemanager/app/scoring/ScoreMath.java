package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class ScoreMath {
	static final BigDecimal ZERO = BigDecimal.ZERO;
	static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	static final int RESULT_SCALE = 2;
	static final int WORKING_SCALE = 10;

	private ScoreMath() {
	}

	static BigDecimal safe(BigDecimal value) {
		return value == null ? ZERO : value;
	}

	static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
		if (divisor == null || divisor.signum() == 0) {
			return ZERO;
		}
		return safe(dividend).divide(divisor, WORKING_SCALE, RoundingMode.HALF_UP);
	}

	static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
		return divide(safe(part).multiply(ONE_HUNDRED), whole);
	}

	static BigDecimal round(BigDecimal value) {
		return safe(value).setScale(RESULT_SCALE, RoundingMode.HALF_UP);
	}

	static BigDecimal min(BigDecimal left, BigDecimal right) {
		return left.compareTo(right) <= 0 ? left : right;
	}

	static BigDecimal max(BigDecimal left, BigDecimal right) {
		return left.compareTo(right) >= 0 ? left : right;
	}
}
