package my.performancemanager.app.scoring;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ReviewPeriod(String reviewPeriodId,
						   String name,
						   BigDecimal maxPoints,
						   LocalDate startDate,
						   LocalDate endDate) {
}
