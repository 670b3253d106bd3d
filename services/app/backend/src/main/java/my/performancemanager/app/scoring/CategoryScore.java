package my.performancemanager.app.scoring;

import java.math.BigDecimal;

public record CategoryScore(String categoryId,
							CategoryType categoryType,
							int recordCount,
							BigDecimal rawPoints,
							BigDecimal cappedPoints,
							BigDecimal maxPoints,
							BigDecimal periodSharePercent,
							BigDecimal score) {
}
