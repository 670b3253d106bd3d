package my.performancemanager.app.dto;

import java.util.List;

public record WeightValidationDto(String reviewPeriodId, boolean valid, List<String> violations) {
}
