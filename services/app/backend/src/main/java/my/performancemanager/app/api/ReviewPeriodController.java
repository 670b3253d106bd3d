package my.performancemanager.app.api;

import my.performancemanager.app.dto.UnitLevelSummaryDto;
import my.performancemanager.app.dto.WeightValidationDto;
import my.performancemanager.app.scoring.CompetencyCategorySummary;
import my.performancemanager.app.scoring.CompetencyGapRecord;
import my.performancemanager.app.scoring.FeedbackResult;
import my.performancemanager.app.scoring.OrganizationLevel;
import my.performancemanager.app.scoring.OrganizationalUnitSummary;
import my.performancemanager.app.scoring.StaffPeriodScore;
import my.performancemanager.app.service.CompetencyGapService;
import my.performancemanager.app.service.StaffScoringService;
import my.performancemanager.app.service.UnitSummaryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/review-periods/{periodId}")
public class ReviewPeriodController {
	private final StaffScoringService staffScoringService;
	private final CompetencyGapService competencyGapService;
	private final UnitSummaryService unitSummaryService;

	public ReviewPeriodController(StaffScoringService staffScoringService,
								  CompetencyGapService competencyGapService,
								  UnitSummaryService unitSummaryService) {
		this.staffScoringService = staffScoringService;
		this.competencyGapService = competencyGapService;
		this.unitSummaryService = unitSummaryService;
	}

	@GetMapping("/staff/{staffId}/score")
	public StaffPeriodScore staffScore(@PathVariable("periodId") String periodId,
									   @PathVariable("staffId") String staffId) {
		return staffScoringService.computeStaffScore(staffId, periodId);
	}

	@GetMapping("/staff/{staffId}/competency-gaps")
	public List<CompetencyGapRecord> competencyGaps(@PathVariable("periodId") String periodId,
													@PathVariable("staffId") String staffId) {
		return competencyGapService.computeCompetencyGaps(staffId, periodId);
	}

	@GetMapping("/staff/{staffId}/feedback")
	public List<FeedbackResult> feedback(@PathVariable("periodId") String periodId,
										 @PathVariable("staffId") String staffId) {
		return staffScoringService.computeFeedback(staffId, periodId);
	}

	@GetMapping("/units/{level}")
	public UnitLevelSummaryDto levelSummaries(@PathVariable("periodId") String periodId,
											  @PathVariable("level") String level) {
		return unitSummaryService.computeLevelSummaries(OrganizationLevel.fromPath(level), periodId);
	}

	@GetMapping("/units/{level}/{unitId}/summary")
	public OrganizationalUnitSummary unitSummary(@PathVariable("periodId") String periodId,
												 @PathVariable("level") String level,
												 @PathVariable("unitId") String unitId,
												 @RequestParam(name = "strict", defaultValue = "false") boolean strict) {
		return unitSummaryService.computeUnitSummary(unitId, OrganizationLevel.fromPath(level), periodId, strict);
	}

	@GetMapping("/units/{level}/{unitId}/competency-categories")
	public List<CompetencyCategorySummary> competencyCategories(@PathVariable("periodId") String periodId,
																@PathVariable("level") String level,
																@PathVariable("unitId") String unitId) {
		return competencyGapService.summarizeCategories(unitId, OrganizationLevel.fromPath(level), periodId);
	}

	@GetMapping("/weights/validation")
	public WeightValidationDto weightValidation(@PathVariable("periodId") String periodId) {
		return staffScoringService.validateWeights(periodId);
	}
}
