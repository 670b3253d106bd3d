package my.performancemanager.app.api;

import my.performancemanager.app.dto.ScoringJobResponseDto;
import my.performancemanager.app.service.PeriodScoringJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ScoringJobController {
	private final PeriodScoringJobService jobService;

	public ScoringJobController(PeriodScoringJobService jobService) {
		this.jobService = jobService;
	}

	@PostMapping("/review-periods/{periodId}/scoring-jobs")
	@ResponseStatus(HttpStatus.ACCEPTED)
	public ScoringJobResponseDto start(@PathVariable("periodId") String periodId) {
		return jobService.start(periodId);
	}

	@GetMapping("/scoring-jobs/{jobId}")
	public ScoringJobResponseDto get(@PathVariable("jobId") String jobId) {
		return jobService.get(jobId);
	}
}
