package my.performancemanager.app.service;

import my.performancemanager.app.config.AppProperties;
import my.performancemanager.app.dto.PeriodRecomputationDto;
import my.performancemanager.app.dto.ScoringJobResponseDto;
import my.performancemanager.app.dto.ScoringJobStatus;
import my.performancemanager.app.scoring.InconsistentWeightException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PeriodScoringJobServiceTest {
	@Mock
	private PeriodRecomputationService recomputationService;

	private PeriodScoringJobService jobService;

	@BeforeEach
	void setup() {
		AppProperties properties = new AppProperties(new AppProperties.Scoring(new BigDecimal("0.01"), 2, 1, 30, "system"));
		jobService = new PeriodScoringJobService(recomputationService, properties);
	}

	@AfterEach
	void tearDown() {
		jobService.shutdown();
	}

	@Test
	void jobCompletesWithRecomputationResult() throws Exception {
		PeriodRecomputationDto recomputation = new PeriodRecomputationDto("P1", 3, 2, List.of());
		when(recomputationService.recompute("P1")).thenReturn(recomputation);

		ScoringJobResponseDto started = jobService.start("P1");
		ScoringJobResponseDto finished = awaitCompletion(started.jobId());

		assertThat(finished.status()).isEqualTo(ScoringJobStatus.DONE);
		assertThat(finished.result()).isEqualTo(recomputation);
		assertThat(finished.error()).isNull();
	}

	@Test
	void failedJobReportsOnlyErrorReference() throws Exception {
		when(recomputationService.recompute("P1"))
				.thenThrow(new InconsistentWeightException("P1", List.of("category WP weights sum to 90% instead of 100%")));

		ScoringJobResponseDto started = jobService.start("P1");
		ScoringJobResponseDto finished = awaitCompletion(started.jobId());

		assertThat(finished.status()).isEqualTo(ScoringJobStatus.FAILED);
		assertThat(finished.error()).matches("Error ref SC-[0-9A-F]{8}");
	}

	@Test
	void unknownJobIsNotFound() {
		assertThatThrownBy(() -> jobService.get("missing"))
				.isInstanceOf(ResponseStatusException.class)
				.satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
	}

	@Test
	void blankPeriodIsRejected() {
		assertThatThrownBy(() -> jobService.start(" ")).isInstanceOf(IllegalArgumentException.class);
	}

	private ScoringJobResponseDto awaitCompletion(String jobId) throws InterruptedException {
		for (int attempt = 0; attempt < 100; attempt++) {
			ScoringJobResponseDto job = jobService.get(jobId);
			if (job.status() == ScoringJobStatus.DONE || job.status() == ScoringJobStatus.FAILED) {
				return job;
			}
			Thread.sleep(50);
		}
		fail("Scoring job did not finish");
		return null;
	}
}
