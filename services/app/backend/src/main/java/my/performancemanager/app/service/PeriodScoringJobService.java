package my.performancemanager.app.service;

import jakarta.annotation.PreDestroy;
import my.performancemanager.app.config.AppProperties;
import my.performancemanager.app.dto.PeriodRecomputationDto;
import my.performancemanager.app.dto.ScoringJobResponseDto;
import my.performancemanager.app.dto.ScoringJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class PeriodScoringJobService {
	private static final Logger logger = LoggerFactory.getLogger(PeriodScoringJobService.class);

	private final PeriodRecomputationService recomputationService;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor;
	private final Duration jobTtl;

	public PeriodScoringJobService(PeriodRecomputationService recomputationService, AppProperties properties) {
		this.recomputationService = recomputationService;
		this.jobTtl = Duration.ofMinutes(properties.scoring().jobTtlMinutes());
		AtomicInteger counter = new AtomicInteger();
		this.executor = Executors.newFixedThreadPool(properties.scoring().maxConcurrentJobs(), runnable -> {
			Thread thread = new Thread(runnable, "scoring-job-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	public ScoringJobResponseDto start(String reviewPeriodId) {
		if (reviewPeriodId == null || reviewPeriodId.isBlank()) {
			throw new IllegalArgumentException("Review period is required");
		}
		cleanupExpired();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, reviewPeriodId, Instant.now());
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		logger.info("Queued scoring job {} for period {}", jobId, reviewPeriodId);
		return toDto(job);
	}

	public ScoringJobResponseDto get(String jobId) {
		cleanupExpired();
		JobState job = jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Scoring job not found");
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			job.status = ScoringJobStatus.RUNNING;
			job.result = recomputationService.recompute(job.reviewPeriodId);
			job.status = ScoringJobStatus.DONE;
		} catch (Exception ex) {
			job.status = ScoringJobStatus.FAILED;
			job.error = failWithReference(job, ex);
		} finally {
			job.finishedAt = Instant.now();
		}
	}

	private ScoringJobResponseDto toDto(JobState job) {
		return new ScoringJobResponseDto(
				job.jobId,
				job.reviewPeriodId,
				job.status,
				job.result,
				job.error
		);
	}

	private void cleanupExpired() {
		Instant now = Instant.now();
		jobs.entrySet().removeIf(entry -> {
			JobState job = entry.getValue();
			Instant base = job.finishedAt == null ? job.createdAt : job.finishedAt;
			return base.plus(jobTtl).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String reference = "SC-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Scoring job failed (ref={}, jobId={}, period={}, error={})",
				reference, job.jobId, job.reviewPeriodId, ex.getMessage(), ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String jobId;
		private final String reviewPeriodId;
		private final Instant createdAt;

		private volatile Instant finishedAt;
		private volatile ScoringJobStatus status;
		private volatile PeriodRecomputationDto result;
		private volatile String error;

		private JobState(String jobId, String reviewPeriodId, Instant createdAt) {
			this.jobId = jobId;
			this.reviewPeriodId = reviewPeriodId;
			this.createdAt = createdAt;
			this.status = ScoringJobStatus.PENDING;
		}
	}
}
