package my.performancemanager.app.config;

import my.performancemanager.app.scoring.FeedbackAggregator;
import my.performancemanager.app.scoring.GapAnalyzer;
import my.performancemanager.app.scoring.GradeClassifier;
import my.performancemanager.app.scoring.RollupAggregator;
import my.performancemanager.app.scoring.ScoreAccumulator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ScoringConfig {
	@Bean
	public GradeClassifier gradeClassifier() {
		return new GradeClassifier();
	}

	@Bean
	public ScoreAccumulator scoreAccumulator(GradeClassifier gradeClassifier) {
		return new ScoreAccumulator(gradeClassifier);
	}

	@Bean
	public GapAnalyzer gapAnalyzer() {
		return new GapAnalyzer();
	}

	@Bean
	public FeedbackAggregator feedbackAggregator() {
		return new FeedbackAggregator();
	}

	@Bean
	public RollupAggregator rollupAggregator(GradeClassifier gradeClassifier) {
		return new RollupAggregator(gradeClassifier);
	}

	@Bean(name = "scoringExecutor", destroyMethod = "shutdownNow")
	public ExecutorService scoringExecutor(AppProperties properties) {
		int parallelism = properties.scoring().parallelism();
		return new ThreadPoolExecutor(parallelism, parallelism, 30L, TimeUnit.SECONDS,
				new LinkedBlockingQueue<>(), namedThreads("scoring-"));
	}

	static ThreadFactory namedThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
