package my.performancemanager.app.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

final class ParallelRunner {
	private ParallelRunner() {
	}

	// Returns only once every task has finished, successfully or not.
	static <T> Map<String, Result<T>> runAll(List<String> ids, Function<String, T> task, Executor executor) {
		Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
		for (String id : ids) {
			futures.put(id, CompletableFuture.supplyAsync(() -> task.apply(id), executor));
		}
		CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
				.handle((ignored, ex) -> null)
				.join();
		Map<String, Result<T>> results = new LinkedHashMap<>();
		futures.forEach((id, future) -> results.put(id, collect(future)));
		return results;
	}

	private static <T> Result<T> collect(CompletableFuture<T> future) {
		try {
			return new Result<>(future.join(), null);
		} catch (CompletionException ex) {
			return new Result<>(null, ex.getCause() == null ? ex : ex.getCause());
		} catch (CancellationException ex) {
			return new Result<>(null, ex);
		}
	}

	record Result<T>(T value, Throwable failure) {
		boolean succeeded() {
			return failure == null;
		}

		String failureMessage() {
			if (failure == null) {
				return null;
			}
			String message = failure.getMessage();
			return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
		}
	}
}
