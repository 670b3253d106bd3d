package my.performancemanager.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.performancemanager.app.scoring.ConfigurationMissingException;
import my.performancemanager.app.scoring.InconsistentWeightException;
import my.performancemanager.app.scoring.OutOfRangeInputException;
import my.performancemanager.app.scoring.PartialAggregationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);
	private static final HttpStatusCode UNPROCESSABLE = HttpStatusCode.valueOf(422);

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(OutOfRangeInputException.class)
	public ProblemDetail handleOutOfRange(OutOfRangeInputException ex, HttpServletRequest request) {
		logger.warn("Out of range input on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Out of range input", ex.getMessage(), request);
	}

	@ExceptionHandler(ConfigurationMissingException.class)
	public ProblemDetail handleConfigurationMissing(ConfigurationMissingException ex, HttpServletRequest request) {
		logger.warn("Missing scoring configuration on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(UNPROCESSABLE, "Configuration missing", ex.getMessage(), request);
	}

	@ExceptionHandler(InconsistentWeightException.class)
	public ProblemDetail handleInconsistentWeights(InconsistentWeightException ex, HttpServletRequest request) {
		logger.warn("Inconsistent category weights for period {} on {}: {}",
				ex.getReviewPeriodId(), request.getRequestURI(), ex.violations());
		ProblemDetail detail = problem(UNPROCESSABLE, "Inconsistent category weights",
				"Category weights for review period " + ex.getReviewPeriodId() + " are inconsistent.", request);
		detail.setProperty("violations", ex.violations());
		return detail;
	}

	@ExceptionHandler(PartialAggregationException.class)
	public ProblemDetail handlePartialAggregation(PartialAggregationException ex, HttpServletRequest request) {
		logger.warn("Partial aggregation on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.CONFLICT, "Partial aggregation", ex.getMessage(), request);
		detail.setProperty("unitId", ex.getUnitId());
		return detail;
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ProblemDetail handleResponseStatus(ResponseStatusException ex, HttpServletRequest request) {
		HttpStatusCode status = ex.getStatusCode();
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setDetail(ex.getReason());
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private ProblemDetail problem(HttpStatusCode status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}
}
