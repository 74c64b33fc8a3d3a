package com.titlesearch.pipeline.recovery;

import com.titlesearch.pipeline.model.DiagnosticEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps free-text error messages onto the {@link ErrorCategory} taxonomy and derives retry and
 * recovery decisions from the category's static policy.
 *
 * <p>Patterns are lowercase phrases that must not be glued to other letters or digits, so "429"
 * does not match inside an instrument number. Categories are tried in declaration order and the
 * first match wins.
 */
@Component
public class ErrorClassifier {
  private static final int MAX_ERROR_LENGTH = 1000;
  private static final int MAX_BACKOFF_EXPONENT = 20;

  private static final Map<ErrorCategory, List<String>> PHRASES = new LinkedHashMap<>();
  private static final Map<ErrorCategory, List<Pattern>> PATTERNS = new LinkedHashMap<>();

  static {
    PHRASES.put(ErrorCategory.NETWORK, List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "connection aborted",
        "network unreachable",
        "network is unreachable",
        "name resolution",
        "dns",
        "socket",
        "err_connection",
        "net::err",
        "unknownhostexception",
        "no such host",
        "name or service not known",
        "ssl handshake",
        "handshake"));
    PHRASES.put(ErrorCategory.TIMEOUT, List.of(
        "timeout",
        "timed out",
        "took too long",
        "deadline exceeded",
        "timeouterror",
        "timeoutexception"));
    PHRASES.put(ErrorCategory.RATE_LIMIT, List.of(
        "rate limit",
        "rate limited",
        "ratelimit",
        "too many requests",
        "429",
        "throttled",
        "throttling",
        "quota exceeded"));
    PHRASES.put(ErrorCategory.AUTHENTICATION, List.of(
        "unauthorized",
        "401",
        "forbidden",
        "403",
        "login required",
        "session expired",
        "authentication failed",
        "authentication required",
        "access denied"));
    PHRASES.put(ErrorCategory.PARSING, List.of(
        "parse error",
        "parsing error",
        "failed to parse",
        "invalid json",
        "json parse",
        "malformed",
        "unexpected token",
        "xml",
        "html parsing",
        "element not found",
        "selector",
        "jsonprocessingexception",
        "jsonparseexception"));
    PHRASES.put(ErrorCategory.SCRAPING, List.of(
        "page not found",
        "404",
        "no results",
        "website unavailable",
        "site unavailable",
        "recorder unavailable",
        "under maintenance",
        "captcha",
        "bot detection",
        "blocked",
        "website structure"));
    PHRASES.put(ErrorCategory.DATABASE, List.of(
        "database",
        "sql",
        "sqlexception",
        "postgres",
        "postgresql",
        "psqlexception",
        "connection pool",
        "deadlock",
        "integrity error",
        "constraint",
        "jdbc",
        "dataaccessexception"));
    PHRASES.put(ErrorCategory.STORAGE, List.of(
        "storage",
        "disk space",
        "disk full",
        "no space left",
        "s3",
        "minio",
        "file not found",
        "nosuchfileexception",
        "accessdeniedexception",
        "permission denied",
        "upload failed"));
    PHRASES.put(ErrorCategory.EXTERNAL_SERVICE, List.of(
        "openai",
        "anthropic",
        "api key",
        "model not found",
        "context length",
        "content policy",
        "analysis service",
        "service unavailable",
        "bad gateway",
        "502",
        "503"));
    PHRASES.put(ErrorCategory.VALIDATION, List.of(
        "validation",
        "invalid",
        "required field",
        "type error",
        "value error",
        "illegalargumentexception"));
    PHRASES.put(ErrorCategory.RESOURCE, List.of(
        "memory",
        "out of memory",
        "outofmemoryerror",
        "oom",
        "resource exhausted",
        "too many open files",
        "cpu"));

    for (Map.Entry<ErrorCategory, List<String>> entry : PHRASES.entrySet()) {
      List<Pattern> compiled = new ArrayList<>();
      for (String phrase : entry.getValue()) {
        compiled.add(Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase) + "(?![a-z0-9])"));
      }
      PATTERNS.put(entry.getKey(), List.copyOf(compiled));
    }
  }

  /** Phrases that define {@code category}, in matching order. Empty for {@link ErrorCategory#UNKNOWN}. */
  public static List<String> phrasesFor(ErrorCategory category) {
    return PHRASES.getOrDefault(category, List.of());
  }

  public ErrorCategory categorize(String error) {
    if (error == null || error.isBlank()) {
      return ErrorCategory.UNKNOWN;
    }
    String lower = error.toLowerCase(Locale.ROOT);
    for (Map.Entry<ErrorCategory, List<Pattern>> entry : PATTERNS.entrySet()) {
      for (Pattern pattern : entry.getValue()) {
        if (pattern.matcher(lower).find()) {
          return entry.getKey();
        }
      }
    }
    return ErrorCategory.UNKNOWN;
  }

  public ErrorDiagnosis diagnose(String error, String stage, int retryCount) {
    ErrorCategory category = categorize(error);
    int safeRetryCount = Math.max(0, retryCount);
    int remaining = Math.max(0, category.maxRetries() - safeRetryCount);
    List<RecoveryAction> actions = remaining == 0
        ? List.of(RecoveryAction.MANUAL_REVIEW, RecoveryAction.ABORT)
        : category.actions();
    return new ErrorDiagnosis(
        category,
        category.severity(),
        category.isTransient(),
        category.baseDelaySeconds(),
        remaining,
        actions,
        actions.get(0),
        category.userMessage(),
        truncate(error),
        stage,
        safeRetryCount);
  }

  public DiagnosticEntry createEntry(String error, String stage, ErrorDiagnosis diagnosis) {
    return new DiagnosticEntry(
        Instant.now(),
        stage,
        truncate(error),
        diagnosis.category(),
        diagnosis.severity(),
        diagnosis.transientError(),
        diagnosis.recommendedAction());
  }

  /**
   * Retries stop once {@code retryCount} reaches the smaller of the caller's and the category's
   * ceiling. Delays double per attempt from the category's base delay.
   */
  public RetryDecision shouldRetry(String error, int retryCount, int maxRetries) {
    ErrorCategory category = categorize(error);
    if (!category.isTransient()) {
      return RetryDecision.NO_RETRY;
    }
    int safeRetryCount = Math.max(0, retryCount);
    int ceiling = Math.min(maxRetries, category.maxRetries());
    if (safeRetryCount >= ceiling) {
      return RetryDecision.NO_RETRY;
    }
    long multiplier = 1L << Math.min(safeRetryCount, MAX_BACKOFF_EXPONENT);
    return new RetryDecision(true, category.baseDelaySeconds() * multiplier);
  }

  /**
   * Entry for a failure the chain carried on past. Warnings keep their category for display but
   * take no part in recovery decisions.
   */
  public DiagnosticEntry createWarningEntry(String error, String stage) {
    return new DiagnosticEntry(
        Instant.now(),
        stage,
        truncate(error),
        categorize(error),
        Severity.WARNING,
        false,
        RecoveryAction.SKIP_STEP);
  }

  public RecoverySuggestions recoverySuggestions(
      List<DiagnosticEntry> errorLog, int consecutiveFailureThreshold) {
    List<DiagnosticEntry> failures = errorLog == null
        ? List.of()
        : errorLog.stream().filter(entry -> !isWarning(entry)).toList();
    if (failures.isEmpty()) {
      return new RecoverySuggestions(
          List.of("No errors recorded. Try running the search again."),
          true,
          new ErrorSummary(0, Map.of(), null, 0),
          null);
    }

    Map<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);
    ErrorCategory mostCommon = null;
    int mostCommonCount = 0;
    for (DiagnosticEntry entry : failures) {
      ErrorCategory category = entry.category() == null ? ErrorCategory.UNKNOWN : entry.category();
      int count = counts.merge(category, 1, Integer::sum);
      // strictly greater keeps the first category to reach the top count
      if (count > mostCommonCount) {
        mostCommon = category;
        mostCommonCount = count;
      }
    }

    int consecutive = 0;
    for (int i = failures.size() - 1; i >= 0; i--) {
      Severity severity = failures.get(i).severity();
      if (severity == null || !severity.isHighOrCritical()) {
        break;
      }
      consecutive++;
    }

    List<String> suggestions = new ArrayList<>(remediationFor(mostCommon));
    boolean canRetry = mostCommon.isResumable();
    if (consecutive >= consecutiveFailureThreshold) {
      suggestions.add(0, "Multiple consecutive failures detected. Manual review recommended.");
      canRetry = false;
    }

    return new RecoverySuggestions(
        List.copyOf(suggestions),
        canRetry,
        new ErrorSummary(failures.size(), Map.copyOf(counts), mostCommon, consecutive),
        failures.get(failures.size() - 1));
  }

  public static boolean isWarning(DiagnosticEntry entry) {
    return entry.severity() != null && entry.severity().isWarning();
  }

  /**
   * Renders an exception as {@code SimpleName: message}, unwrapping executor wrappers and
   * appending the root cause when it differs.
   */
  public static String describe(Throwable error) {
    if (error == null) {
      return "Unknown error";
    }
    Throwable current = error;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    StringBuilder out = new StringBuilder(render(current));
    Throwable root = current;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root != current) {
      out.append(" (caused by ").append(render(root)).append(')');
    }
    return truncate(out.toString());
  }

  private static String render(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return error.getClass().getSimpleName() + ": " + message.trim();
  }

  private static List<String> remediationFor(ErrorCategory category) {
    return switch (category) {
      case NETWORK -> List.of(
          "Check if the county recorder website is accessible",
          "Verify network connectivity",
          "Retry the search in a few minutes");
      case TIMEOUT -> List.of(
          "The county website is responding slowly",
          "Retry during off-peak hours");
      case SCRAPING -> List.of(
          "The county website structure may have changed",
          "Try manual document upload",
          "Contact support to update the county adapter");
      case RATE_LIMIT -> List.of(
          "Wait 5-10 minutes before retrying",
          "Consider scheduling searches during off-peak hours");
      case AUTHENTICATION -> List.of(
          "Check county website credentials",
          "Verify the county adapter configuration");
      case EXTERNAL_SERVICE -> List.of(
          "The document analysis service may be temporarily unavailable",
          "Retry in a few minutes",
          "Check the analysis service configuration");
      case DATABASE, STORAGE, RESOURCE -> List.of(
          "A system component failed while processing the search",
          "Retry the search; contact support if the issue persists");
      default -> List.of(
          "Review the error details for more information",
          "Contact support if the issue persists");
    };
  }

  private static String truncate(String value) {
    if (value == null) {
      return null;
    }
    return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
  }
}
