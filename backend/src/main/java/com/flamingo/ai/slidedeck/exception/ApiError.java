package com.flamingo.ai.slidedeck.exception;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String PRESENTATION_NOT_FOUND = "PRESENTATION_001";
  public static final String PRESENTATION_BUILD_ERROR = "PRESENTATION_002";
  public static final String STYLE_EXTRACTION_ERROR = "TEMPLATE_001";
  public static final String UPLOAD_TOO_LARGE = "TEMPLATE_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String LLM_NOT_CONFIGURED = "LLM_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INVALID_PRESENTATION = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Individual field violations, as {@code path: message}. */
  private final List<String> violations;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
