package io.recall.scoring.judge;

import io.recall.ErrorKind;
import io.recall.RecallException;

/**
 * Failure of a judge model call. Adapters choose the kind: {@link ErrorKind#TRANSIENT}
 * for network problems, timeouts and rate limits, {@link ErrorKind#PERMANENT} for
 * rejected requests.
 */
public class JudgeException extends RecallException {

  public JudgeException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public JudgeException(ErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }

  public static JudgeException transientFailure(String message, Throwable cause) {
    return new JudgeException(ErrorKind.TRANSIENT, message, cause);
  }

  public static JudgeException permanentFailure(String message, Throwable cause) {
    return new JudgeException(ErrorKind.PERMANENT, message, cause);
  }
}
