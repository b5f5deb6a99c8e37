package io.faultline.transport;

/**
 * What the collector answered to one POST.
 *
 * @param statusCode  HTTP status code
 * @param retryAfter  value of the {@code Retry-After} header, or {@code null}
 * @param rateLimits  value of the {@code X-Faultline-Rate-Limits} header, or {@code null}
 */
public record SendResponse(int statusCode, String retryAfter, String rateLimits) {

  public static SendResponse ok() {
    return new SendResponse(200, null, null);
  }

  public static SendResponse status(int statusCode) {
    return new SendResponse(statusCode, null, null);
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }

  /** 4xx other than 429: the request itself is wrong, resending cannot help. */
  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500 && statusCode != 429;
  }

  public boolean isServerError() {
    return statusCode >= 500;
  }
}
