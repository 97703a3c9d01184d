package models;

import java.util.Optional;

/**
 * Generic wrapper capturing either a computed score or the reason it could not be computed.
 * The status follows HTTP semantics so the web layer can pass it through unchanged.
 */
public class ServiceResult<T> {
    public static final int OK = 200;
    public static final int UNPROCESSABLE = 422;

    private final boolean success;
    private final int status;
    private final T data;
    private final ErrorInfo error;

    private ServiceResult(boolean success, int status, T data, ErrorInfo error) {
        this.success = success;
        this.status = status;
        this.data = data;
        this.error = error;
    }

    public static <T> ServiceResult<T> success(int status, T data) {
        return new ServiceResult<>(true, status, data, null);
    }

    public static <T> ServiceResult<T> success(T data) {
        return success(OK, data);
    }

    public static <T> ServiceResult<T> failure(int status, ErrorInfo error) {
        return new ServiceResult<>(false, status, null, error);
    }

    public static <T> ServiceResult<T> failure(ErrorInfo error) {
        return failure(UNPROCESSABLE, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getStatus() {
        return status;
    }

    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }

    public Optional<ErrorInfo> getError() {
        return Optional.ofNullable(error);
    }
}
