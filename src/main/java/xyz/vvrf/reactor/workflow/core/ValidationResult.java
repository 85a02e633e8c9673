package xyz.vvrf.reactor.workflow.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 校验器的返回值：要么通过，要么带有一条错误说明。
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null);

    private final String error;

    private ValidationResult(String error) {
        this.error = error;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(Objects.requireNonNull(message, "错误说明不能为空"));
    }

    public boolean isValid() {
        return error == null;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{ok}" : "ValidationResult{error='" + error + "'}";
    }
}
