package xyz.vvrf.reactor.workflow.core;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 常用的 {@link InputValidator} 实现。
 */
public final class InputValidators {

    private InputValidators() {}

    /** 值必须存在（非 null）。*/
    public static InputValidator required() {
        return value -> value != null ? ValidationResult.ok() : ValidationResult.error("value is required");
    }

    /** 值为 null 或者是指定类型的实例。*/
    public static InputValidator ofType(Class<?> type) {
        Objects.requireNonNull(type, "类型不能为空");
        return value -> (value == null || type.isInstance(value))
                ? ValidationResult.ok()
                : ValidationResult.error(String.format("expected %s but got %s",
                type.getSimpleName(), value.getClass().getSimpleName()));
    }

    /** 必须存在且是指定类型的实例。*/
    public static InputValidator requiredOfType(Class<?> type) {
        return required().and(ofType(type));
    }

    /** 基于谓词的校验，谓词为 false 时返回给定的错误说明。*/
    public static InputValidator matching(Predicate<Object> predicate, String errorMessage) {
        Objects.requireNonNull(predicate, "谓词不能为空");
        Objects.requireNonNull(errorMessage, "错误说明不能为空");
        return value -> predicate.test(value) ? ValidationResult.ok() : ValidationResult.error(errorMessage);
    }
}
