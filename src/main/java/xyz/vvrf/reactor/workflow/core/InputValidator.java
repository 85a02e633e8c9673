package xyz.vvrf.reactor.workflow.core;

/**
 * 值校验器。用于运行输入校验，也可以作为节点输出的校验器。
 */
@FunctionalInterface
public interface InputValidator {

    /**
     * @param value 待校验的值（缺失的运行输入以 null 传入）
     */
    ValidationResult validate(Object value);

    /**
     * 组合校验：先执行当前校验器，通过后再执行 {@code next}。
     */
    default InputValidator and(InputValidator next) {
        return value -> {
            ValidationResult first = validate(value);
            return first.isValid() ? next.validate(value) : first;
        };
    }
}
