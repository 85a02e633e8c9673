package xyz.vvrf.reactor.workflow.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行输入未通过图声明的校验器。在任何节点执行前抛出，不触发补偿。
 */
public class InputValidationException extends WorkflowException {

    private final String graphName;
    private final Map<String, String> violations;

    public InputValidationException(String graphName, Map<String, String> violations) {
        super(String.format("Run input for graph '%s' failed validation: %s", graphName, violations));
        this.graphName = graphName;
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * @return 输入名称 -> 错误说明，按图中声明顺序。
     */
    public Map<String, String> getViolations() {
        return violations;
    }
}
