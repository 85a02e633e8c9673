package xyz.vvrf.reactor.workflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 嵌套调用栈（不可变）。
 * push 返回新实例，父运行持有的栈不受子运行影响，子运行结束即等价于出栈。
 * 通过 Reactor {@code Context} 在父运行的节点执行与子运行之间传递。
 */
public final class CallStack {

    /** Reactor Context 中存放当前调用栈的键。*/
    public static final String CONTEXT_KEY = CallStack.class.getName();

    private static final CallStack EMPTY = new CallStack(Collections.<CallFrame>emptyList());

    private final List<CallFrame> frames;

    private CallStack(List<CallFrame> frames) {
        this.frames = frames;
    }

    public static CallStack empty() {
        return EMPTY;
    }

    public CallStack push(CallFrame frame) {
        Objects.requireNonNull(frame, "调用栈帧不能为空");
        List<CallFrame> copy = new ArrayList<>(frames.size() + 1);
        copy.addAll(frames);
        copy.add(frame);
        return new CallStack(Collections.unmodifiableList(copy));
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * @return 图名称在栈中出现的次数。
     */
    public int occurrencesOf(String graphName) {
        int count = 0;
        for (CallFrame frame : frames) {
            if (frame.getGraphName().equals(graphName)) {
                count++;
            }
        }
        return count;
    }

    public Optional<CallFrame> top() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    /**
     * @return 根运行（栈底）的帧。
     */
    public Optional<CallFrame> root() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(0));
    }

    public List<CallFrame> getFrames() {
        return frames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return frames.equals(((CallStack) o).frames);
    }

    @Override
    public int hashCode() {
        return frames.hashCode();
    }

    @Override
    public String toString() {
        return frames.stream().map(CallFrame::toString).collect(Collectors.joining(" > ", "[", "]"));
    }
}
