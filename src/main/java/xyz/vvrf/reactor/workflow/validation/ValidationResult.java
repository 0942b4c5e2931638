package xyz.vvrf.reactor.workflow.validation;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 依赖校验结果（不可变）。
 *
 * @author ruifeng.wen
 */
public final class ValidationResult {

    @Getter private final boolean ok;
    @Getter private final boolean modified;
    @Getter private final List<RemovedDependency> removedDependencies;
    private final List<String> cyclePath;

    ValidationResult(boolean ok, boolean modified, List<RemovedDependency> removedDependencies, List<String> cyclePath) {
        this.ok = ok;
        this.modified = modified;
        this.removedDependencies = Collections.unmodifiableList(removedDependencies);
        this.cyclePath = cyclePath;
    }

    /**
     * @return 检测到的循环路径，首尾为同一个任务 ID
     */
    public Optional<List<String>> getCyclePath() {
        return Optional.ofNullable(cyclePath);
    }

    /**
     * 面向用户的错误描述；校验通过时返回空字符串。
     */
    public String describe() {
        if (ok) {
            return "";
        }
        if (cyclePath != null) {
            return "dependency cycle detected: " + String.join(" -> ", cyclePath);
        }
        return "invalid dependencies: " + removedDependencies.stream()
                .map(RemovedDependency::toString)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "ValidationResult{ok=" + ok + ", modified=" + modified +
                ", removed=" + removedDependencies.size() +
                (cyclePath != null ? ", cyclePath=" + cyclePath : "") + '}';
    }
}
