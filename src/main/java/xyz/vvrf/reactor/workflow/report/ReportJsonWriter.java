package xyz.vvrf.reactor.workflow.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 将执行报告序列化为 JSON。时间戳输出为 ISO-8601 字符串。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ReportJsonWriter {

    @Getter
    private final ObjectMapper objectMapper;

    public ReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    public ReportJsonWriter() {
        this(defaultObjectMapper());
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String toJson(ExecutionReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("序列化工作流 '{}' 的执行报告失败", report.getWorkflowId(), e);
            throw new IllegalStateException("无法序列化执行报告: " + report.getWorkflowId(), e);
        }
    }

    public String toPrettyJson(ExecutionReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("序列化工作流 '{}' 的执行报告失败", report.getWorkflowId(), e);
            throw new IllegalStateException("无法序列化执行报告: " + report.getWorkflowId(), e);
        }
    }
}
