package com.otpguard.otp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.otpguard.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 验证码记录的存储编码（带版本号的固定字段 JSON）。
 * <p>
 * 编码格式：{@code {"v":1,"sid":..,"code":..,"createdAt":..,"used":..,"resendCount":..,"lastResendAt":..,"verifiedAt":..}}。
 * 解码规则：
 * - 非 JSON、非对象、版本不符或缺少 sid/code：返回 null（视为记录不存在）；
 * - createdAt 缺失或无法解析：保留为 null，由调用方视为已过期；
 * - used 不是布尔值：按已使用处理，避免旧码被重放；
 * - resendCount 不是非负整数：记为 {@link OneTimeCode#UNKNOWN_RESEND_COUNT}，重发计数不会因此被清零。
 */
@Slf4j
@Component
public class OneTimeCodeCodec {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public OneTimeCodeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(OneTimeCode record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("v", FORMAT_VERSION);
        node.put("sid", record.subjectId());
        node.put("code", record.code());
        node.put("createdAt", formatOrNull(record.createdAt()));
        node.put("used", record.used());
        node.put("resendCount", record.resendCount());
        node.put("lastResendAt", formatOrNull(record.lastResendAt()));
        node.put("verifiedAt", formatOrNull(record.verifiedAt()));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode one-time code record", ex);
        }
    }

    public OneTimeCode decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            log.warn("Discarding undecodable one-time code record ({})", ex.getClass().getSimpleName());
            return null;
        }
        if (root == null || !root.isObject()) {
            log.warn("Discarding one-time code record that is not a JSON object");
            return null;
        }
        JsonNode version = root.get("v");
        if (version == null || !version.canConvertToInt() || version.asInt() != FORMAT_VERSION) {
            log.warn("Discarding one-time code record with unsupported format version {}", version);
            return null;
        }
        JsonNode sid = root.get("sid");
        JsonNode code = root.get("code");
        if (sid == null || !sid.isIntegralNumber() || code == null || !code.isTextual() || code.asText().isEmpty()) {
            log.warn("Discarding one-time code record with missing identity fields");
            return null;
        }
        JsonNode used = root.get("used");
        JsonNode resendCount = root.get("resendCount");
        return new OneTimeCode(
                sid.asLong(),
                code.asText(),
                parseInstant(root, "createdAt"),
                used == null || !used.isBoolean() || used.asBoolean(),
                resendCount != null && resendCount.isInt() && resendCount.asInt() >= 0
                        ? resendCount.asInt()
                        : OneTimeCode.UNKNOWN_RESEND_COUNT,
                parseInstant(root, "lastResendAt"),
                parseInstant(root, "verifiedAt"));
    }

    private static Instant parseInstant(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            return null;
        }
        return Timestamps.parse(node.asText());
    }

    private static String formatOrNull(Instant instant) {
        return instant == null ? null : Timestamps.format(instant);
    }
}
