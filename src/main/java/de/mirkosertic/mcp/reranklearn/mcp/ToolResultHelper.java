package de.mirkosertic.mcp.reranklearn.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;

/**
 * Turns response DTOs into MCP tool results.
 * <p>
 * Every response record carries a {@code success} component; a result built from a record
 * with {@code success=false} is flagged as an error result.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Record response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!isSuccess(response))
                .build();
    }

    /**
     * Serialize a response to JSON. Serialization failures become an error document.
     */
    public static String toJson(final Object response) {
        try {
            return OBJECT_MAPPER.writeValueAsString(response);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize tool response {}", response.getClass().getSimpleName(), e);
            try {
                return OBJECT_MAPPER.writeValueAsString(
                        Map.of("success", false, "error", "JSON serialization error: " + e.getOriginalMessage()));
            } catch (final JsonProcessingException nested) {
                throw new IllegalStateException("Cannot serialize error document", nested);
            }
        }
    }

    private static boolean isSuccess(final Record response) {
        for (final RecordComponent component : response.getClass().getRecordComponents()) {
            if ("success".equals(component.getName()) && component.getType() == boolean.class) {
                try {
                    return (Boolean) component.getAccessor().invoke(response);
                } catch (final ReflectiveOperationException e) {
                    throw new IllegalStateException("Cannot read success flag of " + response.getClass().getName(), e);
                }
            }
        }
        return true;
    }
}
