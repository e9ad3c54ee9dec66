package de.mirkosertic.mcp.reranklearn.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a tool input parameter declared as a record component.
 * Read by {@link SchemaGenerator} when building the input schema of a tool.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ToolParam {

    /**
     * Human readable description shown to the MCP client.
     */
    String value();

    /**
     * Inclusive lower bound for numeric parameters. NaN means unbounded.
     */
    double minimum() default Double.NaN;

    /**
     * Inclusive upper bound for numeric parameters. NaN means unbounded.
     */
    double maximum() default Double.NaN;
}
