package com.purchasingpower.forge.agent;

import java.util.Map;

/**
 * A named operation the executor model may call during a turn.
 *
 * <p>Each tool maps to exactly one state mutation (or one rendering) and reports back a short
 * text the model reads on its next iteration. Implementations are Spring components; the
 * {@link ToolDispatcher} discovers them by name.
 */
public interface Tool {

    /**
     * Wire name used by the model, e.g. {@code register_assumption}.
     */
    String getName();

    /**
     * Description shown to the model. Explains when to call the tool.
     */
    String getDescription();

    /**
     * JSON schema (object) of the tool's arguments.
     */
    String getParameterSchema();

    /**
     * Execute with the arguments the model supplied.
     *
     * @param parameters raw arguments from the tool call
     * @param context state of the running turn
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    ToolCategory getCategory();

    enum ToolCategory {
        /**
         * Assumption register and dependency graph.
         */
        FACT_STORE,

        /**
         * Finding skeleton fields.
         */
        SKELETON,

        /**
         * Routing bookkeeping: guidance firings, rolling summary, mode completion.
         */
        ROUTING,

        /**
         * Organisation context.
         */
        CONTEXT,

        /**
         * Rendered work products.
         */
        ARTIFACT
    }
}
