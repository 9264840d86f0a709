package com.hybridrag.tools;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hybridrag.error.RagException;

/**
 * Times the call and turns every outcome, including unexpected exceptions, into a
 * {@link ToolResponse}.
 */
abstract class AbstractTool implements Tool {
    private static final Logger log = LoggerFactory.getLogger(AbstractTool.class);

    private final String name;
    private final String description;

    AbstractTool(String name, String description) {
        this.name = name;
        this.description = description;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public ToolResponse call(Map<String, Object> arguments) {
        long start = System.nanoTime();
        try {
            Object data = execute(new ToolArguments(arguments));
            double elapsed = elapsedMs(start);
            log.info("{} completed in {} ms", name, elapsed);
            return ToolResponse.ok(name, data, elapsed);
        } catch (RagException e) {
            double elapsed = elapsedMs(start);
            log.warn("{} failed in {} ms: [{}] {}", name, elapsed, e.code(), e.getMessage());
            return ToolResponse.failure(name, e, elapsed);
        } catch (RuntimeException e) {
            double elapsed = elapsedMs(start);
            log.error("{} failed in {} ms", name, elapsed, e);
            return ToolResponse.failure(name, e, elapsed);
        }
    }

    abstract Object execute(ToolArguments arguments);

    private static double elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
