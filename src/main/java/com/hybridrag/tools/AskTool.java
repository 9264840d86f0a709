package com.hybridrag.tools;

import java.util.LinkedHashMap;
import java.util.Map;

import com.hybridrag.pipeline.AskPipeline;
import com.hybridrag.pipeline.AskResult;

class AskTool extends AbstractTool {
    private final AskPipeline pipeline;

    AskTool(AskPipeline pipeline) {
        super("ask", "Answer a question about the project from indexed documentation and code.");
        this.pipeline = pipeline;
    }

    @Override
    Object execute(ToolArguments arguments) {
        AskResult result = pipeline.ask(arguments.requiredString("question"), arguments.string("context"));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("answer", result.answer());
        out.put("intent", result.analysis() == null ? null : result.analysis().intent().label());
        out.put("sources", result.sources());
        out.put("result_count", result.results().size());
        return out;
    }
}
