package com.planrunner.tools.impl;

import com.planrunner.files.FileService;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.TextTool;
import com.planrunner.tools.ToolName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectExploreStructureTool implements TextTool {

    static final int DEFAULT_DEPTH = 3;
    static final int MAX_DEPTH = 8;
    static final int MAX_ENTRIES = 400;

    private final FileService fileService;

    @Override
    public ToolName name() {
        return ToolName.PROJECT_EXPLORE_STRUCTURE;
    }

    @Override
    public String description() {
        return "Lists the directory tree of the project workspace. Optional parameters: path (relative directory), depth.";
    }

    @Override
    public String exampleInstruction() {
        return "Explore the project layout\nParameters:\npath: src\ndepth: 3";
    }

    @Override
    public ToolResult execute(Plan plan, String taskDescription, String stepContext) {
        String path = InstructionArguments.value(taskDescription, "path").orElse("");
        int depth = InstructionArguments.intValue(taskDescription, "depth")
                .map(d -> Math.max(0, Math.min(d, MAX_DEPTH)))
                .orElse(DEFAULT_DEPTH);
        List<String> tree = fileService.tree(path, depth, MAX_ENTRIES);
        String root = path.isBlank() ? fileService.getWorkspaceRoot().getFileName() + "/" : path;
        log.debug("Explored '{}' to depth {}: {} entries (correlationId={}).", root, depth, tree.size(), plan.getCorrelationId());
        if (tree.isEmpty()) {
            return ToolResult.success(name().name(), "Directory '" + root + "' is empty", "");
        }
        return ToolResult.success(name().name(),
                "Listed " + tree.size() + " entries under '" + root + "'",
                root + "\n" + String.join("\n", tree));
    }
}
