package com.planrunner.tools.impl;

import com.planrunner.files.FileContent;
import com.planrunner.files.FileService;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.TextTool;
import com.planrunner.tools.ToolName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ProjectFileReadTool implements TextTool {

    private final FileService fileService;

    @Override
    public ToolName name() {
        return ToolName.PROJECT_FILE_READ;
    }

    @Override
    public String description() {
        return "Reads a UTF-8 text file from the project workspace. Parameter: path (relative to the workspace root).";
    }

    @Override
    public String exampleInstruction() {
        return "Read the build file\nParameters:\npath: pom.xml";
    }

    @Override
    public ToolResult execute(Plan plan, String taskDescription, String stepContext) {
        Optional<String> path = InstructionArguments.value(taskDescription, "path")
                .or(() -> InstructionArguments.firstPathToken(taskDescription));
        if (path.isEmpty()) {
            return ToolResult.failure(name().name(), "No file path in instruction", "Expected a 'path: <file>' line.");
        }
        FileContent file = fileService.read(path.get());
        String summary = "Read " + file.path() + " (" + file.content().length() + " chars"
                + (file.truncated() ? ", truncated)" : ")");
        return ToolResult.success(name().name(), summary, file.content());
    }
}
