package com.planrunner.api;

import com.planrunner.tools.ToolDescriptor;
import com.planrunner.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolDescriptor> tools() {
        return toolRegistry.describeTools();
    }
}
