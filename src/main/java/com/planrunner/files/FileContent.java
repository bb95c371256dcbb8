package com.planrunner.files;

public record FileContent(String path, String content, boolean truncated) {
}
