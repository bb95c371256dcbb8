package com.planrunner.tools.impl;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls arguments out of free instruction text for the text tools. Reasoning renders parameters as
 * {@code key: value} lines below the requirement, so those lines win over guessing.
 */
final class InstructionArguments {

    private static final Pattern PATH_TOKEN = Pattern.compile("[\\w./\\\\-]*[\\w-]\\.[A-Za-z0-9]{1,10}\\b");

    private InstructionArguments() {
    }

    static Optional<String> value(@Nullable String instruction, String key) {
        if (!StringUtils.hasText(instruction)) {
            return Optional.empty();
        }
        Pattern line = Pattern.compile("(?im)^\\s*" + Pattern.quote(key) + "\\s*:\\s*(.+?)\\s*$");
        Matcher matcher = line.matcher(instruction);
        return matcher.find() ? Optional.of(stripQuotes(matcher.group(1))) : Optional.empty();
    }

    static Optional<Integer> intValue(@Nullable String instruction, String key) {
        return value(instruction, key).flatMap(raw -> {
            try {
                return Optional.of(Integer.parseInt(raw.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        });
    }

    /**
     * First token shaped like a file path with an extension, e.g. {@code src/main/App.java}.
     */
    static Optional<String> firstPathToken(@Nullable String instruction) {
        if (!StringUtils.hasText(instruction)) {
            return Optional.empty();
        }
        Matcher matcher = PATH_TOKEN.matcher(instruction);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    private static String stripQuotes(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && (trimmed.startsWith("\"") && trimmed.endsWith("\"")
                || trimmed.startsWith("'") && trimmed.endsWith("'")
                || trimmed.startsWith("`") && trimmed.endsWith("`"))) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
