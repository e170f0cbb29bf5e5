package com.mouse.provisioner.utils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a numeric verification code out of a message body. Patterns go from the most specific
 * (code inside a dedicated HTML cell) to a bare run of digits.
 */
public class OtpCodeExtractor {

    private final List<Pattern> patterns;

    public OtpCodeExtractor(int codeLength) {
        if (codeLength <= 0) {
            throw new IllegalArgumentException("codeLength must be positive");
        }
        String digits = "(\\d{" + codeLength + "})";
        this.patterns = List.of(
                Pattern.compile("class=\"(?:data|otp|code)\"[^>]*>\\s*" + digits + "\\s*<"),
                Pattern.compile(">\\s*" + digits + "\\s*</td>"),
                Pattern.compile(":\\s*" + digits + "(?!\\d)"),
                Pattern.compile("(?<!\\d)" + digits + "(?!\\d)")
        );
    }

    public Optional<String> extract(String body) {
        if (body == null || body.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(body);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
