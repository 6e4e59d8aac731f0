package com.hlsflow.translator;

import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 翻译异常：携带错误类别与源码位置
 */
public class TranslationException extends RuntimeException {
    private final ErrorCategory category;
    private final SourceLocation location;

    public TranslationException(ErrorCategory category, String message, SourceLocation location) {
        super(message);
        this.category = category;
        this.location = location;
    }

    public TranslationException(ErrorCategory category, String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.location = location;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不带位置的原始消息 */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (location == null || location == SourceLocation.UNKNOWN) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + location;
    }

    // ========== 工厂方法 ==========

    public static TranslationException parse(String detail, SourceLocation location) {
        return new TranslationException(ErrorCategory.PARSE, "Unable to parse text: " + detail, location);
    }

    public static TranslationException unsupported(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.UNSUPPORTED, message, location);
    }

    public static TranslationException sequencing(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.SEQUENCING, message, location);
    }

    public static TranslationException controlFlow(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.CONTROL_FLOW, message, location);
    }

    public static TranslationException channelUsage(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.CHANNEL_USAGE, message, location);
    }

    public static TranslationException layout(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.LAYOUT, message, location);
    }

    public static TranslationException notFound(String message, SourceLocation location) {
        return new TranslationException(ErrorCategory.NOT_FOUND, message, location);
    }
}
