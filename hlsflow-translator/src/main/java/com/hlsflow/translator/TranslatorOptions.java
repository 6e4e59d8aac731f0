package com.hlsflow.translator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * 翻译配置
 */
public class TranslatorOptions {

    private static final Logger LOG = Logger.getLogger(TranslatorOptions.class.getName());

    /** 类路径上的默认配置 */
    public static final String RESOURCE = "/hlsflow.properties";

    private String topName;
    private int maxUnrollIterations = 1000;
    private boolean inlineAfterGeneration = false;

    public TranslatorOptions() {
    }

    /**
     * 读取类路径上的 hlsflow.properties，缺失时使用内置默认值
     */
    public static TranslatorOptions load() {
        TranslatorOptions options = new TranslatorOptions();
        try (InputStream in = TranslatorOptions.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOG.fine("No " + RESOURCE + " on classpath, using defaults");
                return options;
            }
            Properties props = new Properties();
            props.load(in);
            options.apply(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return options;
    }

    /**
     * 用属性覆盖当前值（hlsflow.top、hlsflow.maxUnrollIterations、hlsflow.inline）
     */
    public void apply(Properties props) {
        String top = props.getProperty("hlsflow.top");
        if (top != null && !top.trim().isEmpty()) {
            topName = top.trim();
        }
        String max = props.getProperty("hlsflow.maxUnrollIterations");
        if (max != null) {
            try {
                setMaxUnrollIterations(Integer.parseInt(max.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("hlsflow.maxUnrollIterations is not a number: " + max, e);
            }
        }
        String inline = props.getProperty("hlsflow.inline");
        if (inline != null) {
            inlineAfterGeneration = Boolean.parseBoolean(inline.trim());
        }
    }

    public String getTopName() {
        return topName;
    }

    public void setTopName(String topName) {
        this.topName = topName;
    }

    public int getMaxUnrollIterations() {
        return maxUnrollIterations;
    }

    public void setMaxUnrollIterations(int maxUnrollIterations) {
        if (maxUnrollIterations <= 0) {
            throw new IllegalArgumentException("maxUnrollIterations must be positive: " + maxUnrollIterations);
        }
        this.maxUnrollIterations = maxUnrollIterations;
    }

    public boolean isInlineAfterGeneration() {
        return inlineAfterGeneration;
    }

    public void setInlineAfterGeneration(boolean inlineAfterGeneration) {
        this.inlineAfterGeneration = inlineAfterGeneration;
    }
}
