package com.hlsflow.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 命令行的 JUL 配置：读取 logging.properties，--verbose 时把 com.hlsflow 调到 FINE
 */
final class LoggingSetup {

    private static final String RESOURCE = "/logging.properties";

    /** 持有引用，避免配置好的 logger 被回收 */
    private static final Logger ROOT = Logger.getLogger("com.hlsflow");

    private LoggingSetup() {
    }

    static void configure(boolean verbose) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            ROOT.log(Level.WARNING, "Failed to read " + RESOURCE, e);
        }
        ROOT.setLevel(verbose ? Level.FINE : Level.WARNING);
    }

    static Level currentLevel() {
        return ROOT.getLevel();
    }
}
