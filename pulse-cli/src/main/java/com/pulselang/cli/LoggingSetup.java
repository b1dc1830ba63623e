package com.pulselang.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 从 classpath 加载 {@code logging.properties}
 */
final class LoggingSetup {

    private static final String CONFIG = "/logging.properties";

    private LoggingSetup() {}

    /**
     * @param verbose 为 true 时 pulse 包和控制台输出降到 FINE
     */
    static void install(boolean verbose) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置 - " + e.getMessage());
        }
        if (verbose) {
            Logger.getLogger("pulse").setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }
    }
}
