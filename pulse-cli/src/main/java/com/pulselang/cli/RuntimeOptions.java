package com.pulselang.cli;

import picocli.CommandLine.Option;
import pulse.runtime.interpreter.PulseInterpreter;
import pulse.runtime.interpreter.RandomSource;
import pulse.runtime.interpreter.RuntimeConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * run 和 debug 共用的运行时选项（picocli mixin）
 */
public class RuntimeOptions {

    @Option(names = "--profile", description = "配置档（standard, embedded）")
    String profile;

    @Option(names = "--config", description = "pulse.* 配置文件（properties）")
    Path configFile;

    @Option(names = "--seed", description = "Math.random() 的固定种子")
    Long seed;

    @Option(names = "--verbose", description = "输出 FINE 级别日志")
    boolean verbose;

    /**
     * 配置文件中的值优先于档位预设，--profile 优先于文件中的 pulse.profile
     *
     * @throws IllegalArgumentException 未知档位或非法配置值
     */
    RuntimeConfig resolveConfig() throws IOException {
        Properties props = new Properties();
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(configFile)) {
                props.load(in);
            }
        }
        if (profile != null) {
            String name = profile.toLowerCase(Locale.ROOT);
            if (!"standard".equals(name) && !"embedded".equals(name)) {
                throw new IllegalArgumentException("未知配置档 '" + profile + "'（可选: standard, embedded）");
            }
            props.setProperty(RuntimeConfig.PROFILE, name);
        }
        return RuntimeConfig.fromProperties(props);
    }

    PulseInterpreter createInterpreter() throws IOException {
        LoggingSetup.install(verbose);
        RandomSource random = seed != null ? RandomSource.seeded(seed) : RandomSource.system();
        return new PulseInterpreter(resolveConfig(), random);
    }
}
