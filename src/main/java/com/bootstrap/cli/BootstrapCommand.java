package com.bootstrap.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * CLI 子命令
 */
public enum BootstrapCommand {

    /** 只建立並輸出計畫 */
    PREFLIGHT("preflight"),
    /** 執行計畫，搭配 --dry-run 只預覽 */
    APPLY("apply");

    private final String value;

    BootstrapCommand(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<BootstrapCommand> fromValue(String raw) {
        return Arrays.stream(values())
                .filter(command -> command.value.equalsIgnoreCase(raw))
                .findFirst();
    }
}
