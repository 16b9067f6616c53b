package com.bootstrap.cli;

import com.bootstrap.shared.model.Provider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 把 Spring {@link ApplicationArguments} 轉成 {@link BootstrapOptions}
 *
 * 選項格式為 Spring Boot 慣例 {@code --name=value}，布林旗標可省略值:
 * <pre>
 * bootstrap apply --dry-run --provider=stripe --webhook-url=https://example.com/api/webhooks/stripe
 * </pre>
 * 格式錯誤一律拋 {@link IllegalArgumentException}。
 */
@Component
public class BootstrapOptionsParser {

    public static final String USAGE = String.join("\n",
            "Usage: bootstrap <preflight|apply> [options]",
            "  --provider=stripe|cloudflare   only plan/apply one provider",
            "  --dry-run                      preview apply without side effects",
            "  --webhook-url=<url>            Stripe webhook endpoint URL",
            "  --base-url=<url>               base URL used to derive the webhook URL",
            "  --project-id=<id>              override PROJECT_ID",
            "  --d1-name=<name>               override D1 database name",
            "  --r2-bucket=<name>             override R2 bucket name",
            "  --output-dir=<path>            where .env.local.generated is written",
            "  --skip-wrangler                skip Cloudflare permission checks",
            "  --attempts=<n> --delay-ms=<n>  HTTP retry policy for remote checks",
            "  --fail-on-warnings             exit 1 when any warning is reported",
            "  --mode --routes --token --stamp --no-headless",
            "                                 smoke test options, accepted and passed through as-is");

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "provider", "webhook-url", "base-url", "mode", "routes", "token", "output-dir",
            "stamp", "attempts", "delay-ms", "project-id", "d1-name", "r2-bucket");

    private static final Set<String> FLAG_OPTIONS = Set.of(
            "dry-run", "skip-wrangler", "headless", "no-headless", "fail-on-warnings");

    public BootstrapOptions parse(ApplicationArguments args) {
        for (String name : args.getOptionNames()) {
            // spring.* / logging.* 等屬性交給 Spring 處理
            if (name.contains(".")) {
                continue;
            }
            if (!VALUE_OPTIONS.contains(name) && !FLAG_OPTIONS.contains(name)) {
                throw new IllegalArgumentException("Unknown option: --" + name);
            }
        }

        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            throw new IllegalArgumentException("Missing command (expected preflight or apply)");
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Unexpected argument: " + positional.get(1));
        }
        BootstrapCommand command = BootstrapCommand.fromValue(positional.get(0))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown command: " + positional.get(0) + " (expected preflight or apply)"));

        BootstrapOptions.BootstrapOptionsBuilder builder = BootstrapOptions.builder()
                .command(command)
                .dryRun(flag(args, "dry-run"))
                .webhookUrl(value(args, "webhook-url"))
                .baseUrl(value(args, "base-url"))
                .outputDir(value(args, "output-dir"))
                .skipWrangler(flag(args, "skip-wrangler"))
                .projectId(value(args, "project-id"))
                .d1Name(value(args, "d1-name"))
                .r2Bucket(value(args, "r2-bucket"))
                .failOnWarnings(flag(args, "fail-on-warnings"))
                .mode(value(args, "mode"))
                .routes(value(args, "routes"))
                .token(value(args, "token"))
                .stamp(value(args, "stamp"))
                .headless(!flag(args, "no-headless") && (!args.containsOption("headless") || flag(args, "headless")));

        String provider = value(args, "provider");
        if (provider != null) {
            builder.provider(Arrays.stream(Provider.values())
                    .filter(candidate -> candidate.label().equalsIgnoreCase(provider))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown provider: " + provider + " (expected stripe or cloudflare)")));
        }

        String attempts = value(args, "attempts");
        if (attempts != null) {
            int parsed = parseNumber("attempts", attempts);
            if (parsed < 1) {
                throw new IllegalArgumentException("--attempts must be at least 1");
            }
            builder.attempts(parsed);
        }

        String delayMs = value(args, "delay-ms");
        if (delayMs != null) {
            int parsed = parseNumber("delay-ms", delayMs);
            if (parsed < 0) {
                throw new IllegalArgumentException("--delay-ms must not be negative");
            }
            builder.delayMs(parsed);
        }

        return builder.build();
    }

    /**
     * 值選項：取最後一個值；有寫選項卻沒給值視為錯誤
     */
    private String value(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value (use --" + name + "=<value>)");
        }
        return values.get(values.size() - 1).trim();
    }

    /**
     * 布林旗標：--flag 或 --flag=true 為 true，--flag=false 為 false
     */
    private boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return true;
        }
        String last = values.get(values.size() - 1).trim();
        if (last.isEmpty() || last.equalsIgnoreCase("true")) {
            return true;
        }
        if (last.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("--" + name + " expects true or false, got: " + last);
    }

    private int parseNumber(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number, got: " + raw);
        }
    }
}
