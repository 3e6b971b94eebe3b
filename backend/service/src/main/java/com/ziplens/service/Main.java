package com.ziplens.service;

import com.ziplens.core.model.ZipRecord;
import com.ziplens.core.util.JsonUtils;
import com.ziplens.service.config.ConfigLoader;
import com.ziplens.service.config.FetchServiceConfig;
import com.ziplens.service.fetch.FetchResult;
import com.ziplens.service.fetch.FetchService;
import com.ziplens.service.runtime.ZipLensRuntime;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;
    static final int DEFAULT_LIMIT = 100;

    private Main() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("ZIPLENS_CONFIG_DIR", "config"));
        Path cacheFile = Path.of(env.getOrDefault("ZIPLENS_CACHE_FILE", "state/acs-cache.json"));
        Path indexFile = Path.of(env.getOrDefault("ZIPLENS_INDEX_FILE", "data/zips.json"));

        FetchServiceConfig config = ConfigLoader.loadFetch(configDir);
        int exitCode;
        try (ZipLensRuntime runtime = ZipLensRuntime.create(config, ConfigLoader.apiKey(env), cacheFile, indexFile, Clock.systemUTC())) {
            exitCode = run(args, runtime, System.out);
        }
        System.exit(exitCode);
    }

    static int run(String[] args, ZipLensRuntime runtime, PrintStream out) {
        if (args.length == 0) {
            printUsage(out);
            return USAGE;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (command) {
                case "zip" -> require(rest, 1, out) ? printRecord(runtime.index().get(rest.get(0)), rest.get(0), out) : USAGE;
                case "state" -> require(rest, 1, out)
                        ? print(runtime.index().byState(rest.get(0), limitAt(rest, 1)), out) : USAGE;
                case "county" -> require(rest, 1, out)
                        ? print(runtime.index().byCounty(rest.get(0), limitAt(rest, 1)), out) : USAGE;
                case "city" -> require(rest, 1, out)
                        ? print(runtime.index().byCity(rest.get(0), rest.size() > 1 ? rest.get(1) : null, limitAt(rest, 2)), out) : USAGE;
                case "radius" -> require(rest, 3, out) ? print(runtime.index().searchRadius(
                        Double.parseDouble(rest.get(0)), Double.parseDouble(rest.get(1)), Double.parseDouble(rest.get(2)),
                        limitAt(rest, 3)), out) : USAGE;
                case "bbox" -> require(rest, 4, out) ? print(runtime.index().searchBoundingBox(
                        Double.parseDouble(rest.get(0)), Double.parseDouble(rest.get(1)),
                        Double.parseDouble(rest.get(2)), Double.parseDouble(rest.get(3)), limitAt(rest, 4)), out) : USAGE;
                case "sample" -> require(rest, 1, out) ? print(runtime.index().randomSample(Integer.parseInt(rest.get(0))), out) : USAGE;
                case "index-stats" -> print(runtime.index().stats(), out);
                case "fetch" -> require(rest, 2, out) ? fetch(runtime.fetchService(), rest, out) : USAGE;
                case "validate-key" -> print(runtime.fetchService().validateCredential(), out);
                case "cache-stats" -> print(runtime.fetchService().cacheStats(), out);
                case "clear-cache" -> print(Map.of("removed", runtime.fetchService().clearCache()), out);
                case "sweep-cache" -> print(runtime.fetchService().sweepCache(), out);
                case "stats" -> print(runtime.fetchService().stats(), out);
                case "errors" -> print(runtime.diagnostics().recentErrors(limitAt(rest, 0)), out);
                default -> {
                    out.println("Unknown command: " + command);
                    printUsage(out);
                    yield USAGE;
                }
            };
        } catch (IllegalArgumentException e) {
            out.println("Invalid input: " + e.getMessage());
            return USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return FAILED;
        } catch (IllegalStateException e) {
            LOGGER.warning(() -> "Command " + command + " failed: " + e.getMessage());
            out.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    private static int fetch(FetchService fetchService, List<String> rest, PrintStream out) throws InterruptedException {
        List<String> variables = Arrays.asList(rest.get(0).split(","));
        FetchResult result = fetchService.fetchVariables(rest.subList(1, rest.size()), variables);
        print(result, out);
        return result.failures().isEmpty() ? OK : FAILED;
    }

    private static int printRecord(Optional<ZipRecord> record, String zip, PrintStream out) {
        if (record.isEmpty()) {
            out.println("ZIP not found: " + zip);
            return FAILED;
        }
        return print(record.get(), out);
    }

    private static int print(Object value, PrintStream out) {
        out.println(JsonUtils.toJson(value));
        return OK;
    }

    private static boolean require(List<String> rest, int count, PrintStream out) {
        if (rest.size() < count) {
            out.println("Expected at least " + count + " argument(s)");
            printUsage(out);
            return false;
        }
        return true;
    }

    private static int limitAt(List<String> rest, int position) {
        return rest.size() > position ? Integer.parseInt(rest.get(position)) : DEFAULT_LIMIT;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: ziplens <command> [args]");
        out.println("  zip <zip> | state <ST> [limit] | county <fips> [limit] | city <name> [ST] [limit]");
        out.println("  radius <lat> <lng> <km> [limit] | bbox <minLat> <minLng> <maxLat> <maxLng> [limit]");
        out.println("  sample <count> | index-stats");
        out.println("  fetch <VAR1,VAR2> <zip>... | validate-key | cache-stats | clear-cache | sweep-cache | stats | errors [limit]");
    }
}
