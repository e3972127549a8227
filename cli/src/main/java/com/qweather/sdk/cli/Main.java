package com.qweather.sdk.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qweather.sdk.api.QWeather;
import com.qweather.sdk.cli.config.ConfigLoader;
import com.qweather.sdk.cli.http.HttpClientFactory;
import com.qweather.sdk.core.client.ClientConfig;
import com.qweather.sdk.core.client.QWeatherClient;
import com.qweather.sdk.core.envelope.ApiError;
import com.qweather.sdk.core.envelope.ApiResponse;
import com.qweather.sdk.core.util.JsonUtils;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one endpoint and prints the outcome as JSON. Exit status is 0 on success, 1 when the call
 * returned an error and 2 on bad usage or configuration.
 */
public final class Main {
    public static final String LOG_LEVEL_VAR = "QWEATHER_LOG_LEVEL";
    static final int EXIT_OK = 0;
    static final int EXIT_API_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final Map<String, Command> COMMANDS = commands();

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> environment, PrintStream out, PrintStream err) {
        configureLogging(environment.get(LOG_LEVEL_VAR), LOGGER::warning);

        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        Path configFile = null;
        if (remaining.size() >= 2 && remaining.get(0).equals("--config")) {
            configFile = Path.of(remaining.get(1));
            remaining = remaining.subList(2, remaining.size());
        }
        if (remaining.isEmpty()) {
            printUsage(out);
            return EXIT_USAGE;
        }

        Command command = COMMANDS.get(remaining.get(0));
        List<String> commandArgs = remaining.subList(1, remaining.size());
        if (command == null || commandArgs.size() < command.minArgs() || commandArgs.size() > command.maxArgs()) {
            err.println(command == null ? "Unknown command: " + remaining.get(0) : "Usage: " + command.usage());
            printUsage(err);
            return EXIT_USAGE;
        }

        QWeather qweather;
        try {
            ClientConfig config = configFile == null
                    ? ConfigLoader.fromEnvironment(environment)
                    : ConfigLoader.loadClient(configFile);
            qweather = new QWeather(new QWeatherClient(
                    config,
                    HttpClientFactory.create(TIMEOUT, environment),
                    TIMEOUT,
                    Clock.systemUTC()
            ));
        } catch (IllegalStateException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }

        ApiResponse<?> response;
        try {
            response = command.action().apply(qweather, commandArgs);
        } catch (NumberFormatException e) {
            err.println("Invalid number: " + e.getMessage());
            err.println("Usage: " + command.usage());
            return EXIT_USAGE;
        }

        try {
            out.println(render(response));
        } catch (JsonProcessingException e) {
            err.println("Failed to render response: " + e.getOriginalMessage());
            return EXIT_API_ERROR;
        }
        return response.isSuccess() ? EXIT_OK : EXIT_API_ERROR;
    }

    static String render(ApiResponse<?> response) throws JsonProcessingException {
        ObjectMapper mapper = JsonUtils.objectMapper();
        ObjectNode root = mapper.createObjectNode();
        if (response instanceof ApiResponse.Success<?> success) {
            root.put("status", "success");
            root.set("envelope", mapper.valueToTree(success.value()));
        } else if (response instanceof ApiResponse.Failure<?> failure) {
            ApiError error = failure.cause();
            root.put("status", "error");
            root.put("error", error.getClass().getSimpleName());
            root.put("description", error.description());
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    static void configureLogging(String level, Consumer<String> warn) {
        if (level == null || level.isBlank()) {
            return;
        }
        Level parsed;
        try {
            parsed = Level.parse(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            warn.accept(LOG_LEVEL_VAR + "=" + level + " is not a logging level; keeping defaults.");
            return;
        }
        Logger root = Logger.getLogger("");
        root.setLevel(parsed);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(parsed);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: qweather [--config <file>] <command> [args...]");
        stream.println("Commands:");
        COMMANDS.values().forEach(command -> stream.println("  " + command.usage()));
    }

    private static Map<String, Command> commands() {
        Map<String, Command> commands = new LinkedHashMap<>();
        add(commands, "weather-now", "<location>", 1, 1,
                (q, a) -> q.weather().now(a.get(0)));
        add(commands, "weather-daily", "<location> <days>", 2, 2,
                (q, a) -> q.weather().dailyForecast(a.get(0), Integer.parseInt(a.get(1))));
        add(commands, "weather-hourly", "<location> <hours>", 2, 2,
                (q, a) -> q.weather().hourlyForecast(a.get(0), Integer.parseInt(a.get(1))));
        add(commands, "minutely", "<location>", 1, 1,
                (q, a) -> q.minutely().precipitation(a.get(0)));
        add(commands, "grid-now", "<lon,lat>", 1, 1,
                (q, a) -> q.gridWeather().now(a.get(0)));
        add(commands, "grid-daily", "<lon,lat> <days>", 2, 2,
                (q, a) -> q.gridWeather().dailyForecast(a.get(0), Integer.parseInt(a.get(1))));
        add(commands, "grid-hourly", "<lon,lat> <hours>", 2, 2,
                (q, a) -> q.gridWeather().hourlyForecast(a.get(0), Integer.parseInt(a.get(1))));
        add(commands, "city-lookup", "<location> [number]", 1, 2,
                (q, a) -> q.geo().cityLookup(a.get(0), null, null, optionalInt(a, 1)));
        add(commands, "city-top", "[range] [number]", 0, 2,
                (q, a) -> q.geo().cityTop(a.isEmpty() ? null : a.get(0), optionalInt(a, 1)));
        add(commands, "poi-lookup", "<location> <type> [city]", 2, 3,
                (q, a) -> q.geo().poiLookup(a.get(0), a.get(1), a.size() > 2 ? a.get(2) : null, null));
        add(commands, "poi-range", "<lon,lat> <type> [radiusKm]", 2, 3,
                (q, a) -> q.geo().poiRange(a.get(0), a.get(1), a.size() > 2 ? Double.valueOf(a.get(2)) : null, null));
        add(commands, "warning-now", "<location>", 1, 1,
                (q, a) -> q.warning().now(a.get(0)));
        add(commands, "warning-list", "<range>", 1, 1,
                (q, a) -> q.warning().cityList(a.get(0)));
        add(commands, "indices", "<location> <type[,type...]> <days>", 3, 3,
                (q, a) -> q.indices().forecast(a.get(0), List.of(a.get(1).split(",")), Integer.parseInt(a.get(2))));
        add(commands, "storm-forecast", "<stormId>", 1, 1,
                (q, a) -> q.tropical().stormForecast(a.get(0)));
        add(commands, "air-current", "<lat> <lon>", 2, 2,
                (q, a) -> q.airQuality().current(Double.parseDouble(a.get(0)), Double.parseDouble(a.get(1))));
        add(commands, "air-hourly", "<lat> <lon>", 2, 2,
                (q, a) -> q.airQuality().hourlyForecast(Double.parseDouble(a.get(0)), Double.parseDouble(a.get(1))));
        add(commands, "air-daily", "<lat> <lon>", 2, 2,
                (q, a) -> q.airQuality().dailyForecast(Double.parseDouble(a.get(0)), Double.parseDouble(a.get(1))));
        add(commands, "air-station", "<locationId>", 1, 1,
                (q, a) -> q.airQuality().station(a.get(0)));
        return Collections.unmodifiableMap(commands);
    }

    private static void add(
            Map<String, Command> commands,
            String name,
            String arguments,
            int minArgs,
            int maxArgs,
            BiFunction<QWeather, List<String>, ApiResponse<?>> action
    ) {
        commands.put(name, new Command(name + " " + arguments, minArgs, maxArgs, action));
    }

    private static Integer optionalInt(List<String> args, int index) {
        return args.size() > index ? Integer.valueOf(args.get(index)) : null;
    }

    private record Command(
            String usage,
            int minArgs,
            int maxArgs,
            BiFunction<QWeather, List<String>, ApiResponse<?>> action
    ) {
    }
}
