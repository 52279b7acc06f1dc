// file: client/src/main/java/io/chunklite/client/Cli.java
package io.chunklite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

/**
 * Simple CLI for interacting with a running chunk node over HTTP.
 *
 * Usage:
 *   chunklite-cli [--base-url http://host:port] put <text>
 *   chunklite-cli [--base-url http://host:port] get <address-hex> [--timeout-ms N]
 *
 * Examples:
 *   chunklite-cli put hello          prints the content address
 *   chunklite-cli get 2cf24dba...    prints the stored text
 *
 * Exit codes: 0 ok, 1 usage or HTTP error, 2 unexpected failure.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;

    private Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Execute one command; returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                throw new UsageException("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(parsed.getKey(), out);

            switch (cmd) {
                case "put" -> {
                    if (rest.length != 2) {
                        throw new UsageException("put requires <text>");
                    }
                    cli.put(rest[1]);
                }
                case "get" -> {
                    if (rest.length != 2 && !(rest.length == 4 && "--timeout-ms".equals(rest[2]))) {
                        throw new UsageException("get requires <address-hex> [--timeout-ms N]");
                    }
                    Long timeoutMs = rest.length == 4 ? parseTimeout(rest[3]) : null;
                    cli.get(rest[1], timeoutMs);
                }
                default -> throw new UsageException("unknown command: " + cmd);
            }
            return 0;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println("""
                    Usage:
                      chunklite-cli [--base-url http://host:port] put <text>
                      chunklite-cli [--base-url http://host:port] get <address-hex> [--timeout-ms N]
                    """);
            return 1;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("error: interrupted");
            return 2;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new UsageException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static long parseTimeout(String raw) {
        try {
            long ms = Long.parseLong(raw);
            if (ms <= 0) {
                throw new UsageException("--timeout-ms must be > 0");
            }
            return ms;
        } catch (NumberFormatException e) {
            throw new UsageException("--timeout-ms must be a number, got: " + raw);
        }
    }

    private void put(String text) throws Exception {
        String body = JSON.writeValueAsString(Map.of(
                "dataBase64", Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8))));

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chunks"))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("PUT failed (" + resp.statusCode() + "): " + resp.body());
        }
        out.println(JSON.readTree(resp.body()).path("address").asText());
    }

    private void get(String hex, Long timeoutMs) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chunks/" + hex))
                .GET();
        if (timeoutMs != null) {
            req.header("X-Chunk-Timeout-Ms", Long.toString(timeoutMs));
        }

        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 504) {
            throw new CliException("chunk " + hex + " not retrieved before the deadline");
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }

        JsonNode node = JSON.readTree(resp.body());
        byte[] decoded = Base64.getDecoder().decode(node.path("dataBase64").asText());
        out.println(new String(decoded, StandardCharsets.UTF_8));
    }

    private static class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    private static final class UsageException extends CliException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
