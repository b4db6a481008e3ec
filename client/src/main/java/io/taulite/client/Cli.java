package io.taulite.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for a running TauLite server.
 *
 * Usage:
 *   taulite-cli [--base-url http://host:port] series list
 *   taulite-cli [--base-url http://host:port] series create <label> <value>@<from>:<until> ...
 *   taulite-cli [--base-url http://host:port] series append <label> <value>@<from>:<until> ...
 *   taulite-cli [--base-url http://host:port] series get <label> [at <t> | range <from> <until>]
 *   taulite-cli [--base-url http://host:port] series drop <label>
 *   taulite-cli [--base-url http://host:port] group create|append <label> <series> ...
 *   taulite-cli [--base-url http://host:port] group get <label> [lens <lens>]
 *   taulite-cli [--base-url http://host:port] group list|drop ...
 *   taulite-cli [--base-url http://host:port] lens builtin <label> <source> <transform>
 *   taulite-cli [--base-url http://host:port] lens define <label> <description> <expression> <var>=<series> ...
 *   taulite-cli [--base-url http://host:port] lens compose <label> <inputsFrom> <expressionFrom>
 *   taulite-cli [--base-url http://host:port] lens get <label> [at <t>]
 *   taulite-cli [--base-url http://host:port] lens list|drop ...
 *
 * Examples:
 *   taulite-cli series create temp 21.5@0:1000 22@1000:2000
 *   taulite-cli lens builtin temp_f temp celsius_to_fahrenheit
 *   taulite-cli lens get temp_f at 1500
 *
 * The server's JSON response is printed as-is.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:7701";

    private static final String USAGE = """
            Usage:
              taulite-cli [--base-url http://host:port] series list
              taulite-cli [--base-url http://host:port] series create|append <label> <value>@<from>:<until> ...
              taulite-cli [--base-url http://host:port] series get <label> [at <t> | range <from> <until>]
              taulite-cli [--base-url http://host:port] series drop <label>
              taulite-cli [--base-url http://host:port] group list
              taulite-cli [--base-url http://host:port] group create|append <label> <series> ...
              taulite-cli [--base-url http://host:port] group get <label> [lens <lens>]
              taulite-cli [--base-url http://host:port] group drop <label>
              taulite-cli [--base-url http://host:port] lens list
              taulite-cli [--base-url http://host:port] lens builtin <label> <source> <transform>
              taulite-cli [--base-url http://host:port] lens define <label> <description> <expression> <var>=<series> ...
              taulite-cli [--base-url http://host:port] lens compose <label> <inputsFrom> <expressionFrom>
              taulite-cli [--base-url http://host:port] lens get <label> [at <t>]
              taulite-cli [--base-url http://host:port] lens drop <label>
            """;

    /** A single HTTP call derived from the command line. {@code body} is null for GET and DELETE. */
    record Call(String method, String path, String body) {
    }

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0 || "--help".equals(rest[0]) || "-h".equals(rest[0])) {
                System.err.print(USAGE);
                System.exit(rest.length == 0 ? 1 : 0);
            }
            Call call = toCall(rest);
            System.out.println(new Cli(parsed.getKey()).execute(call));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /**
     * Translate a command line (without --base-url) into an HTTP call.
     *
     * @throws CliException on unknown commands or wrong argument counts
     */
    static Call toCall(String[] rest) {
        if (rest.length < 2) {
            throw new CliException("expected <resource> <command>");
        }
        String resource = rest[0];
        String cmd = rest[1];
        String[] args = Arrays.copyOfRange(rest, 2, rest.length);
        return switch (resource) {
            case "series" -> seriesCall(cmd, args);
            case "group" -> groupCall(cmd, args);
            case "lens" -> lensCall(cmd, args);
            default -> throw new CliException("unknown resource: " + resource);
        };
    }

    private static Call seriesCall(String cmd, String[] args) {
        switch (cmd) {
            case "list" -> {
                expect(args, 0, "series list takes no arguments");
                return new Call("GET", "/series", null);
            }
            case "create", "append" -> {
                if (args.length < 1) throw new CliException("series " + cmd + " requires <label>");
                String path = "/series/" + encode(args[0]) + ("append".equals(cmd) ? "/append" : "");
                List<String> deltas = new ArrayList<>();
                for (int i = 1; i < args.length; i++) {
                    deltas.add(deltaJson(args[i]));
                }
                return new Call("POST", path, "{\"deltas\":[" + String.join(",", deltas) + "]}");
            }
            case "get" -> {
                if (args.length == 1) return new Call("GET", "/series/" + encode(args[0]), null);
                if (args.length == 3 && "at".equals(args[1])) {
                    return new Call("GET", "/series/" + encode(args[0]) + "?at=" + time(args[2]), null);
                }
                if (args.length == 4 && "range".equals(args[1])) {
                    return new Call("GET", "/series/" + encode(args[0])
                            + "?from=" + time(args[2]) + "&until=" + time(args[3]), null);
                }
                throw new CliException("series get requires <label> [at <t> | range <from> <until>]");
            }
            case "drop" -> {
                expect(args, 1, "series drop requires <label>");
                return new Call("DELETE", "/series/" + encode(args[0]), null);
            }
            default -> throw new CliException("unknown series command: " + cmd);
        }
    }

    private static Call groupCall(String cmd, String[] args) {
        switch (cmd) {
            case "list" -> {
                expect(args, 0, "group list takes no arguments");
                return new Call("GET", "/groups", null);
            }
            case "create", "append" -> {
                if (args.length < 1) throw new CliException("group " + cmd + " requires <label>");
                String path = "/groups/" + encode(args[0]) + ("append".equals(cmd) ? "/append" : "");
                List<String> members = new ArrayList<>();
                for (int i = 1; i < args.length; i++) {
                    members.add(quote(args[i]));
                }
                return new Call("POST", path, "{\"series\":[" + String.join(",", members) + "]}");
            }
            case "get" -> {
                if (args.length == 1) return new Call("GET", "/groups/" + encode(args[0]), null);
                if (args.length == 3 && "lens".equals(args[1])) {
                    return new Call("GET", "/groups/" + encode(args[0]) + "?lens=" + encode(args[2]), null);
                }
                throw new CliException("group get requires <label> [lens <lens>]");
            }
            case "drop" -> {
                expect(args, 1, "group drop requires <label>");
                return new Call("DELETE", "/groups/" + encode(args[0]), null);
            }
            default -> throw new CliException("unknown group command: " + cmd);
        }
    }

    private static Call lensCall(String cmd, String[] args) {
        switch (cmd) {
            case "list" -> {
                expect(args, 0, "lens list takes no arguments");
                return new Call("GET", "/lenses", null);
            }
            case "builtin" -> {
                expect(args, 3, "lens builtin requires <label> <source> <transform>");
                return new Call("POST", "/lenses/" + encode(args[0]),
                        "{\"source\":" + quote(args[1]) + ",\"transform\":" + quote(args[2]) + "}");
            }
            case "define" -> {
                if (args.length < 3) {
                    throw new CliException("lens define requires <label> <description> <expression> <var>=<series> ...");
                }
                List<String> inputs = new ArrayList<>();
                for (int i = 3; i < args.length; i++) {
                    int eq = args[i].indexOf('=');
                    if (eq <= 0 || eq == args[i].length() - 1) {
                        throw new CliException("input binding must look like <var>=<series>: " + args[i]);
                    }
                    inputs.add(quote(args[i].substring(0, eq)) + ":" + quote(args[i].substring(eq + 1)));
                }
                return new Call("POST", "/lenses/" + encode(args[0]),
                        "{\"description\":" + quote(args[1])
                                + ",\"expression\":" + quote(args[2])
                                + ",\"inputs\":{" + String.join(",", inputs) + "}}");
            }
            case "compose" -> {
                expect(args, 3, "lens compose requires <label> <inputsFrom> <expressionFrom>");
                return new Call("POST", "/lenses/" + encode(args[0]) + "/compose",
                        "{\"inputsFrom\":" + quote(args[1]) + ",\"expressionFrom\":" + quote(args[2]) + "}");
            }
            case "get" -> {
                if (args.length == 1) return new Call("GET", "/lenses/" + encode(args[0]), null);
                if (args.length == 3 && "at".equals(args[1])) {
                    return new Call("GET", "/lenses/" + encode(args[0]) + "?at=" + time(args[2]), null);
                }
                throw new CliException("lens get requires <label> [at <t>]");
            }
            case "drop" -> {
                expect(args, 1, "lens drop requires <label>");
                return new Call("DELETE", "/lenses/" + encode(args[0]), null);
            }
            default -> throw new CliException("unknown lens command: " + cmd);
        }
    }

    /** Send the call and return the response body; non-2xx responses become a {@link CliException}. */
    String execute(Call call) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl + call.path()));
        if (call.body() == null) {
            builder.method(call.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(call.method(), HttpRequest.BodyPublishers.ofString(call.body()));
        }

        HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new CliException(call.method() + " " + call.path() + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body();
    }

    /** Parse {@code value@from:until} into a delta JSON object; the value travels as a string. */
    static String deltaJson(String text) {
        int at = text.lastIndexOf('@');
        int colon = text.lastIndexOf(':');
        if (at <= 0 || colon < at) {
            throw new CliException("delta must look like <value>@<from>:<until>: " + text);
        }
        return "{\"value\":" + quote(text.substring(0, at))
                + ",\"validFromNs\":" + time(text.substring(at + 1, colon))
                + ",\"validUntilNs\":" + time(text.substring(colon + 1)) + "}";
    }

    private static String time(String s) {
        try {
            return Long.toString(Long.parseLong(s.trim()));
        } catch (NumberFormatException e) {
            throw new CliException("not a timestamp: " + s);
        }
    }

    private static void expect(String[] args, int count, String msg) {
        if (args.length != count) throw new CliException(msg);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    // Minimal JSON string escaping to avoid pulling in a JSON library.
    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }
}
