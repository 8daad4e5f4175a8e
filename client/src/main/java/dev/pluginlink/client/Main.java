package dev.pluginlink.client;

import dev.pluginlink.client.token.FileTokenProvider;
import dev.pluginlink.client.token.StaticTokenProvider;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the example echo plugin against a host until the host disconnects or the process is
 * interrupted.
 */
public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        Arguments arguments;
        try {
            arguments = Arguments.parse(List.of(args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }
        if (arguments.help()) {
            printUsage();
            return;
        }

        MethodTable methods = MethodTable.fromService(new EchoService(arguments.name(), arguments.version()));
        try (PluginClient client = PluginConnector.connect(arguments.toOptions(), methods)) {
            Runtime.getRuntime().addShutdownHook(new Thread(client::shutdown, "plugin-shutdown"));
            LOGGER.info("Plugin {} serving methods {}", arguments.name(), methods.methodNames());
            client.serve();
        }
        LOGGER.info("Plugin {} stopped", arguments.name());
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar plugin-link-client.jar [options]\n" +
            "Options:\n" +
            "  --host <host>                  host to connect to (default localhost)\n" +
            "  --port <port>                  port to connect to (default 7071)\n" +
            "  --socket <path>                connect over this Unix domain socket instead of TCP\n" +
            "  --name <name>                  plugin name (default echo)\n" +
            "  --version <version>            plugin version (default v1)\n" +
            "  --token <token>                bearer token\n" +
            "  --token-file <path>            file holding the bearer token\n" +
            "  --max-concurrent-calls <n>     calls handled in parallel (default 16)");
    }

    /**
     * Parsed command line.
     */
    record Arguments(boolean help, String name, String version, String host, int port, Path socket,
                     String token, String tokenFile, int maxConcurrentCalls) {

        /**
         * @throws IllegalArgumentException naming the offending option
         */
        static Arguments parse(List<String> args) {
            boolean help = false;
            String name = "echo";
            String version = "v1";
            String host = "localhost";
            int port = 7071;
            Path socket = null;
            String token = null;
            String tokenFile = null;
            int maxConcurrentCalls = PluginDispatcher.DEFAULT_MAX_CONCURRENT_CALLS;

            for (int i = 0; i < args.size(); i++) {
                String flag = args.get(i);
                if (flag.equals("--help")) {
                    help = true;
                    continue;
                }
                if (i + 1 >= args.size()) {
                    throw new IllegalArgumentException("Missing value for " + flag);
                }
                String value = args.get(++i);
                switch (flag) {
                    case "--host" -> host = value;
                    case "--port" -> port = parseInt(flag, value);
                    case "--socket" -> socket = Path.of(value);
                    case "--name" -> name = value;
                    case "--version" -> version = value;
                    case "--token" -> token = value;
                    case "--token-file" -> tokenFile = value;
                    case "--max-concurrent-calls" -> maxConcurrentCalls = parseInt(flag, value);
                    default -> throw new IllegalArgumentException("Unknown option: " + flag);
                }
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid value for --port: " + port);
            }
            if (maxConcurrentCalls <= 0) {
                throw new IllegalArgumentException("Invalid value for --max-concurrent-calls: " + maxConcurrentCalls);
            }
            return new Arguments(help, name, version, host, port, socket, token, tokenFile, maxConcurrentCalls);
        }

        private static int parseInt(String flag, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value, e);
            }
        }

        ClientOptions toOptions() {
            ClientOptions.Builder options = ClientOptions.builder(name)
                .host(host)
                .port(port)
                .socketPath(socket)
                .version(version)
                .maxConcurrentCalls(maxConcurrentCalls);
            if (token != null) {
                options.tokenProvider(new StaticTokenProvider(token));
            } else if (tokenFile != null) {
                options.tokenProvider(new FileTokenProvider(Path.of(tokenFile)));
            }
            return options.build();
        }
    }
}
