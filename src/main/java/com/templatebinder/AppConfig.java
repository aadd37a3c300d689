package com.templatebinder;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Startup configuration: template workspace, log file, HTTP port and dev mode.
 * Precedence is command line, then environment ({@code TEMPLATE_BINDER_WORKSPACE},
 * {@code TEMPLATE_BINDER_PORT}), then platform defaults.
 */
public class AppConfig {

    static final String APP_NAME = "Template-Binder";
    static final String ENV_WORKSPACE = "TEMPLATE_BINDER_WORKSPACE";
    static final String ENV_PORT = "TEMPLATE_BINDER_PORT";
    static final int DEFAULT_PORT = 8090;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    enum Platform {
        WINDOWS, MAC, LINUX;

        static Platform current() {
            return fromOsName(System.getProperty("os.name", ""));
        }

        static Platform fromOsName(String osName) {
            String os = osName.toLowerCase(Locale.ROOT);
            if (os.contains("win")) {
                return WINDOWS;
            } else if (os.contains("mac")) {
                return MAC;
            }
            return LINUX;
        }
    }

    /**
     * Where templates live when no workspace is given.
     * Windows: %USERPROFILE%\Documents\Template-Binder\templates
     * macOS: ~/Documents/Template-Binder/templates
     * Linux: ~/Template-Binder/templates
     */
    public static Path getDefaultWorkspacePath() {
        return defaultWorkspacePath(Platform.current(), System.getProperty("user.home"), System.getenv());
    }

    static Path defaultWorkspacePath(Platform platform, String userHome, Map<String, String> env) {
        switch (platform) {
            case WINDOWS:
                String profile = env.getOrDefault("USERPROFILE", userHome);
                return Paths.get(profile, "Documents", APP_NAME, "templates");
            case MAC:
                return Paths.get(userHome, "Documents", APP_NAME, "templates");
            default:
                return Paths.get(userHome, APP_NAME, "templates");
        }
    }

    /**
     * Windows: %APPDATA%\Template-Binder\logs
     * macOS: ~/Library/Logs/Template-Binder
     * Linux: ~/.local/share/Template-Binder/logs
     */
    public static Path getLogDirectory() {
        return logDirectory(Platform.current(), System.getProperty("user.home"), System.getenv());
    }

    static Path logDirectory(Platform platform, String userHome, Map<String, String> env) {
        switch (platform) {
            case WINDOWS:
                String appData = env.getOrDefault("APPDATA", Paths.get(userHome, "AppData", "Roaming").toString());
                return Paths.get(appData, APP_NAME, "logs");
            case MAC:
                return Paths.get(userHome, "Library", "Logs", APP_NAME);
            default:
                return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("template-binder.log");
    }

    /**
     * The preferred port when free, otherwise any free port; the preferred port again
     * when probing fails, so the server reports the bind error itself.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            AppLogger.get().warn("Could not probe for a free port: " + e.getMessage());
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path workspacePath;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode;

        public Builder workspacePath(String path) {
            if (path != null && !path.isBlank()) {
                this.workspacePath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Applies environment overrides; call before {@link #parseArgs} so flags win.
         */
        public Builder environment(Map<String, String> env) {
            workspacePath(env.get(ENV_WORKSPACE));
            String port = env.get(ENV_PORT);
            if (port != null && !port.isBlank()) {
                this.preferredPort = parsePort(port, ENV_PORT);
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg) && i + 1 < args.length) {
                    workspacePath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()), "--port");
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i], "--port");
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else {
                    AppLogger.get().warn("Ignoring unknown argument: " + arg);
                }
            }
            return this;
        }

        private int parsePort(String value, String source) {
            try {
                int port = Integer.parseInt(value.trim());
                if (port < 0 || port > 65535) {
                    throw new IllegalArgumentException(source + " out of range: " + value);
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(source + " is not a number: " + value, e);
            }
        }

        int getPreferredPort() {
            return preferredPort;
        }

        Path getWorkspacePath() {
            return workspacePath;
        }

        boolean isDevMode() {
            return devMode;
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            Files.createDirectories(workspace);
            Path logDir = getLogDirectory();
            Files.createDirectories(logDir);
            return new AppConfig(workspace, getLogFilePath(), findAvailablePort(preferredPort), devMode);
        }
    }
}
